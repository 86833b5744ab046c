/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.governor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.InstantSource;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Stops calling an endpoint that keeps failing.
 * <p>
 * Each endpoint key counts consecutive failures. Reaching the threshold opens
 * the circuit, and {@link #checkAdmission(String)} rejects every call until the
 * cool-down has passed. Any success resets the count.
 * </p>
 * <p>
 * This is independent of the {@link RateLimiter}: the limiter protects the
 * upstream from us, the breaker protects us from the upstream.
 * </p>
 */
public class CircuitBreaker {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

  private final CircuitBreakerConfig config;
  private final InstantSource clock;
  private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

  /**
   * @param config
   *          threshold, cool-down and half-open behaviour
   * @param clock
   *          the time source used for cool-downs (mainly for testing)
   */
  public CircuitBreaker(CircuitBreakerConfig config, InstantSource clock) {
    this.config = config;
    this.clock = clock;
  }

  /**
   * A breaker with the default threshold (5) and cool-down (60s), using the
   * system clock.
   */
  public CircuitBreaker() {
    this(CircuitBreakerConfig.defaults(), Clock.systemUTC());
  }

  public CircuitBreakerConfig config() {
    return config;
  }

  /**
   * Pass if calls to {@code key} are currently allowed.
   *
   * @throws CircuitOpenException
   *           if the circuit is open, carrying the remaining cool-down
   */
  public void checkAdmission(String key) {
    entry(key).admit(key, clock.instant());
  }

  /**
   * Count a failure against {@code key}, opening its circuit if that reaches the
   * threshold.
   */
  public void recordFailure(String key) {
    entry(key).failure(key, clock.instant());
  }

  /**
   * Close {@code key}'s circuit and forget its failures.
   */
  public void recordSuccess(String key) {
    var entry = entries.get(key);
    if (entry != null) {
      entry.success(key);
    }
  }

  public CircuitState state(String key) {
    var entry = entries.get(key);
    return entry == null ? CircuitState.CLOSED : entry.state(clock.instant());
  }

  public int failureCount(String key) {
    var entry = entries.get(key);
    return entry == null ? 0 : entry.failureCount();
  }

  private Entry entry(String key) {
    return entries.computeIfAbsent(key, k -> new Entry());
  }

  private final class Entry {
    // guarded by this
    private int failureCount;
    private @Nullable Instant openUntil;
    // set while a single probe is outstanding; a probe that never reports is
    // abandoned after one cool-down
    private @Nullable Instant probeDeadline;

    synchronized void admit(String key, Instant now) {
      if (probeDeadline != null) {
        if (now.isBefore(probeDeadline)) {
          throw new CircuitOpenException(key, secondsBetween(now, probeDeadline));
        }
        log.info("Probe for {} never reported, admitting another", key);
        probeDeadline = now.plus(config.cooldown());
        return;
      }
      if (openUntil == null) {
        return;
      }
      if (now.isBefore(openUntil)) {
        throw new CircuitOpenException(key, secondsBetween(now, openUntil));
      }
      openUntil = null;
      if (config.halfOpenMode() == CircuitBreakerConfig.HalfOpenMode.SINGLE_PROBE) {
        log.info("Cool-down over for {}, admitting a probe", key);
        probeDeadline = now.plus(config.cooldown());
      } else {
        log.info("Cool-down over for {}, resetting", key);
        failureCount = 0;
      }
    }

    synchronized void failure(String key, Instant now) {
      failureCount++;
      if (probeDeadline != null) {
        probeDeadline = null;
        open(key, now);
      } else if (failureCount >= config.threshold()) {
        open(key, now);
      }
    }

    synchronized void success(String key) {
      if (openUntil != null || probeDeadline != null) {
        log.info("Circuit closed for {}", key);
      }
      failureCount = 0;
      openUntil = null;
      probeDeadline = null;
    }

    synchronized CircuitState state(Instant now) {
      if (probeDeadline != null) {
        return CircuitState.HALF_OPEN;
      }
      if (openUntil == null) {
        return CircuitState.CLOSED;
      }
      return now.isBefore(openUntil) ? CircuitState.OPEN : CircuitState.HALF_OPEN;
    }

    synchronized int failureCount() {
      return failureCount;
    }

    private void open(String key, Instant now) {
      var until = now.plus(config.cooldown());
      openUntil = until;
      log.warn("Circuit breaker opened for {} after {} failures, until {}", key, failureCount, until);
    }
  }

  private static double secondsBetween(Instant from, Instant to) {
    return from.until(to, ChronoUnit.NANOS) / 1_000_000_000.0;
  }
}
