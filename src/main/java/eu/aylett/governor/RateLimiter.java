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

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Per-identity admission control on two axes: number of requests and volume
 * (for LLM providers, tokens).
 * <p>
 * Volume is charged up front from an estimate and reconciled later with
 * {@link #recordActualUsage(String, long, long)}. An under-estimated call isn't
 * failed after the fact; the difference is borrowed from the bucket, which then
 * admits less until it has refilled.
 * </p>
 * <p>
 * Buckets are created on first use and live as long as the limiter.
 * </p>
 */
public class RateLimiter {
  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
  private static final double SECONDS_PER_MINUTE = 60.0;

  private final RateLimitConfig config;
  private final Ticker ticker;
  private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

  /**
   * @param config
   *          limits to apply
   * @param ticker
   *          the time source used for refilling buckets (mainly for testing)
   */
  public RateLimiter(RateLimitConfig config, Ticker ticker) {
    this.config = config;
    this.ticker = ticker;
  }

  public RateLimiter(RateLimitConfig config) {
    this(config, Ticker.systemTicker());
  }

  /**
   * A limiter using {@link RateLimitConfig#defaults()}.
   */
  public RateLimiter() {
    this(RateLimitConfig.defaults());
  }

  public RateLimitConfig config() {
    return config;
  }

  /**
   * Charge one request and {@code estimatedUnits} of volume to
   * {@code identity}, or refuse.
   * <p>
   * Does nothing if rate limiting is disabled. When the volume budget refuses,
   * the request already taken is given back.
   * </p>
   *
   * @throws RateLimitExceededException
   *           if either budget can't cover the call
   */
  public void checkAdmission(String identity, long estimatedUnits) {
    checkArgument(estimatedUnits >= 0, "estimatedUnits must not be negative: %s", estimatedUnits);
    if (!config.enabled()) {
      return;
    }
    var entry = entry(identity);

    if (!entry.requests.consume(1)) {
      var wait = entry.requests.timeUntilAvailable(1);
      log.debug("Request budget exhausted for {}, available in {}s", identity, wait);
      throw new RateLimitExceededException(identity, RateLimitExceededException.Axis.REQUESTS, wait);
    }

    if (!entry.tokens.consume(estimatedUnits)) {
      var wait = entry.tokens.timeUntilAvailable(estimatedUnits);
      entry.requests.adjust(1);
      log.debug("Token budget exhausted for {} ({} requested), available in {}s", identity, estimatedUnits, wait);
      throw new RateLimitExceededException(identity, RateLimitExceededException.Axis.TOKENS, wait);
    }

    entry.requestsIssued.incrementAndGet();
    entry.tokensIssued.addAndGet(estimatedUnits);
  }

  /**
   * Correct an earlier estimate once the real cost is known. Spending more than
   * estimated debits the difference, spending less credits it back.
   */
  public void recordActualUsage(String identity, long actualUnits, long estimatedUnits) {
    if (!config.enabled()) {
      return;
    }
    var diff = actualUnits - estimatedUnits;
    if (diff != 0) {
      entry(identity).tokens.adjust(-diff);
    }
  }

  /**
   * Usage admitted so far for {@code identity}. An identity that has never been
   * seen has no usage; asking doesn't create its buckets.
   */
  public UsageStats getUsageStats(String identity) {
    var entry = entries.get(identity);
    return entry == null ? UsageStats.NONE : entry.stats();
  }

  /**
   * Usage for every identity seen so far.
   */
  public ImmutableMap<String, UsageStats> getUsageStats() {
    var builder = ImmutableMap.<String, UsageStats>builder();
    entries.forEach((identity, entry) -> builder.put(identity, entry.stats()));
    return builder.buildOrThrow();
  }

  public RemainingCapacity getRemainingCapacity(String identity) {
    var entry = entry(identity);
    return new RemainingCapacity(Math.max(0.0, entry.requests.available()), Math.max(0.0, entry.tokens.available()));
  }

  private Entry entry(String identity) {
    return entries.computeIfAbsent(identity, this::newEntry);
  }

  private Entry newEntry(String identity) {
    var rpm = config.requestsPerMinuteFor(identity);
    var tpm = config.tokensPerMinuteFor(identity);
    log.debug("Creating buckets for {}: {} requests/min, {} tokens/min", identity, rpm, tpm);
    return new Entry(new TokenBucket(rpm, rpm / SECONDS_PER_MINUTE, ticker),
        new TokenBucket(tpm, tpm / SECONDS_PER_MINUTE, ticker));
  }

  private static final class Entry {
    final TokenBucket requests;
    final TokenBucket tokens;
    final AtomicLong requestsIssued = new AtomicLong();
    final AtomicLong tokensIssued = new AtomicLong();

    Entry(TokenBucket requests, TokenBucket tokens) {
      this.requests = requests;
      this.tokens = tokens;
    }

    UsageStats stats() {
      return new UsageStats(requestsIssued.get(), tokensIssued.get());
    }
  }
}
