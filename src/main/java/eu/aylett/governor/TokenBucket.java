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
import org.jetbrains.annotations.Contract;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A token bucket with continuous refill.
 * <p>
 * The bucket starts full. Each operation first adds
 * {@code elapsedSeconds * refillRate} tokens, never exceeding the capacity.
 * {@link #consume(double)} never takes the level below zero; only
 * {@link #adjust(double)} can, which lets a caller that under-estimated a cost
 * borrow against future capacity.
 * </p>
 */
public final class TokenBucket {
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final double capacity;
  private final double refillRate;
  private final Ticker ticker;

  // guarded by this
  private double tokens;
  private long lastRefill;

  /**
   * @param capacity
   *          the maximum number of tokens the bucket holds
   * @param refillRate
   *          tokens added per second
   * @param ticker
   *          monotonic time source (mainly for testing)
   */
  public TokenBucket(double capacity, double refillRate, Ticker ticker) {
    checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    checkArgument(refillRate > 0, "refillRate must be positive: %s", refillRate);
    this.capacity = capacity;
    this.refillRate = refillRate;
    this.ticker = ticker;
    this.tokens = capacity;
    this.lastRefill = ticker.read();
  }

  public TokenBucket(double capacity, double refillRate) {
    this(capacity, refillRate, Ticker.systemTicker());
  }

  /**
   * Take {@code n} tokens if they're all available.
   *
   * @return true if the tokens were taken; false leaves the level untouched
   */
  public synchronized boolean consume(double n) {
    refill();
    if (tokens >= n) {
      tokens -= n;
      return true;
    }
    return false;
  }

  /**
   * Seconds until {@code n} tokens will be available, or zero if they already
   * are.
   */
  public synchronized double timeUntilAvailable(double n) {
    refill();
    if (tokens >= n) {
      return 0.0;
    }
    return (n - tokens) / refillRate;
  }

  /**
   * Add {@code delta} tokens, which may be negative. The level is not floored
   * at zero.
   */
  public synchronized void adjust(double delta) {
    refill();
    tokens = Math.min(capacity, tokens + delta);
  }

  /**
   * The current level after refill. Negative while the bucket is repaying a
   * debt from {@link #adjust(double)}.
   */
  public synchronized double available() {
    refill();
    return tokens;
  }

  @Contract(pure = true)
  public double capacity() {
    return capacity;
  }

  @Contract(pure = true)
  public double refillRate() {
    return refillRate;
  }

  private void refill() {
    var now = ticker.read();
    var elapsed = now - lastRefill;
    if (elapsed <= 0) {
      return;
    }
    tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * refillRate);
    lastRefill = now;
  }
}
