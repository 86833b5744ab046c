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

import org.jetbrains.annotations.Contract;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How often, and how patiently, a transient failure is retried against the same
 * upstream before moving on.
 *
 * @param maxAttempts
 *          total tries per upstream, including the first
 * @param initialBackoff
 *          the wait after the first failure, and the shortest wait
 * @param maxBackoff
 *          the longest wait
 * @param multiplier
 *          growth factor between consecutive waits
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
  public RetryPolicy {
    checkArgument(maxAttempts > 0, "maxAttempts must be positive: %s", maxAttempts);
    checkArgument(!initialBackoff.isNegative(), "initialBackoff must not be negative: %s", initialBackoff);
    checkArgument(maxBackoff.compareTo(initialBackoff) >= 0, "maxBackoff must be at least initialBackoff");
    checkArgument(multiplier >= 1.0, "multiplier must be at least 1: %s", multiplier);
  }

  /**
   * Three tries, waiting 1s then 2s, never more than 10s.
   */
  public static RetryPolicy defaults() {
    return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
  }

  /**
   * A single try.
   */
  public static RetryPolicy noRetries() {
    return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
  }

  /**
   * The wait after the {@code failedTry}th try (counting from 1) has failed.
   */
  @Contract(pure = true)
  public Duration backoff(int failedTry) {
    checkArgument(failedTry > 0, "failedTry must be positive: %s", failedTry);
    var nanos = initialBackoff.toNanos() * Math.pow(multiplier, failedTry - 1);
    if (nanos >= maxBackoff.toNanos()) {
      return maxBackoff;
    }
    return Duration.ofNanos((long) nanos);
  }
}
