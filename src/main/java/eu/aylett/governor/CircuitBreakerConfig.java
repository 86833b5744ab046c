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

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How many failures open a circuit, how long it stays open, and what happens
 * once the cool-down is over.
 *
 * @param threshold
 *          consecutive failures that open the circuit
 * @param cooldown
 *          how long an open circuit rejects calls
 * @param halfOpenMode
 *          how calls are admitted once the cool-down has elapsed
 */
public record CircuitBreakerConfig(int threshold, Duration cooldown, HalfOpenMode halfOpenMode) {
  public static final int DEFAULT_THRESHOLD = 5;
  public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);

  /**
   * What an endpoint's circuit does when its cool-down runs out.
   */
  public enum HalfOpenMode {
    /**
     * Forget the failures and let everyone through. If the endpoint is still
     * down, it takes another {@code threshold} failures to open again, and
     * concurrent callers may all reach it in the meantime.
     */
    RESET_AND_RETRY,
    /**
     * Let exactly one caller through as a probe and keep rejecting the rest
     * until it reports back. A failed probe re-opens the circuit at once.
     */
    SINGLE_PROBE,
  }

  public CircuitBreakerConfig {
    checkArgument(threshold > 0, "threshold must be positive: %s", threshold);
    checkArgument(!cooldown.isNegative() && !cooldown.isZero(), "cooldown must be positive: %s", cooldown);
  }

  public static CircuitBreakerConfig defaults() {
    return new CircuitBreakerConfig(DEFAULT_THRESHOLD, DEFAULT_COOLDOWN, HalfOpenMode.RESET_AND_RETRY);
  }

  public CircuitBreakerConfig withHalfOpenMode(HalfOpenMode mode) {
    return new CircuitBreakerConfig(threshold, cooldown, mode);
  }
}
