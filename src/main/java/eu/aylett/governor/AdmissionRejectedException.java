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
import java.util.Locale;

/**
 * Thrown when a call is refused before it reaches the upstream.
 * <p>
 * The rejection is recoverable: waiting {@link #retryAfterSeconds} should be
 * enough for the same call to be admitted, assuming nobody else uses the
 * capacity first.
 * </p>
 */
public abstract class AdmissionRejectedException extends RuntimeException {
  /**
   * The rate-limit identity or circuit-breaker key that refused the call.
   */
  public final String identity;
  /**
   * Seconds until the call could be admitted.
   */
  public final double retryAfterSeconds;

  protected AdmissionRejectedException(String message, String identity, double retryAfterSeconds) {
    super(message + " for " + identity + ". Try again in " + String.format(Locale.ROOT, "%.1f", retryAfterSeconds)
        + "s");
    this.identity = identity;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  /**
   * {@link #retryAfterSeconds}, rounded up to the next millisecond.
   */
  public Duration retryAfter() {
    return Duration.ofMillis((long) Math.ceil(retryAfterSeconds * 1000.0));
  }
}
