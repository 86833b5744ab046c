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

/**
 * Thrown by {@link RateLimiter#checkAdmission(String, long)} when either of an
 * identity's budgets is exhausted.
 */
public class RateLimitExceededException extends AdmissionRejectedException {
  /**
   * Which budget ran out.
   */
  public enum Axis {
    REQUESTS, TOKENS,
  }

  /**
   * The budget that refused the call.
   */
  public final Axis axis;

  /**
   * @param identity
   *          the identity whose budget is exhausted
   * @param axis
   *          which budget is exhausted
   * @param retryAfterSeconds
   *          seconds until the bucket holds enough tokens again
   */
  public RateLimitExceededException(String identity, Axis axis, double retryAfterSeconds) {
    super(axis == Axis.REQUESTS ? "Request rate limit exceeded" : "Token rate limit exceeded", identity,
        retryAfterSeconds);
    this.axis = axis;
  }
}
