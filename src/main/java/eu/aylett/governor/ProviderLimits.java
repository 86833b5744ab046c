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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Per-identity override of the default rates. A rate left null inherits the
 * global default from {@link RateLimitConfig}.
 *
 * @param requestsPerMinute
 *          request budget per minute, or null for the default
 * @param tokensPerMinute
 *          volume budget per minute, or null for the default
 */
public record ProviderLimits(@Nullable Integer requestsPerMinute, @Nullable Integer tokensPerMinute) {
  public ProviderLimits {
    checkArgument(requestsPerMinute == null || requestsPerMinute > 0, "requestsPerMinute must be positive");
    checkArgument(tokensPerMinute == null || tokensPerMinute > 0, "tokensPerMinute must be positive");
  }

  public static ProviderLimits of(int requestsPerMinute, int tokensPerMinute) {
    return new ProviderLimits(requestsPerMinute, tokensPerMinute);
  }

  public static ProviderLimits requestsOnly(int requestsPerMinute) {
    return new ProviderLimits(requestsPerMinute, null);
  }

  public static ProviderLimits tokensOnly(int tokensPerMinute) {
    return new ProviderLimits(null, tokensPerMinute);
  }
}
