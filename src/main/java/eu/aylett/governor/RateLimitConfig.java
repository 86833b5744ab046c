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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Rate limits shared by every identity, plus per-identity overrides.
 * <p>
 * Immutable; a single instance can back any number of {@link RateLimiter}s.
 * </p>
 */
public final class RateLimitConfig {
  public static final int DEFAULT_REQUESTS_PER_MINUTE = 20;
  public static final int DEFAULT_TOKENS_PER_MINUTE = 100_000;

  private final int requestsPerMinute;
  private final int tokensPerMinute;
  private final boolean enabled;
  private final ImmutableMap<String, ProviderLimits> providerLimits;

  private RateLimitConfig(Builder builder) {
    this.requestsPerMinute = builder.requestsPerMinute;
    this.tokensPerMinute = builder.tokensPerMinute;
    this.enabled = builder.enabled;
    this.providerLimits = builder.providerLimits.buildKeepingLast();
  }

  /**
   * Global defaults with the published limits of the LLM providers we know
   * about. Ollama runs locally, so it's effectively unlimited.
   */
  public static RateLimitConfig defaults() {
    return builder()
        .providerLimit("openai", ProviderLimits.of(60, 150_000))
        .providerLimit("groq", ProviderLimits.of(30, 100_000))
        .providerLimit("openrouter", ProviderLimits.of(100, 200_000))
        .providerLimit("anthropic", ProviderLimits.of(50, 100_000))
        .providerLimit("ollama", ProviderLimits.of(1000, 10_000_000))
        .build();
  }

  /**
   * A builder with no per-identity overrides.
   */
  public static Builder builder() {
    return new Builder();
  }

  public int requestsPerMinute() {
    return requestsPerMinute;
  }

  public int tokensPerMinute() {
    return tokensPerMinute;
  }

  public boolean enabled() {
    return enabled;
  }

  public ImmutableMap<String, ProviderLimits> providerLimits() {
    return providerLimits;
  }

  /**
   * Requests per minute for {@code identity}, from its override if it has one.
   */
  public int requestsPerMinuteFor(String identity) {
    var limits = providerLimits.get(identity);
    if (limits == null || limits.requestsPerMinute() == null) {
      return requestsPerMinute;
    }
    return limits.requestsPerMinute();
  }

  /**
   * Tokens per minute for {@code identity}, from its override if it has one.
   */
  public int tokensPerMinuteFor(String identity) {
    var limits = providerLimits.get(identity);
    if (limits == null || limits.tokensPerMinute() == null) {
      return tokensPerMinute;
    }
    return limits.tokensPerMinute();
  }

  @Override
  public String toString() {
    return "RateLimitConfig{requestsPerMinute=" + requestsPerMinute + ", tokensPerMinute=" + tokensPerMinute
        + ", enabled=" + enabled + ", providerLimits=" + providerLimits + '}';
  }

  public static final class Builder {
    private int requestsPerMinute = DEFAULT_REQUESTS_PER_MINUTE;
    private int tokensPerMinute = DEFAULT_TOKENS_PER_MINUTE;
    private boolean enabled = true;
    private final ImmutableMap.Builder<String, ProviderLimits> providerLimits = ImmutableMap.builder();

    private Builder() {
    }

    public Builder requestsPerMinute(int requestsPerMinute) {
      checkArgument(requestsPerMinute > 0, "requestsPerMinute must be positive: %s", requestsPerMinute);
      this.requestsPerMinute = requestsPerMinute;
      return this;
    }

    public Builder tokensPerMinute(int tokensPerMinute) {
      checkArgument(tokensPerMinute > 0, "tokensPerMinute must be positive: %s", tokensPerMinute);
      this.tokensPerMinute = tokensPerMinute;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder providerLimit(String identity, ProviderLimits limits) {
      providerLimits.put(identity, limits);
      return this;
    }

    public Builder providerLimits(Map<String, ProviderLimits> limits) {
      providerLimits.putAll(limits);
      return this;
    }

    public RateLimitConfig build() {
      return new RateLimitConfig(this);
    }
  }
}
