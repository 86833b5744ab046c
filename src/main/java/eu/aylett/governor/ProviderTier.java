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

import com.google.common.collect.ImmutableList;

/**
 * Groups of interchangeable LLM upstreams, best first. Each endpoint is a model
 * name.
 */
public enum ProviderTier {
  /**
   * Fast, cheap models for classification, extraction and summaries.
   */
  MINI(ImmutableList.of(
      Upstream.of("groq", "llama-3.1-8b-instant"),
      Upstream.of("openrouter", "meta-llama/llama-3.1-8b-instruct:free"),
      Upstream.of("openai", "gpt-4o-mini"),
      Upstream.of("ollama", "llama3.1"))),
  /**
   * Capable models for SQL generation, query optimisation and schema analysis.
   */
  SMART(ImmutableList.of(
      Upstream.of("openrouter", "anthropic/claude-3.5-sonnet"),
      Upstream.of("openai", "gpt-4o"),
      Upstream.of("groq", "llama-3.1-70b-versatile"),
      Upstream.of("anthropic", "claude-3-5-sonnet-20241022"))),
  /**
   * Reasoning specialists, used to review other models' output.
   */
  REASONING(ImmutableList.of(
      Upstream.of("openai", "o1-mini"),
      Upstream.of("openrouter", "anthropic/claude-3.5-sonnet"),
      Upstream.of("deepseek", "deepseek-chat")));

  private final ImmutableList<Upstream> upstreams;

  ProviderTier(ImmutableList<Upstream> upstreams) {
    this.upstreams = upstreams;
  }

  public ImmutableList<Upstream> upstreams() {
    return upstreams;
  }

  /**
   * The preferred upstream in this tier.
   */
  public Upstream primary() {
    return upstreams.get(0);
  }
}
