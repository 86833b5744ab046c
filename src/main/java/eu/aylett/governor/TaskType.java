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
 * Kinds of LLM work, each served by a {@link ProviderTier}.
 */
public enum TaskType {
  INTENT_CLASSIFICATION(ProviderTier.MINI),
  SIMPLE_EXTRACTION(ProviderTier.MINI),
  SUMMARIZATION(ProviderTier.MINI),
  SQL_GENERATION(ProviderTier.SMART),
  QUERY_OPTIMIZATION(ProviderTier.SMART),
  SCHEMA_ANALYSIS(ProviderTier.SMART),
  ARCHITECTURAL(ProviderTier.REASONING),
  REASONING(ProviderTier.REASONING),
  /**
   * Anything unclassified goes to the cheap tier.
   */
  GENERAL(ProviderTier.MINI);

  private final ProviderTier tier;

  TaskType(ProviderTier tier) {
    this.tier = tier;
  }

  public ProviderTier tier() {
    return tier;
  }
}
