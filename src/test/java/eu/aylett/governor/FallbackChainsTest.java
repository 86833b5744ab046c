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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

class FallbackChainsTest {

  @Test
  void tierMembersFallBackToTheRestOfTheTier() {
    var chains = FallbackChains.forTier(ProviderTier.MINI);

    assertThat(chains.alternatesFor("groq").stream().map(Upstream::identity).toList(),
        contains("openrouter", "openai", "ollama"));
    assertThat(chains.alternatesFor("openai").stream().map(Upstream::identity).toList(),
        contains("groq", "openrouter", "ollama"));
  }

  @Test
  void tierAlternatesKeepTheirModels() {
    var chains = FallbackChains.forTier(ProviderTier.SMART);
    assertThat(chains.alternatesFor("openrouter"), contains(Upstream.of("openai", "gpt-4o"),
        Upstream.of("groq", "llama-3.1-70b-versatile"), Upstream.of("anthropic", "claude-3-5-sonnet-20241022")));
    Assertions.assertEquals(Upstream.of("openrouter", "anthropic/claude-3.5-sonnet"), ProviderTier.SMART.primary());
  }

  @Test
  void unknownIdentityHasNoAlternates() {
    assertThat(FallbackChains.forTier(ProviderTier.REASONING).alternatesFor("groq"), empty());
    assertThat(FallbackChains.none().alternatesFor("openai"), empty());
  }

  @Test
  void copiesTheGivenTable() {
    var alternates = new ArrayList<>(List.of(Upstream.of("b")));
    var chains = FallbackChains.of(Map.of("a", alternates));

    alternates.add(Upstream.of("c"));

    assertThat(chains.alternatesFor("a"), contains(Upstream.of("b")));
  }
}
