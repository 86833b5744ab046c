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

import com.google.common.testing.FakeTicker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

class TaskRouterTest {
  private static TaskRouter withKeys(String... variables) {
    var env = new HashMap<String, String>();
    for (var variable : variables) {
      env.put(variable, "sk-test");
    }
    return new TaskRouter(CredentialAvailability.llmProviders(Map.copyOf(env)::get));
  }

  @Test
  void tasksMapToTiers() {
    Assertions.assertEquals(ProviderTier.MINI, TaskType.INTENT_CLASSIFICATION.tier());
    Assertions.assertEquals(ProviderTier.SMART, TaskType.SQL_GENERATION.tier());
    Assertions.assertEquals(ProviderTier.REASONING, TaskType.ARCHITECTURAL.tier());
    Assertions.assertEquals(ProviderTier.MINI, TaskType.GENERAL.tier());
  }

  @Test
  void picksBestAvailableInTheTasksTier() {
    var router = withKeys("OPENAI_API_KEY", "ANTHROPIC_API_KEY");

    Assertions.assertEquals(Upstream.of("openai", "gpt-4o"), router.primaryFor(TaskType.QUERY_OPTIMIZATION));
    assertThat(router.alternatesFor(TaskType.QUERY_OPTIMIZATION),
        contains(Upstream.of("anthropic", "claude-3-5-sonnet-20241022")));
  }

  @Test
  void keylessLocalModelServesCheapTasks() {
    var router = withKeys();

    Assertions.assertEquals(Upstream.of("ollama", "llama3.1"), router.primaryFor(TaskType.SUMMARIZATION));
    assertThat(router.alternatesFor(TaskType.SUMMARIZATION), empty());
  }

  @Test
  void fallsBackToCheapestTierWithAnythingAvailable() {
    var router = withKeys("GROQ_API_KEY");

    // Nothing in the reasoning tier has a key; groq's small model leads the mini tier
    Assertions.assertEquals(Upstream.of("groq", "llama-3.1-8b-instant"), router.primaryFor(TaskType.REASONING));
    assertThat(router.alternatesFor(TaskType.REASONING), empty());
  }

  @Test
  void lastResortWhenNothingIsAvailable() {
    var router = new TaskRouter(upstream -> false);

    Assertions.assertEquals(TaskRouter.LAST_RESORT, router.primaryFor(TaskType.SCHEMA_ANALYSIS));
    Assertions.assertEquals("openrouter", router.primaryFor(TaskType.GENERAL).identity());
  }

  @Test
  void executesThroughTheTier() {
    var availability = CredentialAvailability.llmProviders(
        Map.of("OPENAI_API_KEY", "sk-test", "ANTHROPIC_API_KEY", "sk-test")::get);
    var router = new TaskRouter(availability);
    var governor = new ResilienceGovernor(new RateLimiter(RateLimitConfig.defaults(), new FakeTicker()),
        new CircuitBreaker(CircuitBreakerConfig.defaults(),
            Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneId.of("UTC"))),
        FallbackChains.none(), availability, RetryPolicy.noRetries(), ErrorClassifier.DEFAULT, duration -> {
        });

    var result = router.execute(governor, TaskType.SQL_GENERATION, CostEstimator.fixed(100), upstream -> {
      if (upstream.identity().equals("openai")) {
        throw new PermanentUpstreamException("model not found");
      }
      return UpstreamReply.unmetered("SELECT 1 from " + upstream.identity());
    });

    Assertions.assertEquals("anthropic", result.identityUsed());
    Assertions.assertTrue(result.usedFallback());
    Assertions.assertEquals(Attempt.Outcome.PERMANENT_FAILURE, result.attempts().get(0).outcome());
  }
}
