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

import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RateLimiterTest {
  private final FakeTicker ticker = new FakeTicker();

  private RateLimiter limiter(int requestsPerMinute, int tokensPerMinute) {
    return new RateLimiter(
        RateLimitConfig.builder().requestsPerMinute(requestsPerMinute).tokensPerMinute(tokensPerMinute).build(),
        ticker);
  }

  @Test
  void admitsWithinBudget() {
    var limiter = limiter(100, 100_000);
    limiter.checkAdmission("openai", 1000);
    Assertions.assertEquals(new UsageStats(1, 1000), limiter.getUsageStats("openai"));
  }

  @Test
  void rejectsWhenRequestsExhausted() {
    var limiter = limiter(2, 100_000);
    limiter.checkAdmission("test_provider", 100);
    limiter.checkAdmission("test_provider", 100);

    var e = assertThrows(RateLimitExceededException.class, () -> limiter.checkAdmission("test_provider", 100));
    Assertions.assertEquals(RateLimitExceededException.Axis.REQUESTS, e.axis);
    Assertions.assertEquals("test_provider", e.identity);
    // 2 per minute refills one request every 30s
    assertThat(e.retryAfterSeconds, closeTo(30.0, 1e-6));
  }

  @Test
  void tokenRejectionRefundsTheRequest() {
    var limiter = limiter(10, 1000);

    var e = assertThrows(RateLimitExceededException.class, () -> limiter.checkAdmission("groq", 1500));

    Assertions.assertEquals(RateLimitExceededException.Axis.TOKENS, e.axis);
    assertThat(e.retryAfterSeconds, closeTo(30.0, 1e-6));
    Assertions.assertEquals(10.0, limiter.getRemainingCapacity("groq").requests());
    Assertions.assertEquals(UsageStats.NONE, limiter.getUsageStats("groq"));
  }

  @Test
  void appliesPerProviderLimits() {
    var limiter = new RateLimiter(RateLimitConfig.builder()
        .requestsPerMinute(10)
        .providerLimit("openai", ProviderLimits.of(5, 50_000))
        .providerLimit("groq", ProviderLimits.of(20, 100_000))
        .build(), ticker);

    for (var i = 0; i < 5; i++) {
      limiter.checkAdmission("openai", 100);
    }
    assertThrows(RateLimitExceededException.class, () -> limiter.checkAdmission("openai", 100));

    for (var i = 0; i < 20; i++) {
      limiter.checkAdmission("groq", 100);
    }
    assertThrows(RateLimitExceededException.class, () -> limiter.checkAdmission("groq", 100));
  }

  @Test
  void disabledLimiterAdmitsEverything() {
    var limiter = new RateLimiter(RateLimitConfig.builder().requestsPerMinute(1).enabled(false).build(), ticker);

    for (var i = 0; i < 100; i++) {
      limiter.checkAdmission("openai", 1_000_000);
    }
    limiter.recordActualUsage("openai", 5_000_000, 1_000_000);

    Assertions.assertEquals(UsageStats.NONE, limiter.getUsageStats("openai"));
  }

  @Test
  void tracksUsage() {
    var limiter = limiter(100, 100_000);
    limiter.checkAdmission("openai", 500);
    limiter.checkAdmission("openai", 300);
    limiter.checkAdmission("groq", 10);

    Assertions.assertEquals(new UsageStats(2, 800), limiter.getUsageStats("openai"));
    var all = limiter.getUsageStats();
    Assertions.assertEquals(2, all.size());
    Assertions.assertEquals(new UsageStats(1, 10), all.get("groq"));
  }

  @Test
  void unseenIdentityHasNoUsage() {
    var limiter = limiter(100, 100_000);
    Assertions.assertEquals(UsageStats.NONE, limiter.getUsageStats("nobody"));
    Assertions.assertTrue(limiter.getUsageStats().isEmpty());
  }

  @Test
  void overEstimateIsCreditedBack() {
    var limiter = limiter(100, 1000);
    limiter.checkAdmission("openai", 500);

    limiter.recordActualUsage("openai", 200, 500);

    // 500 never charged, plus 300 refunded
    var remaining = limiter.getRemainingCapacity("openai").tokens();
    assertThat(remaining, greaterThan(400.0));
    assertThat(remaining, closeTo(800.0, 1e-9));
  }

  @Test
  void underEstimateIsBorrowedFromFutureCapacity() {
    var limiter = limiter(100, 1000);
    limiter.checkAdmission("openai", 500);

    limiter.recordActualUsage("openai", 1200, 500);

    // 200 in debt, but never reported below zero
    Assertions.assertEquals(0.0, limiter.getRemainingCapacity("openai").tokens());
    var e = assertThrows(RateLimitExceededException.class, () -> limiter.checkAdmission("openai", 1));
    Assertions.assertEquals(RateLimitExceededException.Axis.TOKENS, e.axis);
    assertThat(e.retryAfterSeconds, closeTo(201 / (1000 / 60.0), 1e-6));
  }

  @Test
  void identitiesAreIsolated() {
    var limiter = limiter(2, 1000);
    limiter.checkAdmission("a", 1000);
    limiter.checkAdmission("a", 0);
    assertThrows(RateLimitExceededException.class, () -> limiter.checkAdmission("a", 0));

    var b = limiter.getRemainingCapacity("b");
    Assertions.assertEquals(2.0, b.requests());
    Assertions.assertEquals(1000.0, b.tokens());
    limiter.checkAdmission("b", 1000);
  }

  @Test
  void refillsOverTime() {
    var limiter = limiter(60, 100_000);
    for (var i = 0; i < 60; i++) {
      limiter.checkAdmission("openai", 1);
    }
    assertThrows(RateLimitExceededException.class, () -> limiter.checkAdmission("openai", 1));

    ticker.advance(1, TimeUnit.SECONDS);

    limiter.checkAdmission("openai", 1);
  }

  @Test
  void rejectsNegativeEstimate() {
    var limiter = limiter(10, 10);
    assertThrows(IllegalArgumentException.class, () -> limiter.checkAdmission("openai", -1));
  }

  @Test
  void concurrentFirstUseSharesOneBudget() throws Exception {
    var limiter = limiter(50, 1_000_000);
    var executor = Executors.newFixedThreadPool(8);
    try {
      Callable<Integer> task = () -> {
        var admitted = 0;
        for (var i = 0; i < 20; i++) {
          try {
            limiter.checkAdmission("shared", 10);
            admitted++;
          } catch (RateLimitExceededException e) {
            // expected once the budget is gone
          }
        }
        return admitted;
      };
      var futures = new ArrayList<Future<Integer>>();
      for (var i = 0; i < 8; i++) {
        futures.add(executor.submit(task));
      }
      var total = 0;
      for (var future : futures) {
        total += future.get();
      }
      Assertions.assertEquals(50, total);
      Assertions.assertEquals(new UsageStats(50, 500), limiter.getUsageStats("shared"));
    } finally {
      executor.shutdownNow();
    }
  }
}
