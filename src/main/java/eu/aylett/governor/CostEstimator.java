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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Estimates, before a call is made, how many volume units it will use.
 * <p>
 * The estimate is charged against the identity's token bucket at admission and
 * corrected afterwards if the upstream reports the actual figure.
 * </p>
 */
@FunctionalInterface
public interface CostEstimator {
  long DEFAULT_ESTIMATE = 1000;

  long estimate(Upstream upstream);

  static CostEstimator fixed(long units) {
    checkArgument(units >= 0, "units must not be negative: %s", units);
    return upstream -> units;
  }

  /**
   * Roughly four characters per token for English prompts, plus the number of
   * tokens we expect to get back.
   */
  static CostEstimator fromPromptLength(CharSequence prompt, long expectedCompletion) {
    checkArgument(expectedCompletion >= 0, "expectedCompletion must not be negative: %s", expectedCompletion);
    var promptTokens = (prompt.length() + 3) / 4;
    return upstream -> promptTokens + expectedCompletion;
  }
}
