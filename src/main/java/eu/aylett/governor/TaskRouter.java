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
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks upstreams for a {@link TaskType}.
 * <p>
 * The primary is the best available upstream in the task's tier. If that tier
 * has nothing available we take the best available upstream of any tier,
 * cheapest tier first, and failing that the free OpenRouter model.
 * Availability is checked on every call, so credentials added later are seen.
 * </p>
 */
public final class TaskRouter {
  private static final Logger log = LoggerFactory.getLogger(TaskRouter.class);

  /**
   * Used when no tier has anything available.
   */
  public static final Upstream LAST_RESORT = Upstream.of("openrouter", "meta-llama/llama-3.1-8b-instruct:free");

  private final UpstreamAvailability availability;

  public TaskRouter(UpstreamAvailability availability) {
    this.availability = availability;
  }

  public Upstream primaryFor(TaskType task) {
    var preferred = firstAvailable(task.tier());
    if (preferred != null) {
      return preferred;
    }
    for (var tier : ProviderTier.values()) {
      var any = firstAvailable(tier);
      if (any != null) {
        log.debug("Nothing available in {} for {}, using {} from {}", task.tier(), task, any, tier);
        return any;
      }
    }
    log.warn("No upstream available for {}, falling back to {}", task, LAST_RESORT);
    return LAST_RESORT;
  }

  /**
   * The other available upstreams in the task's tier, in tier order, for use
   * as alternates after {@link #primaryFor(TaskType)}.
   */
  public ImmutableList<Upstream> alternatesFor(TaskType task) {
    var primary = primaryFor(task);
    return task.tier().upstreams().stream()
        .filter(u -> !u.equals(primary))
        .filter(availability::isAvailable)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Runs {@code call} for {@code task} through {@code governor}, starting at the
   * task's primary and falling back through the rest of its tier.
   */
  public <T> GovernorResult<T> execute(ResilienceGovernor governor, TaskType task, CostEstimator estimator,
      UpstreamCall<T> call) {
    return governor.execute(primaryFor(task), alternatesFor(task), estimator, call);
  }

  private @Nullable Upstream firstAvailable(ProviderTier tier) {
    for (var upstream : tier.upstreams()) {
      if (availability.isAvailable(upstream)) {
        return upstream;
      }
    }
    return null;
  }
}
