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
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Where to go, in order, when an upstream identity can't serve a request.
 * Immutable.
 */
public final class FallbackChains {
  private static final FallbackChains NONE = new FallbackChains(ImmutableMap.of());

  private final ImmutableMap<String, ImmutableList<Upstream>> chains;

  private FallbackChains(ImmutableMap<String, ImmutableList<Upstream>> chains) {
    this.chains = chains;
  }

  /**
   * No fallbacks for anyone.
   */
  public static FallbackChains none() {
    return NONE;
  }

  public static FallbackChains of(Map<String, ? extends List<Upstream>> chains) {
    var builder = ImmutableMap.<String, ImmutableList<Upstream>>builder();
    chains.forEach((identity, alternates) -> builder.put(identity, ImmutableList.copyOf(alternates)));
    return new FallbackChains(builder.buildOrThrow());
  }

  /**
   * Each upstream in {@code tier} falls back to the others, in tier order.
   */
  public static FallbackChains forTier(ProviderTier tier) {
    var upstreams = tier.upstreams();
    var builder = ImmutableMap.<String, ImmutableList<Upstream>>builder();
    for (var primary : upstreams) {
      builder.put(primary.identity(), upstreams.stream()
          .filter(u -> !u.identity().equals(primary.identity()))
          .collect(ImmutableList.toImmutableList()));
    }
    return new FallbackChains(builder.buildKeepingLast());
  }

  /**
   * Alternates for {@code identity}, best first; empty if it has none.
   */
  public ImmutableList<Upstream> alternatesFor(String identity) {
    return chains.getOrDefault(identity, ImmutableList.of());
  }

  @Override
  public String toString() {
    return "FallbackChains" + chains;
  }
}
