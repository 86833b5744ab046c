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
 * Something the governor can route a call to.
 *
 * @param identity
 *          the logical name rate limits are tracked against, such as a
 *          provider name
 * @param endpoint
 *          the key circuit-breaker state is tracked against, such as a model
 *          or a connection string
 */
public record Upstream(String identity, String endpoint) {
  public Upstream {
    checkArgument(!identity.isBlank(), "identity must not be blank");
    checkArgument(!endpoint.isBlank(), "endpoint must not be blank");
  }

  /**
   * An upstream whose endpoint is its identity.
   */
  public static Upstream of(String identity) {
    return new Upstream(identity, identity);
  }

  public static Upstream of(String identity, String endpoint) {
    return new Upstream(identity, endpoint);
  }

  /**
   * The key used for circuit-breaker state. Endpoints are qualified by identity
   * so two providers serving a model of the same name don't share a breaker.
   */
  public String circuitKey() {
    return identity.equals(endpoint) ? identity : identity + "/" + endpoint;
  }

  @Override
  public String toString() {
    return circuitKey();
  }
}
