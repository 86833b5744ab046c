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
 * Decides whether an upstream is worth trying at all. Upstreams that aren't
 * available are skipped without touching their rate limits or circuits.
 */
@FunctionalInterface
public interface UpstreamAvailability {
  boolean isAvailable(Upstream upstream);

  static UpstreamAvailability always() {
    return upstream -> true;
  }
}
