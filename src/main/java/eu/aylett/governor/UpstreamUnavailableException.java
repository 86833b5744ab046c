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
 * Recorded against an upstream that was skipped because it has no usable
 * credentials.
 */
public class UpstreamUnavailableException extends RuntimeException {
  public final Upstream upstream;

  public UpstreamUnavailableException(Upstream upstream) {
    super("No usable credentials for " + upstream);
    this.upstream = upstream;
  }
}
