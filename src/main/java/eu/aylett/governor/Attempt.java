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

import org.jspecify.annotations.Nullable;

/**
 * What happened when the governor tried one upstream.
 *
 * @param upstream
 *          the upstream tried
 * @param outcome
 *          how it ended
 * @param error
 *          the last error seen, or null on success
 * @param tries
 *          how many times the call was actually invoked; zero if it was never
 *          admitted
 * @param fallback
 *          whether this upstream was an alternate rather than the primary
 */
public record Attempt(Upstream upstream, Outcome outcome, @Nullable Throwable error, int tries, boolean fallback) {

  public enum Outcome {
    SUCCEEDED, UNAVAILABLE, RATE_LIMITED, CIRCUIT_OPEN, TRANSIENT_FAILURE, PERMANENT_FAILURE, INTERRUPTED,
  }

  public boolean succeeded() {
    return outcome == Outcome.SUCCEEDED;
  }

  String describeError() {
    if (error == null) {
      return "ok";
    }
    var message = error.getMessage();
    return message == null ? error.getClass().getSimpleName() : message;
  }
}
