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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when neither the primary upstream nor any of its alternates could
 * serve a request.
 * <p>
 * Every attempt's error is attached as a suppressed exception; the last one is
 * also the cause.
 * </p>
 */
public class AllProvidersFailedException extends RuntimeException {
  /**
   * One entry per upstream considered, in the order they were tried.
   */
  public final ImmutableList<Attempt> attempts;

  public AllProvidersFailedException(List<Attempt> attempts) {
    super(describe(attempts), attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).error());
    this.attempts = ImmutableList.copyOf(attempts);
    for (var i = 0; i < attempts.size() - 1; i++) {
      var error = attempts.get(i).error();
      if (error != null) {
        addSuppressed(error);
      }
    }
  }

  private static String describe(List<Attempt> attempts) {
    if (attempts.isEmpty()) {
      return "All providers failed (no upstream attempted)";
    }
    return attempts.stream()
        .map(a -> a.upstream().identity() + ": " + a.outcome() + " (" + a.describeError() + ")")
        .collect(Collectors.joining("; ", "All providers failed: ", ""));
  }
}
