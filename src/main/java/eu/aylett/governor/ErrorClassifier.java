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

import com.google.common.base.Throwables;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Sorts upstream failures into those worth retrying in place and those that
 * aren't.
 */
@FunctionalInterface
public interface ErrorClassifier {
  enum Kind {
    TRANSIENT, PERMANENT,
  }

  /**
   * Connectivity problems and timeouts anywhere in the causal chain are
   * transient, unless something in the chain is explicitly a
   * {@link PermanentUpstreamException}. Everything else is permanent.
   */
  ErrorClassifier DEFAULT = error -> {
    var chain = Throwables.getCausalChain(error);
    if (chain.stream().anyMatch(PermanentUpstreamException.class::isInstance)) {
      return Kind.PERMANENT;
    }
    for (var cause : chain) {
      if (cause instanceof TransientUpstreamException || cause instanceof IOException
          || cause instanceof UncheckedIOException || cause instanceof TimeoutException) {
        return Kind.TRANSIENT;
      }
    }
    return Kind.PERMANENT;
  };

  Kind classify(Throwable error);
}
