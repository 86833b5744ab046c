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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static eu.aylett.governor.ErrorClassifier.Kind.PERMANENT;
import static eu.aylett.governor.ErrorClassifier.Kind.TRANSIENT;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

class ErrorClassifierTest {
  private final ErrorClassifier classifier = ErrorClassifier.DEFAULT;

  @Test
  void connectivityFailuresAreTransient() {
    assertThat(classifier.classify(new ConnectException("Connection refused")), equalTo(TRANSIENT));
    assertThat(classifier.classify(new SocketTimeoutException("Read timed out")), equalTo(TRANSIENT));
    assertThat(classifier.classify(new UncheckedIOException(new IOException("reset"))), equalTo(TRANSIENT));
    assertThat(classifier.classify(new TimeoutException()), equalTo(TRANSIENT));
    assertThat(classifier.classify(new TransientUpstreamException("503 overloaded")), equalTo(TRANSIENT));
  }

  @Test
  void wrappedConnectivityFailuresAreTransient() {
    var wrapped = new ExecutionException(new RuntimeException(new ConnectException("refused")));
    assertThat(classifier.classify(wrapped), equalTo(TRANSIENT));
  }

  @Test
  void everythingElseIsPermanent() {
    assertThat(classifier.classify(new IllegalArgumentException("bad prompt")), equalTo(PERMANENT));
    assertThat(classifier.classify(new PermanentUpstreamException("401 Unauthorized")), equalTo(PERMANENT));
    assertThat(classifier.classify(new NullPointerException()), equalTo(PERMANENT));
  }

  @Test
  void explicitPermanentWinsOverTransientCause() {
    var error = new PermanentUpstreamException("quota exhausted", new IOException("429"));
    assertThat(classifier.classify(error), equalTo(PERMANENT));
    var outer = new TransientUpstreamException("wrapped", error);
    assertThat(classifier.classify(outer), equalTo(PERMANENT));
  }
}
