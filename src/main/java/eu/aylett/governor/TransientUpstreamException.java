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
 * A failure that is likely to go away if the same call is retried: a dropped
 * connection, a timeout, an overloaded server.
 * <p>
 * Throw this from an {@link UpstreamCall} to have the governor retry in place
 * regardless of what the underlying cause looks like.
 * </p>
 */
public class TransientUpstreamException extends RuntimeException {
  public TransientUpstreamException(String message) {
    super(message);
  }

  public TransientUpstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
