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
 * A failure that retrying the same upstream won't fix: bad credentials, a
 * malformed request, an exhausted account quota.
 * <p>
 * Takes precedence over any transient cause further down the chain.
 * </p>
 */
public class PermanentUpstreamException extends RuntimeException {
  public PermanentUpstreamException(String message) {
    super(message);
  }

  public PermanentUpstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
