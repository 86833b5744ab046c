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

import java.util.OptionalLong;

/**
 * What an {@link UpstreamCall} returns.
 *
 * @param content
 *          the payload to hand back to the caller
 * @param unitsUsed
 *          the actual cost of the call as reported by the upstream, if it
 *          reported one; used to correct the pre-call estimate
 */
public record UpstreamReply<T>(T content, OptionalLong unitsUsed) {
  public static <T> UpstreamReply<T> metered(T content, long unitsUsed) {
    return new UpstreamReply<>(content, OptionalLong.of(unitsUsed));
  }

  /**
   * A reply with no usage report; the estimate stands.
   */
  public static <T> UpstreamReply<T> unmetered(T content) {
    return new UpstreamReply<>(content, OptionalLong.empty());
  }
}
