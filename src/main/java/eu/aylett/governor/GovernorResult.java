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

/**
 * A successful governed call.
 *
 * @param content
 *          what the upstream returned
 * @param upstream
 *          the upstream that served the request
 * @param usedFallback
 *          true if that upstream wasn't the primary
 * @param attempts
 *          every upstream considered, ending with the one that succeeded
 */
public record GovernorResult<T>(T content, Upstream upstream, boolean usedFallback, ImmutableList<Attempt> attempts) {
  public String identityUsed() {
    return upstream.identity();
  }
}
