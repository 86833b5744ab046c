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

/**
 * Admission control and fallback routing for the rate-limited, occasionally
 * unreliable upstreams an application talks to: LLM completion endpoints and
 * pooled database connections.
 * <p>
 * A {@link eu.aylett.governor.RateLimiter} keeps two token buckets per upstream
 * identity, one counting requests and one counting volume (LLM tokens). A
 * {@link eu.aylett.governor.CircuitBreaker} stops calls to an endpoint that has
 * failed repeatedly. The {@link eu.aylett.governor.ResilienceGovernor} puts both
 * in front of a call, retries transient failures with exponential backoff, and
 * reroutes to alternate upstreams when the primary can't serve the request.
 * </p>
 * <p>
 * All state is process-local. Nothing here blocks waiting for capacity: a
 * request that can't be admitted is rejected immediately with a hint of how
 * long to wait.
 * </p>
 */
@NullMarked
package eu.aylett.governor;

import org.jspecify.annotations.NullMarked;
