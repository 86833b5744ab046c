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
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Runs a call against an upstream, with admission control, local retries and
 * fallback to alternate upstreams.
 * <p>
 * For each upstream, primary first and then its alternates in order:
 * </p>
 * <ol>
 * <li>skip it if it has no usable credentials;</li>
 * <li>ask the {@link RateLimiter} and then the {@link CircuitBreaker} to admit
 * the call, moving on at once if either refuses;</li>
 * <li>make the call, outside any lock;</li>
 * <li>on a transient failure, back off and go round again, up to the retry
 * policy's limit; on anything else, move on.</li>
 * </ol>
 * <p>
 * Callers only ever see a {@link GovernorResult} or an
 * {@link AllProvidersFailedException} describing every upstream tried.
 * </p>
 */
public class ResilienceGovernor {
  private static final Logger log = LoggerFactory.getLogger(ResilienceGovernor.class);

  private final RateLimiter rateLimiter;
  private final CircuitBreaker circuitBreaker;
  private final FallbackChains fallbackChains;
  private final UpstreamAvailability availability;
  private final RetryPolicy retryPolicy;
  private final ErrorClassifier classifier;
  private final Sleeper sleeper;

  /**
   * A fully configurable governor.
   * <p>
   * You probably don't need to call this constructor directly.
   * </p>
   *
   * @param rateLimiter
   *          admission control per upstream identity
   * @param circuitBreaker
   *          failure tracking per upstream endpoint
   * @param fallbackChains
   *          alternates used by {@link #execute(Upstream, CostEstimator, UpstreamCall)}
   * @param availability
   *          decides which upstreams have usable credentials
   * @param retryPolicy
   *          how transient failures are retried in place
   * @param classifier
   *          sorts failures into transient and permanent
   * @param sleeper
   *          waits out retry backoff (mainly for testing)
   */
  public ResilienceGovernor(RateLimiter rateLimiter, CircuitBreaker circuitBreaker, FallbackChains fallbackChains,
      UpstreamAvailability availability, RetryPolicy retryPolicy, ErrorClassifier classifier, Sleeper sleeper) {
    this.rateLimiter = rateLimiter;
    this.circuitBreaker = circuitBreaker;
    this.fallbackChains = fallbackChains;
    this.availability = availability;
    this.retryPolicy = retryPolicy;
    this.classifier = classifier;
    this.sleeper = sleeper;
  }

  /**
   * Governor with the default retry policy and error classification, sleeping
   * the calling thread between retries.
   */
  public ResilienceGovernor(RateLimiter rateLimiter, CircuitBreaker circuitBreaker, FallbackChains fallbackChains,
      UpstreamAvailability availability) {
    this(rateLimiter, circuitBreaker, fallbackChains, availability, RetryPolicy.defaults(), ErrorClassifier.DEFAULT,
        Sleeper.THREAD);
  }

  public RateLimiter rateLimiter() {
    return rateLimiter;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  /**
   * Run {@code call} against {@code primary}, falling back to the alternates
   * configured for its identity.
   *
   * @throws AllProvidersFailedException
   *           if no upstream could serve the call
   */
  public <T> GovernorResult<T> execute(Upstream primary, CostEstimator estimator, UpstreamCall<T> call) {
    return execute(primary, fallbackChains.alternatesFor(primary.identity()), estimator, call);
  }

  /**
   * Run {@code call} against {@code primary}, falling back to
   * {@code alternates} in order.
   * <p>
   * If {@code estimator} throws or returns a negative estimate for an upstream,
   * that upstream fails permanently without being called and the next one is
   * tried.
   * </p>
   *
   * @throws AllProvidersFailedException
   *           if no upstream could serve the call
   */
  public <T> GovernorResult<T> execute(Upstream primary, List<Upstream> alternates, CostEstimator estimator,
      UpstreamCall<T> call) {
    var candidates = ImmutableList.<Upstream>builder().add(primary).addAll(alternates).build();
    var attempts = new ArrayList<Attempt>(candidates.size());

    for (var i = 0; i < candidates.size(); i++) {
      var upstream = candidates.get(i);
      var fallback = i > 0;
      var tried = attempt(upstream, fallback, estimator, call);
      attempts.add(tried.attempt);

      if (tried.reply != null) {
        if (fallback) {
          log.info("Served by fallback {} after {}", upstream, attempts.subList(0, attempts.size() - 1));
        }
        return new GovernorResult<>(tried.reply.content(), upstream, fallback, ImmutableList.copyOf(attempts));
      }
      if (tried.attempt.outcome() == Attempt.Outcome.INTERRUPTED) {
        break;
      }
      log.debug("{} could not serve the request: {}", upstream, tried.attempt.describeError());
    }

    var failure = new AllProvidersFailedException(attempts);
    log.warn(failure.getMessage());
    throw failure;
  }

  private <T> Tried<T> attempt(Upstream upstream, boolean fallback, CostEstimator estimator, UpstreamCall<T> call) {
    if (!availability.isAvailable(upstream)) {
      return failed(upstream, Attempt.Outcome.UNAVAILABLE, new UpstreamUnavailableException(upstream), 0, fallback);
    }

    var identity = upstream.identity();
    var key = upstream.circuitKey();
    long estimate;
    try {
      estimate = estimator.estimate(upstream);
    } catch (RuntimeException e) {
      return failed(upstream, Attempt.Outcome.PERMANENT_FAILURE, e, 0, fallback);
    }
    if (estimate < 0) {
      return failed(upstream, Attempt.Outcome.PERMANENT_FAILURE,
          new IllegalArgumentException("Negative cost estimate for " + upstream + ": " + estimate), 0, fallback);
    }
    var tries = 0;
    // the upstream failure that sent us round again, kept so a rejected retry
    // still reports it
    @Nullable Exception lastFailure = null;

    while (true) {
      try {
        rateLimiter.checkAdmission(identity, estimate);
      } catch (RateLimitExceededException e) {
        return rejected(upstream, Attempt.Outcome.RATE_LIMITED, e, lastFailure, tries, fallback);
      }
      try {
        circuitBreaker.checkAdmission(key);
      } catch (CircuitOpenException e) {
        return rejected(upstream, Attempt.Outcome.CIRCUIT_OPEN, e, lastFailure, tries, fallback);
      }

      tries++;
      UpstreamReply<T> reply;
      try {
        reply = requireNonNull(call.call(upstream), "upstream call returned null");
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return failed(upstream, Attempt.Outcome.INTERRUPTED, e, tries, fallback);
      } catch (Exception e) {
        circuitBreaker.recordFailure(key);
        if (classifier.classify(e) == ErrorClassifier.Kind.PERMANENT) {
          return failed(upstream, Attempt.Outcome.PERMANENT_FAILURE, e, tries, fallback);
        }
        if (tries >= retryPolicy.maxAttempts()) {
          return failed(upstream, Attempt.Outcome.TRANSIENT_FAILURE, e, tries, fallback);
        }
        if (circuitBreaker.state(key) == CircuitState.OPEN) {
          log.debug("Circuit for {} opened on try {}, not retrying", upstream, tries);
          return failed(upstream, Attempt.Outcome.TRANSIENT_FAILURE, e, tries, fallback);
        }
        var backoff = retryPolicy.backoff(tries);
        log.debug("Transient failure from {} on try {}, retrying in {}", upstream, tries, backoff, e);
        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          interrupted.addSuppressed(e);
          return failed(upstream, Attempt.Outcome.INTERRUPTED, interrupted, tries, fallback);
        }
        lastFailure = e;
        continue;
      }

      reply.unitsUsed().ifPresent(actual -> rateLimiter.recordActualUsage(identity, actual, estimate));
      circuitBreaker.recordSuccess(key);
      return new Tried<>(new Attempt(upstream, Attempt.Outcome.SUCCEEDED, null, tries, fallback), reply);
    }
  }

  private static <T> Tried<T> failed(Upstream upstream, Attempt.Outcome outcome, Throwable error, int tries,
      boolean fallback) {
    return new Tried<>(new Attempt(upstream, outcome, error, tries, fallback), null);
  }

  private static <T> Tried<T> rejected(Upstream upstream, Attempt.Outcome outcome, AdmissionRejectedException rejection,
      @Nullable Exception lastFailure, int tries, boolean fallback) {
    if (lastFailure != null) {
      rejection.addSuppressed(lastFailure);
    }
    return failed(upstream, outcome, rejection, tries, fallback);
  }

  private record Tried<T>(Attempt attempt, @Nullable UpstreamReply<T> reply) {
  }
}
