package com.notionexport.core.retry;

import com.notionexport.core.exception.RemoteApiException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff around remote API calls, backed by a Resilience4j {@link Retry}.
 *
 * <p>Only transient {@link RemoteApiException}s are retried (rate limits, server errors, and
 * failures without a status). Permanent failures and any other exception propagate on the
 * first attempt. The delay before retry {@code n} (zero-based) is
 * {@code baseDelay * multiplier^n}; once {@code maxAttempts} calls have failed the last
 * error is rethrown.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RetryPolicy retry = RetryPolicy.defaults();
 * RemoteDocument page = retry.execute("retrieve page " + id, () -> api.retrieveDocument(id));
 * }</pre>
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 6;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(600);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final RetryConfig config;

    public RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.maxAttempts = maxAttempts;
        this.backoff = IntervalFunction.ofExponentialBackoff(baseDelay, multiplier);
        this.config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(backoff)
            .retryOnException(RetryPolicy::isTransient)
            .build();
    }

    /**
     * Creates the standard policy: 6 attempts, 600 ms base delay, doubling.
     *
     * @return default policy
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MULTIPLIER);
    }

    /**
     * Runs the call, retrying transient failures.
     *
     * @param operation short description used in log messages
     * @param call remote call
     * @param <T> result type
     * @return call result
     * @throws RemoteApiException the permanent failure, or the last transient one
     */
    public <T> T execute(String operation, Supplier<T> call) {
        return Retry.decorateSupplier(newRetry(operation), call).get();
    }

    /**
     * Creates a retry instance named after the operation, with logging attached.
     *
     * @param operation short description used as the retry name
     * @return retry instance for a single call
     */
    Retry newRetry(String operation) {
        Retry retry = Retry.of(operation, config);
        retry.getEventPublisher()
            .onRetry(event -> log.warn("{} failed (attempt {}/{}): {}. Retrying in {} ms",
                event.getName(), event.getNumberOfRetryAttempts(), maxAttempts,
                describe(event.getLastThrowable()), event.getWaitInterval().toMillis()))
            .onError(event -> log.error("{} failed after {} attempts",
                event.getName(), event.getNumberOfRetryAttempts()));
        return retry;
    }

    /**
     * Returns the delay applied after the given failed attempt.
     *
     * @param attempt zero-based attempt index
     * @return backoff delay
     */
    Duration delayFor(int attempt) {
        return Duration.ofMillis(backoff.apply(attempt + 1));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof RemoteApiException remote && remote.isTransient();
    }

    private static String describe(Throwable error) {
        if (error instanceof RemoteApiException remote && remote.getStatus() != null) {
            return "status " + remote.getStatus() + ", " + remote.getMessage();
        }
        return String.valueOf(error.getMessage());
    }
}
