package io.artifacttracker.client;

import io.artifacttracker.core.CancellationReason;
import io.artifacttracker.core.RequestContext;
import io.artifacttracker.http.spi.HttpClientAdapter;
import io.artifacttracker.http.spi.HttpClientException;
import io.artifacttracker.http.spi.HttpClientRequest;
import io.artifacttracker.http.spi.HttpClientResponse;
import io.artifacttracker.http.spi.HttpTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;
import java.util.function.Supplier;

/**
 * Runs one prepared exchange with retries.
 *
 * <p>Server errors (5xx) and transient transport failures are retried with exponential backoff
 * plus jitter, up to {@link RetryConfig#maxRetries()} times. Client errors (4xx) and any other
 * status are returned on the first attempt. Attempts are strictly sequential on the calling
 * thread; the backoff wait ends early when the {@link RequestContext} fires.
 */
final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    // 2^30 times any sane base delay is already far beyond a useful wait
    static final int MAX_BACKOFF_SHIFT = 30;

    // delay plus jitter must stay representable in nanoseconds
    static final long MAX_BACKOFF_MILLIS = Long.MAX_VALUE / 1_000_000L / 2;

    private static final List<String> TRANSIENT_MESSAGE_FRAGMENTS = List.of(
            "connection refused",
            "connection reset",
            "timeout",
            "temporary failure");

    private final HttpClientAdapter transport;
    private final Supplier<RetryConfig> config;
    private final LongUnaryOperator jitter;

    RetryExecutor(HttpClientAdapter transport, Supplier<RetryConfig> config) {
        this(transport, config, RetryExecutor::randomJitter);
    }

    /**
     * @param jitter given an exclusive bound {@code n > 0}, returns a value in {@code [0, n)}
     */
    RetryExecutor(HttpClientAdapter transport, Supplier<RetryConfig> config, LongUnaryOperator jitter) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    /**
     * Returns the first response that is not retried. The caller owns it and must close it.
     *
     * @throws HttpClientException a non-retryable transport failure, as reported by the adapter
     * @throws RetriesExhaustedException the last permitted attempt failed with a retryable transport error
     * @throws RequestCancelledException the context fired before an attempt or during a backoff wait
     */
    HttpClientResponse execute(HttpClientRequest request, RequestContext context)
            throws HttpClientException, RequestExecutionException, RequestCancelledException {
        RetryConfig cfg = config.get();
        if (cfg == null) {
            cfg = RetryConfig.defaults();
        }
        int maxRetries = cfg.maxRetries();

        int attempts = 0;
        int lastStatus = 0;
        Exception lastFailure = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (context.isDone()) {
                throw cancelled(context, attempts, lastStatus, lastFailure);
            }
            attempts++;

            HttpClientResponse response;
            try {
                response = transport.send(request, context);
            } catch (HttpClientException e) {
                if (context.isDone()) {
                    throw cancelled(context, attempts, lastStatus, e);
                }
                if (!isRetryable(e)) {
                    throw e;
                }
                if (attempt == maxRetries) {
                    if (maxRetries == 0) {
                        throw e;
                    }
                    throw new RetriesExhaustedException(attempts, e);
                }
                lastFailure = e;
                lastStatus = 0;
                awaitBackoff(request, context, cfg, attempt, e.getMessage(), attempts, lastStatus, lastFailure);
                continue;
            }

            int status = response.statusCode();
            if (!isRetryableStatus(status) || attempt == maxRetries) {
                return response;
            }
            closeQuietly(response);
            lastStatus = status;
            lastFailure = null;
            awaitBackoff(request, context, cfg, attempt, "server returned status " + status, attempts, lastStatus, null);
        }

        throw new RetriesExhaustedException(attempts, lastFailure);
    }

    private void awaitBackoff(HttpClientRequest request, RequestContext context, RetryConfig cfg, int attempt,
                              String reason, int attempts, int lastStatus, Exception lastFailure)
            throws RequestCancelledException {
        Duration delay = backoffDelay(cfg.retryDelayMillis(), attempt, jitter);
        if (log.isDebugEnabled()) {
            log.debug("Retrying {} (attempt {}/{}, backoff {} ms): {}",
                    request, attempts + 1, cfg.maxAttempts(), delay.toMillis(), reason);
        }
        boolean fired;
        try {
            fired = context.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            RequestCancelledException cancelled = cancelled(context, attempts, lastStatus, lastFailure);
            cancelled.addSuppressed(e);
            throw cancelled;
        }
        if (fired) {
            throw cancelled(context, attempts, lastStatus, lastFailure);
        }
    }

    private static RequestCancelledException cancelled(RequestContext context, int attempts, int lastStatus,
                                                       Exception lastFailure) {
        CancellationReason reason = context.reason().orElse(CancellationReason.CANCELLED);
        return new RequestCancelledException(attempts, reason, lastStatus, lastFailure);
    }

    /**
     * Delay before the retry that follows attempt {@code attempt} (0-based):
     * {@code base * 2^attempt} plus a jitter in {@code [0, half of that)}.
     */
    static Duration backoffDelay(long baseMillis, int attempt, LongUnaryOperator jitter) {
        if (baseMillis <= 0) {
            return Duration.ZERO;
        }
        long factor = 1L << Math.min(Math.max(attempt, 0), MAX_BACKOFF_SHIFT);
        long delay = baseMillis > MAX_BACKOFF_MILLIS / factor ? MAX_BACKOFF_MILLIS : baseMillis * factor;
        long half = delay / 2;
        long extra = half > 0 ? jitter.applyAsLong(half) : 0L;
        return Duration.ofMillis(delay + extra);
    }

    static boolean isRetryableStatus(int status) {
        return status >= 500 && status <= 599;
    }

    /**
     * Whether a transport failure is transient: a timeout or refused connection anywhere in the
     * cause chain, or a message that names one.
     */
    static boolean isRetryable(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException
                    || t instanceof java.net.http.HttpTimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof ConnectException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String fragment : TRANSIENT_MESSAGE_FRAGMENTS) {
                    if (lower.contains(fragment)) {
                        return true;
                    }
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static long randomJitter(long bound) {
        return ThreadLocalRandom.current().nextLong(bound);
    }

    private static void closeQuietly(HttpClientResponse response) {
        try {
            response.close();
        } catch (IOException e) {
            log.debug("Failed to close discarded response", e);
        }
    }
}
