package io.artifacttracker.core;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellation and deadline signal for one logical operation.
 *
 * <p>A context fires at most once, either because {@link #cancel()} was called or because its
 * deadline passed. Once fired it stays fired. Blocking points (the transport exchange and the
 * backoff wait between retries) observe the context and return promptly after it fires.
 *
 * <p>Instances are thread-safe: one thread may run the operation while another cancels it.
 *
 * <pre>{@code
 * RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(10));
 * List<Defect> defects = client.defects().query(ctx, Map.of("FormattedID", "DE42"));
 * }</pre>
 */
public final class RequestContext {

    private final Instant deadline;
    private final CompletableFuture<CancellationReason> done = new CompletableFuture<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private RequestContext(Instant deadline) {
        this.deadline = deadline;
        done.thenRun(this::notifyListeners);
        if (deadline != null) {
            long remaining = saturatedNanos(Duration.between(Instant.now(), deadline));
            done.completeOnTimeout(CancellationReason.DEADLINE_EXCEEDED, remaining, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * A context without deadline. It only fires when {@link #cancel()} is called.
     */
    public static RequestContext background() {
        return new RequestContext(null);
    }

    /**
     * A context that fires after {@code timeout}. A timeout too long to be represented as an
     * instant yields a context without deadline.
     */
    public static RequestContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Instant deadline;
        try {
            deadline = Instant.now().plus(timeout);
        } catch (DateTimeException | ArithmeticException e) {
            if (timeout.isNegative()) {
                deadline = Instant.MIN;
            } else {
                return background();
            }
        }
        return new RequestContext(deadline);
    }

    public static RequestContext withDeadline(Instant deadline) {
        return new RequestContext(Objects.requireNonNull(deadline, "deadline"));
    }

    /**
     * Fires the context. Has no effect if it already fired.
     */
    public void cancel() {
        done.complete(CancellationReason.CANCELLED);
    }

    public boolean isDone() {
        if (done.isDone()) {
            return true;
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            done.complete(CancellationReason.DEADLINE_EXCEEDED);
            return true;
        }
        return false;
    }

    /**
     * Returns why the context fired, or empty while it is still live.
     */
    public Optional<CancellationReason> reason() {
        return isDone() ? Optional.of(done.join()) : Optional.empty();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline, or empty when there is none. Never negative.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Waits for {@code timeout} unless the context fires first.
     *
     * @return {@code true} if the context fired, {@code false} if the full timeout elapsed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (isDone()) {
            return true;
        }
        try {
            done.get(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return isDone();
        } catch (ExecutionException e) {
            // never completed exceptionally
            return true;
        }
    }

    /**
     * Registers an action to run when the context fires. If it already fired, the action runs
     * immediately on the calling thread. Closing the returned registration removes the action.
     */
    public Registration onDone(Runnable action) {
        Objects.requireNonNull(action, "action");
        listeners.add(action);
        if (isDone() && listeners.remove(action)) {
            action.run();
        }
        return () -> listeners.remove(action);
    }

    // clamps to [0, Long.MAX_VALUE] instead of overflowing for durations beyond ~292 years
    private static long saturatedNanos(Duration duration) {
        if (duration.isNegative()) {
            return 0L;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
    }

    /**
     * Handle for a listener registered with {@link #onDone(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
