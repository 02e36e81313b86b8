package io.artifacttracker.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextTest {

    @Test
    void backgroundContextIsLiveUntilCancelled() {
        RequestContext ctx = RequestContext.background();
        assertThat(ctx.isDone()).isFalse();
        assertThat(ctx.reason()).isEmpty();
        assertThat(ctx.deadline()).isEmpty();

        ctx.cancel();

        assertThat(ctx.isDone()).isTrue();
        assertThat(ctx.reason()).contains(CancellationReason.CANCELLED);
    }

    @Test
    void centuriesLongTimeoutBehavesLikeFarFutureDeadline() throws Exception {
        RequestContext ctx = RequestContext.withTimeout(Duration.ofDays(365L * 300));

        assertThat(ctx.isDone()).isFalse();
        assertThat(ctx.deadline()).isPresent();
        assertThat(ctx.remaining()).hasValueSatisfying(left -> assertThat(left).isGreaterThan(Duration.ofDays(365L * 299)));
        assertThat(ctx.await(Duration.ofMillis(10))).isFalse();

        ctx.cancel();
        assertThat(ctx.await(Duration.ofDays(365L * 300))).isTrue();
    }

    @Test
    void unrepresentableTimeoutMeansNoDeadline() {
        RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(Long.MAX_VALUE));

        assertThat(ctx.isDone()).isFalse();
        assertThat(ctx.deadline()).isEmpty();
    }

    @Test
    void pastDeadlineIsDoneImmediately() {
        RequestContext ctx = RequestContext.withDeadline(Instant.now().minusSeconds(1));

        assertThat(ctx.isDone()).isTrue();
        assertThat(ctx.reason()).contains(CancellationReason.DEADLINE_EXCEEDED);
        assertThat(ctx.remaining()).contains(Duration.ZERO);
    }

    @Test
    void cancelAfterDeadlineKeepsFirstReason() {
        RequestContext ctx = RequestContext.withTimeout(Duration.ZERO);
        assertThat(ctx.isDone()).isTrue();

        ctx.cancel();

        assertThat(ctx.reason()).contains(CancellationReason.DEADLINE_EXCEEDED);
    }

    @Test
    void awaitReturnsFalseWhenTimeoutElapses() throws Exception {
        RequestContext ctx = RequestContext.background();

        assertThat(ctx.await(Duration.ofMillis(20))).isFalse();
    }

    @Test
    void awaitIsPreemptedByDeadline() throws Exception {
        RequestContext ctx = RequestContext.withTimeout(Duration.ofMillis(50));

        long start = System.nanoTime();
        boolean fired = ctx.await(Duration.ofSeconds(10));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(fired).isTrue();
        assertThat(elapsedMillis).isLessThan(5_000);
        assertThat(ctx.reason()).contains(CancellationReason.DEADLINE_EXCEEDED);
    }

    @Test
    void awaitIsPreemptedByCancelFromAnotherThread() throws Exception {
        RequestContext ctx = RequestContext.background();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ctx.cancel();
        });
        canceller.start();

        boolean fired = ctx.await(Duration.ofSeconds(10));
        canceller.join();

        assertThat(fired).isTrue();
        assertThat(ctx.reason()).contains(CancellationReason.CANCELLED);
    }

    @Test
    void onDoneRunsListenersOnceAndHonoursRemoval() {
        RequestContext ctx = RequestContext.background();
        AtomicInteger kept = new AtomicInteger();
        AtomicInteger removed = new AtomicInteger();

        ctx.onDone(kept::incrementAndGet);
        RequestContext.Registration registration = ctx.onDone(removed::incrementAndGet);
        registration.close();

        ctx.cancel();
        ctx.cancel();

        assertThat(kept).hasValue(1);
        assertThat(removed).hasValue(0);
    }

    @Test
    void onDoneRunsImmediatelyWhenAlreadyFired() {
        RequestContext ctx = RequestContext.background();
        ctx.cancel();
        AtomicInteger calls = new AtomicInteger();

        ctx.onDone(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }
}
