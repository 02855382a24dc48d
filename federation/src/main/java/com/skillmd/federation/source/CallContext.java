package com.skillmd.federation.source;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation and deadline carrier for one logical caller request.
 *
 * The same instance is handed to every rate-limit wait and every source call
 * made on behalf of the request. Calling {@link #cancel()} wakes any thread
 * blocked in {@link #await(Duration)} immediately; a deadline ends waits once
 * it passes. Waits never hold locks, so ending a context cannot leave shared
 * state half-updated.
 */
public final class CallContext {

    public enum Status { ACTIVE, CANCELLED, DEADLINE_EXCEEDED }

    private static final CallContext BACKGROUND = new CallContext(null, null);

    private final Long           deadlineNanos;   // System.nanoTime() based; null = none
    private final CountDownLatch cancelled;       // null = cannot be cancelled

    private CallContext(Long deadlineNanos, CountDownLatch cancelled) {
        this.deadlineNanos = deadlineNanos;
        this.cancelled     = cancelled;
    }

    /** Never cancelled, no deadline. */
    public static CallContext background() {
        return BACKGROUND;
    }

    /** Cancellable, no deadline. */
    public static CallContext cancellable() {
        return new CallContext(null, new CountDownLatch(1));
    }

    /** Cancellable, ends after {@code timeout}. */
    public static CallContext withTimeout(Duration timeout) {
        return new CallContext(System.nanoTime() + timeout.toNanos(), new CountDownLatch(1));
    }

    /** Cancellable, ends at {@code deadline}. */
    public static CallContext withDeadline(Instant deadline) {
        return withTimeout(Duration.between(Instant.now(), deadline));
    }

    /** End this context now; idempotent. No-op for {@link #background()}. */
    public void cancel() {
        if (cancelled != null) {
            cancelled.countDown();
        }
    }

    public Status status() {
        if (cancelled != null && cancelled.getCount() == 0) {
            return Status.CANCELLED;
        }
        if (deadlineNanos != null && deadlineNanos - System.nanoTime() <= 0) {
            return Status.DEADLINE_EXCEEDED;
        }
        return Status.ACTIVE;
    }

    public boolean isDone() {
        return status() != Status.ACTIVE;
    }

    /** Time left before the deadline; empty when there is none. */
    public Optional<Duration> remaining() {
        if (deadlineNanos == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime())));
    }

    /** The smaller of {@code fallback} and the time left, for I/O timeouts. */
    public Duration timeoutOr(Duration fallback) {
        return remaining()
                .filter(left -> left.compareTo(fallback) < 0)
                .orElse(fallback);
    }

    /**
     * Sleep for {@code duration} unless the context ends first.
     *
     * @return true if the full duration elapsed with the context still
     *         active; false if it was cancelled, hit its deadline, or the
     *         calling thread was interrupted (the interrupt flag is restored)
     */
    public boolean await(Duration duration) {
        long waitNanos = Math.max(0, duration.toNanos());
        boolean boundedByDeadline = false;
        if (deadlineNanos != null) {
            long left = deadlineNanos - System.nanoTime();
            if (left <= 0) {
                return false;
            }
            if (left <= waitNanos) {
                waitNanos = left;
                boundedByDeadline = true;
            }
        }
        try {
            if (cancelled == null) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } else if (cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return !boundedByDeadline;
    }

    /** Throws if this context has ended or the current thread is interrupted. */
    public void checkActive(SourceType source) {
        if (isDone() || Thread.currentThread().isInterrupted()) {
            throw endedException(source);
        }
    }

    /** The exception describing why this context ended. */
    public SourceException endedException(SourceType source) {
        if (status() == Status.DEADLINE_EXCEEDED) {
            return new SourceException(SourceException.Kind.DEADLINE_EXCEEDED, source,
                    "deadline exceeded");
        }
        return new SourceException(SourceException.Kind.CANCELLED, source, "call cancelled");
    }
}
