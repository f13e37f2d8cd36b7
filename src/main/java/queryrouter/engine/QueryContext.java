package queryrouter.engine;

import io.micronaut.core.annotation.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Carries cancellation and an optional deadline from the caller down to the engine.
 *
 * Cancellation is cooperative: calling {@link #cancel()} only flips a flag that
 * the router and engines check. Thread-safe; one context may be shared by the
 * thread running a query and the thread cancelling it.
 */
public final class QueryContext {

    private final Instant deadline;
    private volatile boolean cancelled;

    private QueryContext(@Nullable Instant deadline) {
        this.deadline = deadline;
    }

    /**
     * A context with no deadline that is only done once cancelled.
     */
    public static QueryContext background() {
        return new QueryContext(null);
    }

    public static QueryContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
        }
        return new QueryContext(Instant.now().plus(timeout));
    }

    public static QueryContext withDeadline(Instant deadline) {
        return new QueryContext(Objects.requireNonNull(deadline, "deadline"));
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    /**
     * @return true once cancelled or past the deadline
     */
    public boolean isDone() {
        return cancelled || isExpired();
    }

    @Nullable
    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Time left until the deadline, never negative.
     *
     * @return remaining time, or {@code null} when there is no deadline
     */
    @Nullable
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Short reason for diagnostics, or {@code null} while the context is live.
     */
    @Nullable
    public String doneReason() {
        if (cancelled) {
            return "cancelled";
        }
        if (isExpired()) {
            return "deadline exceeded";
        }
        return null;
    }
}
