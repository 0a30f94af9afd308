package io.chronicle.core.session;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancellation and deadline scope for store operations.
 *
 * <p>Cancelling a context interrupts the statement currently running under it; the store then
 * rolls back the enclosing transaction. A context with a deadline cancels itself once the deadline
 * passes. Close timed contexts when done so their timer is released.
 */
public final class OperationContext implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(OperationContext.class);
    private static final OperationContext BACKGROUND = new OperationContext(null, Clock.systemUTC(), false);
    private static final ScheduledExecutorService DEADLINES = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "chronicle-deadlines");
        thread.setDaemon(true);
        return thread;
    });

    private final Instant deadline;
    private final Clock clock;
    private final boolean cancellable;
    private volatile String cancelReason;
    private Statement activeStatement;
    private ScheduledFuture<?> timer;

    private OperationContext(Instant deadline, Clock clock, boolean cancellable) {
        this.deadline = deadline;
        this.clock = clock;
        this.cancellable = cancellable;
    }

    /**
     * A context that is never cancelled and has no deadline.
     */
    public static OperationContext background() {
        return BACKGROUND;
    }

    public static OperationContext cancellable() {
        return new OperationContext(null, Clock.systemUTC(), true);
    }

    public static OperationContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Clock clock = Clock.systemUTC();
        OperationContext context = new OperationContext(clock.instant().plus(timeout), clock, true);
        synchronized (context) {
            context.timer = DEADLINES.schedule(
                () -> context.cancel("deadline exceeded"),
                Math.max(0, timeout.toMillis()),
                TimeUnit.MILLISECONDS
            );
        }
        return context;
    }

    /**
     * A context whose deadline is checked against {@code clock} before every statement. No timer is
     * scheduled, so a statement already running when the deadline passes runs to completion; use
     * {@link #withTimeout(Duration)} to interrupt it.
     */
    public static OperationContext withDeadline(Instant deadline, Clock clock) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        return new OperationContext(deadline, clock, true);
    }

    public void cancel() {
        cancel("operation cancelled");
    }

    public boolean isCancelled() {
        return cancelReason != null;
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    @Override
    public void close() {
        ScheduledFuture<?> pending;
        synchronized (this) {
            pending = timer;
            timer = null;
        }
        if (pending != null) {
            pending.cancel(false);
        }
    }

    /**
     * Throws {@link CancellationException} if the context was cancelled or its deadline has passed.
     */
    void checkActive() {
        if (cancelReason == null && deadline != null && !clock.instant().isBefore(deadline)) {
            cancelReason = "deadline exceeded";
        }
        String reason = cancelReason;
        if (reason != null) {
            throw new CancellationException(reason);
        }
    }

    synchronized void attach(Statement statement) {
        checkActive();
        if (cancellable) {
            activeStatement = statement;
        }
    }

    synchronized void detach(Statement statement) {
        if (activeStatement == statement) {
            activeStatement = null;
        }
    }

    private void cancel(String reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("background context cannot be cancelled");
        }
        // Interrupt only while the statement is still attached, so a late cancel cannot reach
        // whatever the connection runs next.
        synchronized (this) {
            if (cancelReason == null) {
                cancelReason = reason;
            }
            if (activeStatement == null) {
                return;
            }
            try {
                activeStatement.cancel();
            } catch (SQLException e) {
                LOG.debug("Failed to interrupt running statement: {}", e.getMessage());
            }
        }
    }
}
