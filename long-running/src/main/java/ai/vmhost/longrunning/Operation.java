package ai.vmhost.longrunning;

import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asynchronous unit of work reporting through three one-directional streams: verbose logs, coarse status
 * and a single-slot error. All three are closed exactly once by {@link #finished(Throwable)}.
 */
public final class Operation {
    private static final Logger LOG = LogManager.getLogger(Operation.class);

    public static final int LOGS_CAPACITY = 128;
    public static final int STATUS_CAPACITY = 10;
    public static final int ERROR_CAPACITY = 1;

    private final String id;
    private final String description;
    private final Instant createdAt;

    private final OperationStream<String> logs = new OperationStream<>(LOGS_CAPACITY);
    private final OperationStream<String> status = new OperationStream<>(STATUS_CAPACITY);
    private final OperationStream<Throwable> error = new OperationStream<>(ERROR_CAPACITY);

    private final Lock finishLock = new ReentrantLock();
    private boolean finished = false;

    public Operation(String id, String description) {
        this.id = id;
        this.description = description;
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Inbox<String> logs() {
        return logs;
    }

    public Inbox<String> status() {
        return status;
    }

    public Inbox<Throwable> error() {
        return error;
    }

    public void log(String format, Object... args) {
        push(logs, args.length == 0 ? format : format.formatted(args));
    }

    public void updateStatus(String text) {
        push(status, text);
        push(logs, text);
    }

    /**
     * Completes the operation. Only the first call has any effect; on failure the error is reported to every
     * stream before they are closed.
     *
     * @return {@code true} if this call completed the operation
     */
    public boolean finished(@Nullable Throwable err) {
        finishLock.lock();
        try {
            if (finished) {
                return false;
            }
            finished = true;

            if (err != null) {
                var msg = describe(err);
                push(logs, "Error: " + msg);
                push(status, "Failed: " + msg);
                push(error, err);
            }

            logs.close();
            status.close();
            error.close();
            return true;
        } finally {
            finishLock.unlock();
        }
    }

    public boolean isFinished() {
        finishLock.lock();
        try {
            return finished;
        } finally {
            finishLock.unlock();
        }
    }

    private <T> void push(OperationStream<T> stream, T item) {
        try {
            if (!stream.send(item)) {
                LOG.debug("[Op {} ({})] Dropped '{}': operation already finished", id, description, item);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("[Op {} ({})] Interrupted while reporting '{}'", id, description, item);
        }
    }

    private static String describe(Throwable err) {
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return "Operation{id='" + id + "', description='" + description + "'}";
    }
}
