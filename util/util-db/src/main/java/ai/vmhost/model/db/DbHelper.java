package ai.vmhost.model.db;

import org.apache.logging.log4j.Logger;
import org.postgresql.util.PSQLState;

import java.sql.SQLException;

@SuppressWarnings({"BusyWait"})
public enum DbHelper {
    ;

    public interface Func<T> {
        T run() throws SQLException;
    }

    public interface FuncV {
        void run() throws SQLException;
    }

    public static <T> T withRetries(Logger logger, Func<T> fn) throws SQLException {
        return withRetries(defaultRetryPolicy(), logger, fn);
    }

    public static void withRetries(Logger logger, FuncV fn) throws SQLException {
        withRetries(defaultRetryPolicy(), logger, () -> {
            fn.run();
            return (Void) null;
        });
    }

    /**
     * Runs {@code fn}, repeating it on serialization failures and lost connections. Other errors,
     * including the DAO exceptions, are rethrown as is.
     */
    public static <T> T withRetries(RetryPolicy retryPolicy, Logger logger, Func<T> fn) throws SQLException {
        int delay = 0;
        for (int attempt = 1; ; ++attempt) {
            if (delay > 0) {
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SQLException("Interrupted while waiting for database retry", e);
                }
            }

            try {
                return fn.run();
            } catch (SQLException e) {
                if (!canRetry(e)) {
                    throw e;
                }
                delay = retryPolicy.getNextDelayMs();
                if (delay < 0) {
                    logger.error("Got retryable database error: [{}] {}. Retries limit {} exceeded.",
                        e.getSQLState(), e.getMessage(), attempt);
                    throw new RetryCountExceededException(attempt, e);
                }
                logger.warn("Got retryable database error #{}: [{}] {}. Retry after {}ms.",
                    attempt, e.getSQLState(), e.getMessage(), delay);
            }
        }
    }

    public interface RetryPolicy {
        int getNextDelayMs();
    }

    public static final class DefaultRetryPolicy implements RetryPolicy {
        private int attempts;
        private int nextDelay;
        private final int coeff;

        public DefaultRetryPolicy(int attempts, int nextDelay, int coeff) {
            this.attempts = attempts;
            this.nextDelay = nextDelay;
            this.coeff = coeff;
        }

        @Override
        public int getNextDelayMs() {
            if (--attempts < 0) {
                return -1;
            }
            var delay = nextDelay;
            nextDelay *= coeff;
            return delay + (int) ((delay / 5) * (Math.random() - 0.5));
        }
    }

    public static RetryPolicy defaultRetryPolicy() {
        return new DefaultRetryPolicy(10, 50, 2);
    }

    public static final class RetryCountExceededException extends SQLException {
        public RetryCountExceededException(int count, SQLException last) {
            super("Database retries limit " + count + " exceeded.", last.getSQLState(), last);
        }

        @Override
        public synchronized Throwable fillInStackTrace() {
            return this;
        }
    }

    private static final String CANNOT_SERIALIZE_TRANSACTION = "40001";

    static boolean canRetry(SQLException e) {
        var state = e.getSQLState();
        if (state == null && e.getCause() instanceof SQLException cause) {
            state = cause.getSQLState();
        }
        if (state == null) {
            return false;
        }
        return CANNOT_SERIALIZE_TRANSACTION.equals(state) || PSQLState.isConnectionError(state);
    }

    public static boolean isUniqueViolation(SQLException e) {
        return PSQLState.UNIQUE_VIOLATION.getState().equals(e.getSQLState());
    }
}
