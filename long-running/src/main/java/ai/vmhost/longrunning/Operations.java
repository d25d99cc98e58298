package ai.vmhost.longrunning;

import jakarta.annotation.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Consumer;

public enum Operations {
    ;

    public record Outcome(
        List<String> logs,
        List<String> statuses,
        @Nullable Throwable error
    ) {
        public boolean success() {
            return error == null;
        }
    }

    public static Outcome await(Operation op, Duration timeout) throws InterruptedException, TimeoutException {
        return await(op, timeout, line -> { });
    }

    /**
     * Drains the three streams of {@code op} together until all of them are closed. None of the streams is
     * read with a blocking call, so a producer stuck on a full stream never stalls the consumer.
     */
    public static Outcome await(Operation op, Duration timeout, Consumer<String> onLog)
        throws InterruptedException, TimeoutException
    {
        var deadline = System.nanoTime() + timeout.toNanos();
        var logs = new ArrayList<String>();
        var statuses = new ArrayList<String>();
        Throwable error = null;

        while (true) {
            boolean progress = false;

            String line;
            while ((line = op.logs().poll()) != null) {
                logs.add(line);
                onLog.accept(line);
                progress = true;
            }
            String status;
            while ((status = op.status().poll()) != null) {
                statuses.add(status);
                progress = true;
            }
            var err = op.error().poll();
            if (err != null) {
                error = err;
                progress = true;
            }

            if (op.logs().isDrained() && op.status().isDrained() && op.error().isDrained()) {
                return new Outcome(List.copyOf(logs), List.copyOf(statuses), error);
            }

            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            if (System.nanoTime() > deadline) {
                throw new TimeoutException("Operation " + op.id() + " did not finish in " + timeout);
            }
            if (!progress) {
                LockSupport.parkNanos(Duration.ofMillis(10).toNanos());
            }
        }
    }
}
