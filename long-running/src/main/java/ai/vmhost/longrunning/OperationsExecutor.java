package ai.vmhost.longrunning;

import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

public final class OperationsExecutor {
    private static final Logger LOG = LogManager.getLogger(OperationsExecutor.class);

    private final ScheduledThreadPoolExecutor executor;
    private final AtomicInteger counter = new AtomicInteger(1);
    private final AtomicBoolean terminating = new AtomicBoolean(false);
    private final AtomicInteger runningOperations = new AtomicInteger(0);

    public OperationsExecutor(int corePoolSize, int maxPoolSize) {
        this.executor = create(corePoolSize, maxPoolSize);
    }

    public void startNew(Runnable op) {
        if (terminating.get()) {
            throw new RejectedExecutionException("Cannot start new operation, service is terminating...");
        }

        try {
            runningOperations.getAndIncrement();
            executor.submit(op);
        } catch (RuntimeException e) {
            runningOperations.getAndDecrement();
            throw e;
        }
    }

    public void retryAfter(Runnable op, Duration delay) {
        try {
            runningOperations.getAndIncrement();
            executor.schedule(op, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            runningOperations.getAndDecrement();
            throw e;
        }
    }

    public int runningOperations() {
        return runningOperations.get();
    }

    public boolean isTerminating() {
        return terminating.get();
    }

    @PreDestroy
    public void shutdown() {
        shutdown(Duration.ofMinutes(1));
    }

    public void shutdown(Duration timeout) {
        if (!terminating.compareAndSet(false, true)) {
            while (!executor.isShutdown()) {
                LockSupport.parkNanos(Duration.ofMillis(50).toNanos());
            }
            return;
        }

        LOG.info("Shutdown OperationsExecutor service. Tasks in queue: {}, running tasks: {}, total: {}.",
            executor.getQueue().size(), executor.getActiveCount(), runningOperations.get());

        var deadline = Instant.now().plus(timeout);
        int step = 0;
        while (runningOperations.get() > 0 && Instant.now().isBefore(deadline)) {
            LockSupport.parkNanos(Duration.ofMillis(100).toNanos());
            if (++step % 100 == 0) {
                LOG.info("Remains {} running operation(s)...", runningOperations.get());
            }
        }

        if (runningOperations.get() > 0) {
            LOG.error("Not all operations were completed in timeout, tasks in queue: {}, running tasks: {}",
                executor.getQueue().size(), executor.getActiveCount());
        }

        executor.shutdownNow();

        LOG.info("OperationsExecutor terminated");
    }

    private ScheduledThreadPoolExecutor create(int corePoolSize, int maxPoolSize) {
        var executor = new ScheduledThreadPoolExecutor(
            corePoolSize,
            r -> {
                var th = new Thread(r, "operations-executor-" + counter.getAndIncrement());
                th.setDaemon(true);
                th.setUncaughtExceptionHandler((t, e) ->
                    LOG.error("Unexpected exception in thread {}: {}", t.getName(), e.getMessage(), e));
                return th;
            })
        {
            @Override
            protected void afterExecute(Runnable r, Throwable t) {
                runningOperations.getAndDecrement();
                super.afterExecute(r, t);
                if (t == null && r instanceof Future<?> f && f.isDone()) {
                    try {
                        f.get();
                    } catch (CancellationException ce) {
                        t = ce;
                    } catch (ExecutionException ee) {
                        t = ee.getCause();
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    }
                }
                if (t != null) {
                    LOG.error("Unexpected exception {}: {}", t.getClass().getSimpleName(), t.getMessage(), t);
                }
            }
        };

        executor.setKeepAliveTime(1, TimeUnit.MINUTES);
        executor.setMaximumPoolSize(maxPoolSize);

        return executor;
    }
}
