package ai.vmhost.longrunning;

import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs an {@link Operation} as a list of steps on the {@link OperationsExecutor}.
 *
 * <p>A step returning {@link StepResult#RESTART} is run again after the requested delay, completed steps are
 * not repeated. Every outcome, a thrown exception included, reaches {@link Operation#finished(Throwable)}
 * exactly once, after {@link #onCompleted()} or {@link #onFailed(Throwable)}.
 */
public abstract class OperationRunnerBase implements Runnable {
    private final String logPrefix;
    private final Logger log = LogManager.getLogger(getClass());
    private final Operation op;
    private final OperationsExecutor executor;
    private int nextStep = 0;
    @Nullable
    private Throwable failure = null;

    protected OperationRunnerBase(Operation op, OperationsExecutor executor) {
        this.logPrefix = "[Op %s (%s)]".formatted(op.id(), op.description());
        this.op = op;
        this.executor = executor;
    }

    @Override
    public final void run() {
        try {
            var steps = steps();
            while (nextStep < steps.size()) {
                final var stepResult = steps.get(nextStep).get();
                switch (stepResult.code()) {
                    case ALREADY_DONE, CONTINUE -> nextStep++;
                    case RESTART -> {
                        log.debug("{} Restart step {} after {}", logPrefix, nextStep, stepResult.delay());
                        executor.retryAfter(this, stepResult.delay());
                        return;
                    }
                    case FINISH -> {
                        complete();
                        return;
                    }
                }
            }
            complete();
        } catch (Throwable e) {
            log.error("{} Terminated by exception: {}", logPrefix, e.getMessage(), e);
            failure = e;
            complete();
            if (e instanceof Error err) {
                throw err;
            }
        }
    }

    private void complete() {
        var err = failure;
        try {
            if (err == null) {
                onCompleted();
            } else {
                onFailed(err);
            }
        } catch (Exception e) {
            log.error("{} Completion handler failed: {}", logPrefix, e.getMessage(), e);
            if (err == null) {
                err = e;
                try {
                    onFailed(e);
                } catch (Exception ex) {
                    log.error("{} Failure handler failed: {}", logPrefix, ex.getMessage(), ex);
                }
            } else {
                err.addSuppressed(e);
            }
        }

        if (err == null) {
            log.info("{} Completed", logPrefix);
        } else {
            log.warn("{} Failed: {}", logPrefix, err.getMessage());
        }
        op.finished(err);
    }

    protected abstract List<Supplier<StepResult>> steps();

    protected void onCompleted() throws Exception {
    }

    protected void onFailed(Throwable err) throws Exception {
    }

    /**
     * Records {@code err} as the outcome of the operation and stops executing further steps.
     */
    protected final StepResult fail(Throwable err) {
        failure = err;
        return StepResult.FINISH;
    }

    protected final Logger log() {
        return log;
    }

    protected final String logPrefix() {
        return logPrefix;
    }

    public final String id() {
        return op.id();
    }

    protected final Operation op() {
        return op;
    }

    public record StepResult(
        StepResult.Code code,
        Duration delay
    ) {
        public enum Code {
            ALREADY_DONE,
            CONTINUE,
            RESTART,
            FINISH
        }

        public static final StepResult ALREADY_DONE = new StepResult(Code.ALREADY_DONE, null);
        public static final StepResult CONTINUE = new StepResult(Code.CONTINUE, null);
        public static final StepResult RESTART = new StepResult(Code.RESTART, Duration.ofSeconds(1));
        public static final StepResult FINISH = new StepResult(Code.FINISH, null);

        public StepResult after(Duration delay) {
            assert code == Code.RESTART;
            return new StepResult(code, delay);
        }

        @Override
        public Duration delay() {
            assert code == Code.RESTART;
            return delay;
        }
    }
}
