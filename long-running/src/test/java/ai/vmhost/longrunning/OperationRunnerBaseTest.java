package ai.vmhost.longrunning;

import ai.vmhost.longrunning.OperationRunnerBase.StepResult;
import ai.vmhost.test.TimeUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

public class OperationRunnerBaseTest {

    private OperationsExecutor executor;

    @Before
    public void setUp() {
        executor = new OperationsExecutor(2, 4);
    }

    @After
    public void tearDown() {
        executor.shutdown(Duration.ofSeconds(5));
    }

    @Test
    public void restartedStepIsResumed() throws Exception {
        var op = new Operation("op-1", "restart");
        var trace = Collections.synchronizedList(new ArrayList<String>());
        var attempts = new AtomicInteger(0);

        var action = new TestAction(op, executor, List.of(
            () -> {
                trace.add("first");
                return StepResult.CONTINUE;
            },
            () -> {
                trace.add("second");
                return attempts.incrementAndGet() < 3 ? StepResult.RESTART.after(Duration.ofMillis(10))
                    : StepResult.CONTINUE;
            },
            () -> {
                trace.add("third");
                return StepResult.CONTINUE;
            }));
        executor.startNew(action);

        var outcome = Operations.await(op, Duration.ofSeconds(10));
        Assert.assertTrue(outcome.success());
        Assert.assertEquals(List.of("first", "second", "second", "second", "third"), trace);
        Assert.assertEquals(1, action.completed.get());
        Assert.assertEquals(0, action.failed.get());
    }

    @Test
    public void exceptionFailsOperation() throws Exception {
        var op = new Operation("op-2", "boom");
        var action = new TestAction(op, executor, List.of(
            () -> {
                throw new IllegalStateException("boom");
            },
            () -> {
                Assert.fail("must not be called");
                return StepResult.CONTINUE;
            }));
        executor.startNew(action);

        var outcome = Operations.await(op, Duration.ofSeconds(10));
        Assert.assertFalse(outcome.success());
        Assert.assertEquals("boom", outcome.error().getMessage());
        Assert.assertEquals(1, action.failed.get());
    }

    @Test
    public void failedStepStopsExecution() throws Exception {
        var op = new Operation("op-3", "fail");
        var calls = new AtomicInteger(0);
        var holder = new TestAction[1];
        holder[0] = new TestAction(op, executor, List.of(
            () -> holder[0].failWith(new IllegalArgumentException("bad config")),
            () -> {
                calls.incrementAndGet();
                return StepResult.CONTINUE;
            }));
        executor.startNew(holder[0]);

        var outcome = Operations.await(op, Duration.ofSeconds(10));
        Assert.assertEquals("bad config", outcome.error().getMessage());
        Assert.assertEquals(0, calls.get());
        Assert.assertTrue(TimeUtils.waitFlagUp(() -> executor.runningOperations() == 0, 5, TimeUnit.SECONDS));
    }

    private static final class TestAction extends OperationRunnerBase {
        private final List<Supplier<StepResult>> steps;
        final AtomicInteger completed = new AtomicInteger(0);
        final AtomicInteger failed = new AtomicInteger(0);

        TestAction(Operation op, OperationsExecutor executor, List<Supplier<StepResult>> steps) {
            super(op, executor);
            this.steps = steps;
        }

        StepResult failWith(Throwable e) {
            return fail(e);
        }

        @Override
        protected List<Supplier<StepResult>> steps() {
            return steps;
        }

        @Override
        protected void onCompleted() {
            completed.incrementAndGet();
        }

        @Override
        protected void onFailed(Throwable err) {
            failed.incrementAndGet();
        }
    }
}
