package ai.vmhost.virtualizer.backend;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.longrunning.OperationRunnerBase;
import ai.vmhost.longrunning.OperationsExecutor;

import java.nio.file.Files;
import java.util.List;
import java.util.function.Supplier;

/**
 * Background preparation of a {@link ManagedVm}: backend resources, then registration under the machine name,
 * then the optional auto-start. A failure at any step releases what was acquired and deletes the machine.
 */
final class PrepareVmAction extends OperationRunnerBase {
    private final ManagedVm vm;
    private final PrepareContext ctx;

    PrepareVmAction(ManagedVm vm, Operation op, OperationsExecutor executor) {
        super(op, executor);
        this.vm = vm;
        this.ctx = vm.prepareContext(op);
    }

    @Override
    protected List<Supplier<StepResult>> steps() {
        return List.of(this::createWorkDir, this::prepareMachine, this::register, this::autoStart);
    }

    private StepResult createWorkDir() {
        try {
            Files.createDirectories(ctx.workDir());
        } catch (Exception e) {
            log().error("{} Cannot create working directory {}: {}", logPrefix(), ctx.workDir(), e.getMessage());
            return fail(e);
        }
        op().updateStatus("Preparing %s machine %s".formatted(vm.type(), ctx.args().name()));
        return StepResult.CONTINUE;
    }

    private StepResult prepareMachine() {
        try {
            vm.driver().prepare(ctx);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(e);
        } catch (Exception e) {
            return fail(e);
        }
        return StepResult.CONTINUE;
    }

    private StepResult register() {
        try {
            vm.completePreparation();
        } catch (Exception e) {
            return fail(e);
        }
        op().log("Machine %s is ready", ctx.args().name());
        return StepResult.CONTINUE;
    }

    private StepResult autoStart() {
        if (!ctx.args().autoStart()) {
            return StepResult.ALREADY_DONE;
        }

        op().updateStatus("Starting machine " + ctx.args().name());
        try {
            vm.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(e);
        } catch (Exception e) {
            return fail(e);
        }
        return StepResult.CONTINUE;
    }

    @Override
    protected void onCompleted() {
        op().updateStatus("Machine %s is %s".formatted(ctx.args().name(), vm.state()));
    }

    @Override
    protected void onFailed(Throwable err) {
        log().warn("{} Preparation of machine {} failed, releasing its resources", logPrefix(), ctx.args().name());
        vm.abortPreparation();
    }
}
