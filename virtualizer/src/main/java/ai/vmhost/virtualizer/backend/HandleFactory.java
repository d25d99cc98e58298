package ai.vmhost.virtualizer.backend;

import ai.vmhost.common.IdGenerator;
import ai.vmhost.longrunning.OperationsExecutor;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.registry.ActiveVms;
import jakarta.inject.Singleton;

/**
 * Wraps backend drivers into {@link ManagedVm} handles bound to the process-wide registry and executor.
 */
@Singleton
public class HandleFactory {
    private static final int VM_ID_LENGTH = 12;

    private final IdGenerator idGenerator;
    private final OperationsExecutor executor;
    private final ActiveVms activeVms;
    private final ManagedVm.Settings settings;

    public HandleFactory(IdGenerator idGenerator, OperationsExecutor executor, ActiveVms activeVms,
                         VirtualizerConfig config)
    {
        this.idGenerator = idGenerator;
        this.executor = executor;
        this.activeVms = activeVms;
        this.settings = ManagedVm.Settings.from(config);
    }

    public ManagedVm create(String type, String virtualizer, MachineDriver driver) {
        return new ManagedVm(idGenerator.generate(VM_ID_LENGTH), type, virtualizer, driver, settings, executor,
            activeVms);
    }
}
