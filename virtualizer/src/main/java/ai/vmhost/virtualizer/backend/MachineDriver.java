package ai.vmhost.virtualizer.backend;

import ai.vmhost.virtualizer.console.Broadcaster;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Hypervisor-specific part of a machine. {@link ManagedVm} owns the lifecycle and calls these methods only in
 * valid states, from one thread at a time.
 */
public interface MachineDriver {

    void initialize(byte[] config) throws InvalidConfigurationException;

    /**
     * Acquires everything needed to launch: kernel, network devices, host ports, machine registration.
     * Progress goes to {@code ctx.op()}. Anything acquired must be freed by {@link #release()}, even if this
     * method fails halfway.
     */
    void prepare(PrepareContext ctx) throws Exception;

    /**
     * Boots the machine and connects its console to {@code console}. Returns once the hypervisor accepted it.
     */
    void launch(Broadcaster console) throws IOException, InterruptedException;

    /**
     * Blocks until the machine exits.
     *
     * @return exit code of the hypervisor process, or 0 when it has none
     */
    int awaitExit() throws InterruptedException;

    /**
     * Asks the guest to power off.
     */
    void requestShutdown() throws IOException, InterruptedException;

    boolean isRunning();

    void forceStop() throws IOException, InterruptedException;

    /**
     * Frees every resource acquired by {@link #prepare(PrepareContext)} or {@link #launch(Broadcaster)}.
     * Must tolerate being called when nothing was acquired.
     */
    void release() throws IOException, InterruptedException;

    Path disk();
}
