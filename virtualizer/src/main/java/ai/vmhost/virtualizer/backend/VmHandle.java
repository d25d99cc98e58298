package ai.vmhost.virtualizer.backend;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.model.db.exceptions.AlreadyExistsException;
import ai.vmhost.virtualizer.console.Broadcaster;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.exceptions.InvalidStateException;
import ai.vmhost.virtualizer.exceptions.VmTeardownException;
import ai.vmhost.virtualizer.model.PrepareArgs;
import ai.vmhost.virtualizer.model.VmDetails;
import ai.vmhost.virtualizer.model.VmState;
import jakarta.annotation.Nullable;

import java.io.IOException;
import java.io.InputStream;

/**
 * A prepared or running virtual machine.
 */
public interface VmHandle {

    String id();

    /**
     * @return machine name, {@code null} until {@link #prepare(PrepareArgs)} is called
     */
    @Nullable
    String name();

    /**
     * @return backend identity
     */
    String type();

    String virtualizer();

    void initialize(byte[] config) throws InvalidConfigurationException;

    /**
     * Starts preparation in the background. The machine becomes active under {@code args.name()} when the returned
     * operation completes successfully.
     *
     * @throws AlreadyExistsException if an active machine already uses the name
     */
    Operation prepare(PrepareArgs args) throws AlreadyExistsException, InvalidStateException;

    void start() throws InvalidStateException, IOException, InterruptedException;

    void stop() throws InvalidStateException, IOException, InterruptedException;

    /**
     * Stops the machine, releases its resources and removes it from the active machines. The removal happens
     * even if teardown fails.
     *
     * @param force power the machine off instead of asking it to shut down
     */
    void close(boolean force) throws VmTeardownException;

    VmState state();

    Broadcaster consoleLog();

    InputStream downloadDisk() throws InvalidStateException, IOException;

    VmDetails details();
}
