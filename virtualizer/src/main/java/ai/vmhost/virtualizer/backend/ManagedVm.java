package ai.vmhost.virtualizer.backend;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.longrunning.OperationsExecutor;
import ai.vmhost.model.db.exceptions.AlreadyExistsException;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.console.Broadcaster;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.exceptions.InvalidStateException;
import ai.vmhost.virtualizer.exceptions.VmTeardownException;
import ai.vmhost.virtualizer.model.PrepareArgs;
import ai.vmhost.virtualizer.model.RouteTable;
import ai.vmhost.virtualizer.model.VmDetails;
import ai.vmhost.virtualizer.model.VmState;
import ai.vmhost.virtualizer.net.IpLookout;
import ai.vmhost.virtualizer.registry.ActiveVms;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Lifecycle of one machine, shared by all backends. Hypervisor specifics are delegated to a {@link MachineDriver}.
 *
 * <p>State changes go through an atomic reference. Start only proceeds from {@link VmState#READY} by
 * compare-and-set, so of two racing starts one fails. Other concurrent transitions on the same handle are not
 * serialized and are left to the caller.
 */
public final class ManagedVm implements VmHandle {
    private static final Logger LOG = LogManager.getLogger(ManagedVm.class);

    private final String id;
    private final String type;
    private final String virtualizer;
    private final Instant created = Instant.now();
    private final MachineDriver driver;
    private final Settings settings;
    private final OperationsExecutor executor;
    private final ActiveVms registry;
    private final Broadcaster console;

    private final AtomicReference<VmState> state = new AtomicReference<>(VmState.INITIALIZING);
    private final AtomicBoolean prepareStarted = new AtomicBoolean(false);

    @Nullable
    private volatile PrepareArgs args;
    private volatile RouteTable routes = RouteTable.from(List.of());
    @Nullable
    private volatile Path workDir;

    /**
     * @param vmDrive          parent of per-machine working directories
     * @param consoleBufferSize bytes of console history kept for late subscribers
     * @param stopAttempts     liveness checks after a graceful shutdown request before powering off
     * @param stopPollInterval pause between those checks
     * @param ipLookupTimeout  how long to watch the console for guest addresses
     */
    public record Settings(
        Path vmDrive,
        int consoleBufferSize,
        int stopAttempts,
        Duration stopPollInterval,
        Duration ipLookupTimeout
    ) {
        public static Settings from(VirtualizerConfig config) {
            return new Settings(Path.of(config.getVmDrive()), config.getConsoleBufferSize(), config.getStopAttempts(),
                config.getStopPollInterval(), config.getIpLookupTimeout());
        }
    }

    public ManagedVm(String id, String type, String virtualizer, MachineDriver driver, Settings settings,
                     OperationsExecutor executor, ActiveVms registry)
    {
        this.id = id;
        this.type = type;
        this.virtualizer = virtualizer;
        this.driver = driver;
        this.settings = settings;
        this.executor = executor;
        this.registry = registry;
        this.console = new Broadcaster(id, settings.consoleBufferSize());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    @Nullable
    public String name() {
        var a = args;
        return a == null ? null : a.name();
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String virtualizer() {
        return virtualizer;
    }

    @Override
    public VmState state() {
        return state.get();
    }

    @Override
    public Broadcaster consoleLog() {
        return console;
    }

    @Override
    public void initialize(byte[] config) throws InvalidConfigurationException {
        driver.initialize(config);
    }

    @Override
    public Operation prepare(PrepareArgs args) throws AlreadyExistsException, InvalidStateException {
        if (state.get() != VmState.INITIALIZING || !prepareStarted.compareAndSet(false, true)) {
            throw new InvalidStateException("vm is already prepared", state.get());
        }
        if (registry.contains(args.name())) {
            prepareStarted.set(false);
            throw new AlreadyExistsException("virtual machine already exists");
        }

        this.args = args;
        this.routes = RouteTable.from(args.config().networks());
        this.workDir = settings.vmDrive().resolve(id);

        var op = new Operation(id, "Prepare vm " + args.name());
        LOG.info("Preparing {} machine '{}' ({}) from virtualizer '{}'", type, args.name(), id, virtualizer);
        executor.startNew(new PrepareVmAction(this, op, executor));
        return op;
    }

    @Override
    public void start() throws InvalidStateException, IOException, InterruptedException {
        if (!state.compareAndSet(VmState.READY, VmState.CHANGING)) {
            var current = state.get();
            throw new InvalidStateException("vm not in a state to be started, currently in: " + current, current);
        }

        LOG.info("Starting machine '{}' ({})", name(), id);
        try {
            driver.launch(console);
        } catch (IOException | RuntimeException e) {
            state.set(VmState.BROKEN);
            LOG.error("Cannot start machine '{}' ({}): {}", name(), id, e.getMessage(), e);
            throw e;
        } catch (InterruptedException e) {
            state.set(VmState.BROKEN);
            throw e;
        }
        state.set(VmState.ALIVE);

        startWatcher();
        if (routes.needsAddressLookup()) {
            startIpLookout();
        }
    }

    @Override
    public void stop() throws InvalidStateException, IOException, InterruptedException {
        var current = state.get();
        if (current == VmState.READY) {
            throw new InvalidStateException("vm is already stopped", current);
        }
        if ((current != VmState.ALIVE && current != VmState.BROKEN) || !state.compareAndSet(current, VmState.CHANGING)) {
            current = state.get();
            throw new InvalidStateException("vm not in a state to be stopped, currently in: " + current, current);
        }

        LOG.info("Stopping machine '{}' ({})", name(), id);
        try {
            driver.requestShutdown();
        } catch (IOException e) {
            LOG.warn("Shutdown request to machine '{}' failed: {}", name(), e.getMessage());
        }

        for (int attempt = 0; attempt < settings.stopAttempts(); attempt++) {
            if (!driver.isRunning()) {
                state.set(VmState.READY);
                LOG.info("Machine '{}' ({}) stopped", name(), id);
                return;
            }
            Thread.sleep(settings.stopPollInterval().toMillis());
        }
        if (!driver.isRunning()) {
            state.set(VmState.READY);
            return;
        }

        state.set(VmState.BROKEN);
        LOG.error("Machine '{}' ({}) did not shut down after {} checks, powering it off",
            name(), id, settings.stopAttempts());
        driver.forceStop();
        state.set(VmState.READY);
    }

    @Override
    public void close(boolean force) throws VmTeardownException {
        var current = state.get();
        if (current == VmState.DELETED) {
            return;
        }

        var errors = new ArrayList<Exception>();
        try {
            LOG.info("Closing machine '{}' ({}), force: {}", name(), id, force);
            if (current != VmState.READY && current != VmState.INITIALIZING) {
                if (force) {
                    state.set(VmState.CHANGING);
                    forceStop(errors);
                } else {
                    try {
                        stop();
                    } catch (InvalidStateException | IOException e) {
                        LOG.warn("Cannot stop machine '{}' gracefully: {}", name(), e.getMessage());
                        state.set(VmState.CHANGING);
                        forceStop(errors);
                    }
                }
            }

            try {
                driver.release();
            } catch (IOException | RuntimeException e) {
                LOG.error("Cannot release resources of machine '{}' ({}): {}", name(), id, e.getMessage(), e);
                errors.add(e);
            }
            deleteWorkDir(errors);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add(e);
        } finally {
            console.close();
            state.set(VmState.DELETED);
            unregister();
        }

        if (!errors.isEmpty()) {
            throw new VmTeardownException(String.valueOf(name()), errors);
        }
        LOG.info("Machine '{}' ({}) closed", name(), id);
    }

    @Override
    public InputStream downloadDisk() throws InvalidStateException, IOException {
        var current = state.get();
        if (current != VmState.READY) {
            throw new InvalidStateException("the machine must be in a stopped or ready state", current);
        }
        return Files.newInputStream(driver.disk());
    }

    @Override
    public VmDetails details() {
        var a = args;
        var config = a == null ? null : a.config();
        return new VmDetails(
            id,
            name(),
            virtualizer,
            type,
            state.get(),
            created,
            config == null ? null : config.kernel(),
            config == null ? 0 : config.cpus(),
            config == null ? 0 : config.memoryMib(),
            config == null ? null : config.hostname(),
            VmDetails.describe(routes));
    }

    PrepareContext prepareContext(Operation op) {
        return new PrepareContext(id, args, op, routes, workDir);
    }

    MachineDriver driver() {
        return driver;
    }

    /**
     * Last preparation step: the machine becomes ready and visible under its name.
     */
    void completePreparation() throws AlreadyExistsException, InvalidStateException {
        if (!state.compareAndSet(VmState.INITIALIZING, VmState.READY)) {
            throw new InvalidStateException("vm was closed during preparation", state.get());
        }
        if (!registry.register(name(), this)) {
            throw new AlreadyExistsException("virtual machine already exists");
        }
    }

    /**
     * Undoes a failed preparation. Leaves the machine deleted.
     */
    void abortPreparation() {
        try {
            driver.release();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while releasing machine '{}' ({})", name(), id);
        } catch (IOException | RuntimeException e) {
            LOG.error("Cannot release resources of machine '{}' ({}): {}", name(), id, e.getMessage(), e);
        }
        deleteWorkDir(new ArrayList<>());
        console.close();
        state.set(VmState.DELETED);
        unregister();
    }

    private void forceStop(List<Exception> errors) throws InterruptedException {
        try {
            driver.forceStop();
        } catch (IOException | RuntimeException e) {
            LOG.error("Cannot power off machine '{}' ({}): {}", name(), id, e.getMessage(), e);
            errors.add(e);
        }
    }

    private void unregister() {
        var n = name();
        if (n != null) {
            registry.remove(n, this);
        }
    }

    private void deleteWorkDir(List<Exception> errors) {
        var dir = workDir;
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> files = Files.walk(dir)) {
            for (var path : files.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            LOG.warn("Cannot remove working directory {} of machine '{}': {}", dir, name(), e.getMessage());
            errors.add(e);
        }
    }

    private void startWatcher() {
        var watcher = new Thread(() -> {
            try {
                int code = driver.awaitExit();
                if (state.compareAndSet(VmState.ALIVE, VmState.READY)) {
                    if (code == 0) {
                        LOG.info("Machine '{}' ({}) powered off", name(), id);
                    } else {
                        LOG.warn("Machine '{}' ({}) exited with code {}", name(), id, code);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "vm-watcher-" + id);
        watcher.setDaemon(true);
        watcher.start();
    }

    private void startIpLookout() {
        var lookout = new Thread(new IpLookout(String.valueOf(name()), console.subscribe(), routes,
            settings.ipLookupTimeout()), "ip-lookout-" + id);
        lookout.setDaemon(true);
        lookout.start();
    }

    @Override
    public String toString() {
        return "ManagedVm{id='" + id + "', name='" + name() + "', type='" + type + "', state=" + state.get() + "}";
    }
}
