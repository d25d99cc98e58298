package ai.vmhost.virtualizer.backend.firecracker;

import ai.vmhost.netprov.NetworkProvisioningClient;
import ai.vmhost.virtualizer.backend.MachineDriver;
import ai.vmhost.virtualizer.backend.PrepareContext;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.console.Broadcaster;
import ai.vmhost.virtualizer.console.ConsoleDialer;
import ai.vmhost.virtualizer.console.ConsolePump;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.util.HostExecutables;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a machine as a firecracker process. Network interfaces are tap devices owned by the network helper.
 */
final class FirecrackerDriver implements MachineDriver {
    private static final Logger LOG = LogManager.getLogger(FirecrackerDriver.class);

    // tap device names are limited to 15 characters
    private static final int DEVICE_PREFIX_LENGTH = 8;
    private static final Duration KILL_TIMEOUT = Duration.ofSeconds(5);

    private final FirecrackerBackend backend;
    private final VirtualizerConfig.Firecracker config;
    private final Duration dialTimeout;
    private final KernelCache kernels;
    private final NetworkProvisioningClient networkHelper;
    private final ConsoleDialer dialer;
    private final ObjectMapper mapper;

    private List<String> devices = List.of();
    @Nullable
    private Path disk;
    @Nullable
    private Path configFile;
    @Nullable
    private Path apiSocket;
    @Nullable
    private String vmName;
    @Nullable
    private volatile Process process;

    FirecrackerDriver(FirecrackerBackend backend, VirtualizerConfig.Firecracker config, Duration dialTimeout,
                      KernelCache kernels, NetworkProvisioningClient networkHelper, ConsoleDialer dialer,
                      ObjectMapper mapper)
    {
        this.backend = backend;
        this.config = config;
        this.dialTimeout = dialTimeout;
        this.kernels = kernels;
        this.networkHelper = networkHelper;
        this.dialer = dialer;
        this.mapper = mapper;
    }

    @Override
    public void initialize(byte[] data) throws InvalidConfigurationException {
        backend.parseSettings(data);
    }

    @Override
    public void prepare(PrepareContext ctx) throws Exception {
        var op = ctx.op();
        var vmConfig = ctx.args().config();
        vmName = ctx.args().name();
        disk = ctx.args().disk();
        apiSocket = ctx.workDir().resolve("firecracker.socket");
        configFile = ctx.workDir().resolve("config.json");

        op.updateStatus("Building firecracker command and tap interfaces...");
        var kernel = kernels.fetch(vmConfig.kernel(), op);

        int nics = ctx.routes().size();
        if (nics > 0) {
            var prefix = ctx.vmId().substring(0, Math.min(DEVICE_PREFIX_LENGTH, ctx.vmId().length()));
            op.log("Requesting %d tap device(s) from the network helper", nics);
            devices = networkHelper.createDevices(prefix, nics);
            if (devices.size() != nics) {
                throw new IOException("network helper returned %d device(s) for %d interface(s)"
                    .formatted(devices.size(), nics));
            }
        }

        // statically addressed interfaces are reachable right away, the others report over the console
        for (var nic : ctx.routes().interfaces()) {
            if (!nic.dhcp() && nic.ip() != null) {
                nic.assignAddress(nic.ip());
            }
        }

        var interfaces = new ArrayList<FirecrackerMachineConfig.NetworkInterface>();
        for (int i = 0; i < devices.size(); i++) {
            interfaces.add(new FirecrackerMachineConfig.NetworkInterface("eth" + i, devices.get(i)));
        }
        var machine = new FirecrackerMachineConfig(
            new FirecrackerMachineConfig.BootSource(kernel.toString(), config.getBootArgs()),
            List.of(new FirecrackerMachineConfig.Drive("rootfs", disk.toString(), true, false)),
            new FirecrackerMachineConfig.MachineConfig(vmConfig.cpus(), vmConfig.memoryMib()),
            interfaces);
        mapper.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), machine);
        op.log("Firecracker configuration written to %s", configFile);
    }

    @Override
    public void launch(Broadcaster console) throws IOException, InterruptedException {
        Files.deleteIfExists(apiSocket);

        var command = List.of(HostExecutables.resolve(config.getBinary()),
            "--api-sock", apiSocket.toString(),
            "--config-file", configFile.toString());
        LOG.debug("Launching {}: {}", vmName, String.join(" ", command));

        var proc = new ProcessBuilder(command)
            .directory(apiSocket.getParent().toFile())
            .redirectErrorStream(true)
            .start();
        process = proc;
        new ConsolePump(vmName, proc.getInputStream(), console).start();

        var deadline = Instant.now().plus(dialTimeout);
        while (!Files.exists(apiSocket)) {
            if (!proc.isAlive()) {
                throw new IOException("firecracker exited with code " + proc.exitValue());
            }
            if (Instant.now().isAfter(deadline)) {
                proc.destroyForcibly();
                throw new IOException("firecracker did not open its API socket within " + dialTimeout);
            }
            Thread.sleep(50);
        }
    }

    @Override
    public int awaitExit() throws InterruptedException {
        var proc = process;
        return proc == null ? 0 : proc.waitFor();
    }

    @Override
    public void requestShutdown() throws IOException, InterruptedException {
        new FirecrackerApi(dialer, apiSocket, dialTimeout).sendCtrlAltDel();
    }

    @Override
    public boolean isRunning() {
        var proc = process;
        return proc != null && proc.isAlive();
    }

    @Override
    public void forceStop() throws InterruptedException {
        var proc = process;
        if (proc == null || !proc.isAlive()) {
            return;
        }
        proc.destroyForcibly();
        if (!proc.waitFor(KILL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            LOG.warn("Firecracker process of {} is still alive after kill", vmName);
        }
    }

    @Override
    public void release() throws IOException, InterruptedException {
        forceStop();
        if (!devices.isEmpty()) {
            LOG.debug("Deleting tap devices {} of {}", devices, vmName);
            networkHelper.deleteDevices(devices);
            devices = List.of();
        }
    }

    @Override
    public Path disk() {
        return disk;
    }
}
