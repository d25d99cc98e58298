package ai.vmhost.virtualizer.backend.qemu;

import ai.vmhost.virtualizer.backend.MachineDriver;
import ai.vmhost.virtualizer.backend.PrepareContext;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.console.Broadcaster;
import ai.vmhost.virtualizer.console.ConsoleConnection;
import ai.vmhost.virtualizer.console.ConsoleDialer;
import ai.vmhost.virtualizer.console.ConsolePump;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.net.PortBinder;
import ai.vmhost.virtualizer.util.HostExecutables;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a machine as a qemu process with user-mode networking. Guest ports are forwarded from host ports.
 */
final class QemuDriver implements MachineDriver {
    private static final Logger LOG = LogManager.getLogger(QemuDriver.class);
    private static final Duration QUIT_TIMEOUT = Duration.ofSeconds(5);

    private final QemuBackend backend;
    private final VirtualizerConfig.Qemu config;
    private final Duration dialTimeout;
    private final ConsoleDialer dialer;

    private QemuBackend.Settings settings = new QemuBackend.Settings(true);
    @Nullable
    private List<String> command;
    @Nullable
    private Path monitorEndpoint;
    @Nullable
    private Path workDir;
    @Nullable
    private Path disk;
    @Nullable
    private String vmName;
    @Nullable
    private volatile Process process;
    @Nullable
    private volatile ConsoleConnection monitor;

    QemuDriver(QemuBackend backend, VirtualizerConfig.Qemu config, Duration dialTimeout, ConsoleDialer dialer) {
        this.backend = backend;
        this.config = config;
        this.dialTimeout = dialTimeout;
        this.dialer = dialer;
    }

    @Override
    public void initialize(byte[] data) throws InvalidConfigurationException {
        settings = backend.parseSettings(data);
    }

    @Override
    public void prepare(PrepareContext ctx) throws IOException {
        var op = ctx.op();
        vmName = ctx.args().name();
        disk = ctx.args().disk();
        workDir = ctx.workDir();
        monitorEndpoint = QemuCommand.monitorEndpoint(ctx.workDir(), ctx.vmId());

        op.updateStatus("Binding host ports...");
        var forwards = new ArrayList<List<PortBinder.Binding>>();
        for (var nic : ctx.routes().interfaces()) {
            var bindings = new ArrayList<PortBinder.Binding>();
            for (var route : nic.routes()) {
                var binding = PortBinder.bind(route.protocol(), route.port());
                route.setAddress(binding.address());
                bindings.add(binding);
                op.log("%s port %s is reachable at %s", route.protocol().value(), route.port(), binding.address());
            }
            forwards.add(bindings);
        }

        command = QemuCommand.build(HostExecutables.resolve(config.getBinary()), vmName, ctx.args().config(), disk,
            QemuCommand.monitorArg(monitorEndpoint, ctx.vmId()), settings.headless(), forwards);
        op.log("Qemu command: %s", String.join(" ", command));
    }

    @Override
    public void launch(Broadcaster console) throws IOException, InterruptedException {
        disconnectMonitor();
        LOG.debug("Launching {}: {}", vmName, String.join(" ", command));
        var proc = new ProcessBuilder(command)
            .directory(workDir.toFile())
            .redirectErrorStream(true)
            .start();
        process = proc;
        new ConsolePump(vmName, proc.getInputStream(), console).start();

        try {
            monitor = dialer.dial(monitorEndpoint, dialTimeout);
        } catch (IOException e) {
            proc.destroyForcibly();
            throw new IOException("cannot connect to qemu monitor of " + vmName + ": " + e.getMessage(), e);
        }
        startMonitorReader(monitor);
    }

    @Override
    public int awaitExit() throws InterruptedException {
        var proc = process;
        return proc == null ? 0 : proc.waitFor();
    }

    @Override
    public void requestShutdown() throws IOException {
        sendMonitorCommand("system_powerdown");
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
        try {
            sendMonitorCommand("quit");
        } catch (IOException e) {
            LOG.debug("Cannot send quit to qemu monitor of {}: {}", vmName, e.getMessage());
        }
        if (!proc.waitFor(QUIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            LOG.warn("Qemu of {} ignored quit, killing it", vmName);
            proc.destroyForcibly();
            proc.waitFor(QUIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void release() throws IOException, InterruptedException {
        forceStop();
        disconnectMonitor();
    }

    @Override
    public Path disk() {
        return disk;
    }

    /**
     * Drops the monitor connection of the previous run, if any.
     */
    private void disconnectMonitor() {
        var conn = monitor;
        monitor = null;
        if (conn != null) {
            try {
                conn.close();
            } catch (IOException e) {
                LOG.debug("Cannot close qemu monitor of {}: {}", vmName, e.getMessage());
            }
        }
    }

    private void startMonitorReader(ConsoleConnection conn) {
        var reader = new Thread(() -> {
            var buf = new byte[1024];
            try {
                int n;
                while ((n = conn.input().read(buf)) >= 0) {
                    LOG.trace("qemu monitor of {}: {}", vmName, new String(buf, 0, n, StandardCharsets.UTF_8));
                }
            } catch (IOException e) {
                LOG.debug("qemu monitor of {} closed: {}", vmName, e.getMessage());
            }
        }, "qemu-monitor-" + vmName);
        reader.setDaemon(true);
        reader.start();
    }

    private void sendMonitorCommand(String cmd) throws IOException {
        var conn = monitor;
        if (conn == null) {
            throw new IOException("qemu monitor of " + vmName + " is not connected");
        }
        var out = conn.output();
        out.write((cmd + "\n").getBytes(StandardCharsets.US_ASCII));
        out.flush();
    }
}
