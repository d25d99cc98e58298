package ai.vmhost.virtualizer.backend.virtualbox;

import ai.vmhost.virtualizer.backend.MachineDriver;
import ai.vmhost.virtualizer.backend.PrepareContext;
import ai.vmhost.virtualizer.console.Broadcaster;
import ai.vmhost.virtualizer.console.ConsoleConnection;
import ai.vmhost.virtualizer.console.ConsoleDialer;
import ai.vmhost.virtualizer.console.ConsolePump;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.model.NetworkInterface;
import ai.vmhost.virtualizer.net.PortBinder;
import jakarta.annotation.Nullable;
import org.apache.commons.lang3.SystemUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Registers the machine with VirtualBox and drives it through {@code VBoxManage}. The serial port is exposed as a
 * local pipe and read into the console.
 */
final class VirtualBoxDriver implements MachineDriver {
    private static final Logger LOG = LogManager.getLogger(VirtualBoxDriver.class);

    private static final String STORAGE_CONTROLLER = "SATA";
    private static final Set<String> STOPPED_STATES = Set.of("poweroff", "aborted", "saved", "unknown");

    private final VirtualBoxBackend backend;
    private final VBoxManage vbox;
    private final ConsoleDialer dialer;
    private final Duration dialTimeout;
    private final Duration pollInterval;

    private VirtualBoxBackend.Settings settings = new VirtualBoxBackend.Settings(true, null, null);
    @Nullable
    private String machine;
    @Nullable
    private String vmName;
    @Nullable
    private Path disk;
    @Nullable
    private Path serialEndpoint;
    private volatile boolean registered = false;
    private volatile boolean diskAttached = false;
    @Nullable
    private volatile ConsoleConnection serial;

    VirtualBoxDriver(VirtualBoxBackend backend, VBoxManage vbox, ConsoleDialer dialer, Duration dialTimeout,
                     Duration pollInterval)
    {
        this.backend = backend;
        this.vbox = vbox;
        this.dialer = dialer;
        this.dialTimeout = dialTimeout;
        this.pollInterval = pollInterval;
    }

    @Override
    public void initialize(byte[] data) throws InvalidConfigurationException {
        settings = backend.parseSettings(data);
    }

    @Override
    public void prepare(PrepareContext ctx) throws IOException, InterruptedException {
        var op = ctx.op();
        var config = ctx.args().config();
        vmName = ctx.args().name();
        disk = ctx.args().disk();
        machine = "vmhost-" + ctx.vmId();
        serialEndpoint = SystemUtils.IS_OS_WINDOWS
            ? Path.of("\\\\.\\pipe\\vmhost-" + ctx.vmId())
            : ctx.workDir().resolve("serial.sock");

        op.updateStatus("Registering virtualbox machine " + machine);
        vbox.run("createvm", "--name", machine, "--basefolder", ctx.workDir().toString(), "--register");
        registered = true;

        var modify = new ArrayList<>(List.of("modifyvm", machine,
            "--memory", Integer.toString(config.memoryMib()),
            "--cpus", Integer.toString(config.cpus()),
            "--ostype", "Linux26_64",
            "--acpi", "on",
            "--ioapic", "on",
            "--longmode", "on",
            "--biosbootmenu", "disabled",
            "--rtcuseutc", "on",
            "--uart1", "0x3F8", "4",
            "--uartmode1", "server", serialEndpoint.toString()));
        modify.addAll(networkArgs(ctx.routes().interfaces()));
        op.log("Configuring %s with %d interface(s) on %s networking", machine, ctx.routes().size(),
            settings.networkType());
        vbox.run(modify);

        op.updateStatus("Attaching disk " + disk);
        vbox.run("storagectl", machine, "--name", STORAGE_CONTROLLER, "--add", "sata", "--portcount", "1",
            "--bootable", "on");
        vbox.run("storageattach", machine, "--storagectl", STORAGE_CONTROLLER, "--port", "0", "--device", "0",
            "--type", "hdd", "--medium", disk.toString());
        diskAttached = true;
    }

    private List<String> networkArgs(List<NetworkInterface> nics) throws IOException {
        var args = new ArrayList<String>();
        for (var nic : nics) {
            int slot = nic.index() + 1;
            args.addAll(List.of("--nic" + slot, settings.networkType(),
                "--nictype" + slot, "virtio",
                "--cableconnected" + slot, "on"));

            switch (settings.networkType()) {
                case VirtualBoxBackend.NETWORK_BRIDGED ->
                    args.addAll(List.of("--bridgeadapter" + slot, settings.networkDevice()));
                case VirtualBoxBackend.NETWORK_HOSTONLY ->
                    args.addAll(List.of("--hostonlyadapter" + slot, settings.networkDevice()));
                default -> {
                    for (var route : nic.routes()) {
                        var binding = PortBinder.bind(route.protocol(), route.port());
                        route.setAddress(binding.address());
                        args.addAll(List.of("--natpf" + slot, "%s%s%d,%s,,%d,,%d".formatted(
                            route.protocol().value(), route.port(), slot, route.protocol().transport(),
                            binding.hostPort(), binding.guestPort())));
                    }
                }
            }

            if (!VirtualBoxBackend.NETWORK_NAT.equals(settings.networkType()) && !nic.dhcp() && nic.ip() != null) {
                nic.assignAddress(nic.ip());
            }
        }
        return args;
    }

    @Override
    public void launch(Broadcaster console) throws IOException, InterruptedException {
        disconnectSerial();
        vbox.run("startvm", machine, "--type", settings.headless() ? "headless" : "gui");

        try {
            var conn = dialer.dial(serialEndpoint, dialTimeout);
            serial = conn;
            new ConsolePump(vmName, conn.input(), console).start();
        } catch (IOException e) {
            LOG.error("Cannot attach to the serial console of {}: {}", vmName, e.getMessage());
            try {
                vbox.run("controlvm", machine, "poweroff");
            } catch (IOException ex) {
                e.addSuppressed(ex);
            }
            throw e;
        }
    }

    @Override
    public int awaitExit() throws InterruptedException {
        while (isRunning()) {
            Thread.sleep(pollInterval.toMillis());
        }
        return 0;
    }

    @Override
    public void requestShutdown() throws IOException, InterruptedException {
        vbox.run("controlvm", machine, "acpipowerbutton");
    }

    @Override
    public boolean isRunning() {
        if (!registered) {
            return false;
        }
        try {
            return !STOPPED_STATES.contains(vbox.vmState(machine));
        } catch (IOException e) {
            LOG.debug("Cannot read state of {}: {}", machine, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void forceStop() throws IOException, InterruptedException {
        if (isRunning()) {
            vbox.run("controlvm", machine, "poweroff");
        }
    }

    @Override
    public void release() throws IOException, InterruptedException {
        disconnectSerial();
        if (!registered) {
            return;
        }
        forceStop();
        // detach first, otherwise unregistervm --delete removes the disk image too
        if (diskAttached) {
            vbox.run("storageattach", machine, "--storagectl", STORAGE_CONTROLLER, "--port", "0", "--device", "0",
                "--medium", "none");
            diskAttached = false;
        }
        vbox.run("unregistervm", machine, "--delete");
        registered = false;
    }

    @Override
    public Path disk() {
        return disk;
    }

    private void disconnectSerial() {
        var conn = serial;
        serial = null;
        if (conn != null) {
            try {
                conn.close();
            } catch (IOException e) {
                LOG.debug("Cannot close serial console of {}: {}", vmName, e.getMessage());
            }
        }
    }
}
