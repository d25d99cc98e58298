package ai.vmhost.virtualizer.backend.qemu;

import ai.vmhost.virtualizer.model.VmConfig;
import ai.vmhost.virtualizer.net.PortBinder;
import org.apache.commons.lang3.SystemUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line of a qemu machine.
 */
final class QemuCommand {

    private QemuCommand() {
    }

    /**
     * @param forwards host port bindings per interface, index {@code i} for interface {@code i}
     */
    static List<String> build(String binary, String vmName, VmConfig config, Path disk, String monitor,
                              boolean headless, List<List<PortBinder.Binding>> forwards)
    {
        var args = new ArrayList<String>();
        args.add(binary);
        args.addAll(accelerator());
        args.addAll(List.of(
            "-name", vmName,
            "-smp", Integer.toString(config.cpus()),
            "-m", config.memoryMib() + "M",
            "-no-reboot",
            "-serial", "stdio",
            "-monitor", monitor,
            "-drive", "if=virtio,file=" + disk + ",format=qcow2"));
        if (headless) {
            args.addAll(List.of("-display", "none"));
        }
        for (int i = 0; i < forwards.size(); i++) {
            args.addAll(nicArgs(i, forwards.get(i)));
        }
        return args;
    }

    static List<String> nicArgs(int index, List<PortBinder.Binding> bindings) {
        var netdev = new StringBuilder("user,id=network").append(index);
        for (var b : bindings) {
            netdev.append(",hostfwd=").append(b.protocol().transport())
                .append("::").append(b.hostPort())
                .append("-:").append(b.guestPort());
        }
        var mac = "26:10:05:00:00:%02x".formatted(0xa + index);
        return List.of(
            "-netdev", netdev.toString(),
            "-device", "virtio-net-pci,netdev=network%d,id=virtio%d,mac=%s".formatted(index, index, mac));
    }

    /**
     * Monitor endpoint: a named pipe on Windows, a Unix socket in the machine directory elsewhere.
     */
    static String monitorArg(Path endpoint, String vmId) {
        if (SystemUtils.IS_OS_WINDOWS) {
            return "pipe:vmhost-" + vmId;
        }
        return "unix:" + endpoint + ",server,nowait";
    }

    static Path monitorEndpoint(Path workDir, String vmId) {
        if (SystemUtils.IS_OS_WINDOWS) {
            return Path.of("\\\\.\\pipe\\vmhost-" + vmId);
        }
        return workDir.resolve("monitor.sock");
    }

    private static List<String> accelerator() {
        if (SystemUtils.IS_OS_WINDOWS) {
            return List.of("-accel", "whpx");
        }
        if (SystemUtils.IS_OS_MAC) {
            return List.of("-accel", "hvf");
        }
        if (Files.exists(Path.of("/dev/kvm"))) {
            return List.of("-cpu", "host", "-enable-kvm");
        }
        return List.of();
    }
}
