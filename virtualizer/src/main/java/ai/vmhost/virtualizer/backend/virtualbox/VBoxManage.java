package ai.vmhost.virtualizer.backend.virtualbox;

import ai.vmhost.common.ProcessRunner;
import ai.vmhost.virtualizer.util.HostExecutables;
import com.google.common.annotations.VisibleForTesting;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin wrapper over the {@code VBoxManage} command line tool.
 */
class VBoxManage {
    private final String binary;
    private final ProcessRunner runner;

    VBoxManage(String binary, ProcessRunner runner) {
        this.binary = binary;
        this.runner = runner;
    }

    String binary() {
        return binary;
    }

    /**
     * Runs {@code VBoxManage args...} and returns its output.
     */
    String run(List<String> args) throws IOException, InterruptedException {
        var cmd = new ArrayList<String>(args.size() + 1);
        cmd.add(HostExecutables.resolve(binary));
        cmd.addAll(args);
        return runner.runChecked(cmd.toArray(new String[0]));
    }

    String run(String... args) throws IOException, InterruptedException {
        return run(List.of(args));
    }

    /**
     * @param kind {@code bridgedifs} or {@code hostonlyifs}
     */
    List<String> listInterfaces(String kind) throws IOException, InterruptedException {
        return parseNames(run("list", kind));
    }

    /**
     * @return value of {@code VMState}, e.g. {@code running} or {@code poweroff}
     */
    String vmState(String vm) throws IOException, InterruptedException {
        return parseVmState(run("showvminfo", vm, "--machinereadable"));
    }

    @VisibleForTesting
    static List<String> parseNames(String output) {
        var names = new ArrayList<String>();
        for (var line : output.split("\\r?\\n")) {
            if (line.startsWith("Name:")) {
                names.add(line.substring("Name:".length()).strip());
            }
        }
        return names;
    }

    @VisibleForTesting
    static String parseVmState(String output) {
        for (var line : output.split("\\r?\\n")) {
            if (line.startsWith("VMState=")) {
                var value = line.substring("VMState=".length()).strip();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }
        return "unknown";
    }
}
