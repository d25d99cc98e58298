package ai.vmhost.virtualizer.util;

import org.apache.commons.lang3.SystemUtils;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Looks hypervisor executables up on {@code PATH} and in the usual installation directories.
 */
public final class HostExecutables {

    private HostExecutables() {
    }

    public static Optional<Path> find(String executable) {
        return find(executable, System.getenv("PATH"));
    }

    static Optional<Path> find(String executable, String pathEnv) {
        var direct = Path.of(executable);
        if (direct.getParent() != null) {
            return isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }

        for (var dir : searchDirs(pathEnv)) {
            for (var name : candidateNames(executable)) {
                var candidate = dir.resolve(name);
                if (isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Resolved location of {@code executable}, or the name itself to be resolved by the OS at launch.
     */
    public static String resolve(String executable) {
        return find(executable).map(Path::toString).orElse(executable);
    }

    private static List<Path> searchDirs(String pathEnv) {
        var dirs = new ArrayList<Path>();
        if (pathEnv != null) {
            for (var entry : pathEnv.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    dirs.add(Path.of(entry));
                }
            }
        }

        if (SystemUtils.IS_OS_WINDOWS) {
            dirs.add(Path.of("C:\\Program Files\\Oracle\\VirtualBox"));
            dirs.add(Path.of("C:\\Program Files\\qemu"));
        } else if (SystemUtils.IS_OS_MAC) {
            dirs.add(Path.of("/usr/local/bin"));
            dirs.add(Path.of("/opt/homebrew/bin"));
            dirs.add(Path.of("/Applications/VirtualBox.app/Contents/MacOS"));
        } else {
            dirs.add(Path.of("/usr/bin"));
            dirs.add(Path.of("/usr/local/bin"));
            dirs.add(Path.of("/usr/lib/virtualbox"));
        }
        return dirs;
    }

    private static List<String> candidateNames(String executable) {
        if (SystemUtils.IS_OS_WINDOWS && !executable.toLowerCase().endsWith(".exe")) {
            return List.of(executable + ".exe", executable);
        }
        return List.of(executable);
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
