package ai.vmhost.virtualizer.console;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Connects to a local console transport exposed by a hypervisor process: a Unix domain socket on Linux and macOS,
 * a named pipe on Windows. The transport usually appears some time after the process is launched, so dialing
 * retries until {@code timeout} elapses.
 */
public interface ConsoleDialer {

    ConsoleConnection dial(Path endpoint, Duration timeout) throws IOException, InterruptedException;
}
