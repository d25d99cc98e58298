package ai.vmhost.common;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs short-lived host commands (device management, hypervisor control tools) and collects their output.
 */
public final class ProcessRunner {
    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    private final Duration timeout;

    public ProcessRunner(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    public Result run(String... cmd) throws IOException, InterruptedException {
        return run(List.of(cmd));
    }

    public Result run(List<String> cmd) throws IOException, InterruptedException {
        if (cmd.isEmpty()) {
            throw new IllegalStateException("Cannot create process without command");
        }

        LOG.debug("Execute {}", cmd);
        var process = new ProcessBuilder(cmd)
            .redirectErrorStream(true)
            .start();
        process.getOutputStream().close();

        var lines = new ArrayList<String>();
        var reader = new Thread(() -> {
            try (var in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)))
            {
                String s;
                while ((s = in.readLine()) != null) {
                    synchronized (lines) {
                        lines.add(s);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Output of process {} closed: {}", process.pid(), e.getMessage());
            }
        }, "process-output-" + process.pid());
        reader.setDaemon(true);
        reader.start();

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            LOG.warn("Still waiting after {} to process {} ({}) to finish. Destroying...",
                timeout, process.pid(), cmd.get(0));
            process.destroyForcibly();
            process.waitFor();
            reader.join(1000);
            throw new IOException("Command '%s' timed out after %s".formatted(String.join(" ", cmd), timeout));
        }
        reader.join(1000);

        String output;
        synchronized (lines) {
            output = String.join("\n", lines);
        }
        LOG.debug("Process {} finished with code: {}", process.pid(), process.exitValue());
        return new Result(cmd, process.exitValue(), output);
    }

    /**
     * Runs the command and fails with its output when the exit code is non-zero.
     */
    public String runChecked(String... cmd) throws IOException, InterruptedException {
        var result = run(cmd);
        if (!result.success()) {
            throw new CommandFailedException(result);
        }
        return result.output();
    }

    public record Result(
        List<String> command,
        int exitCode,
        String output
    ) {
        public boolean success() {
            return exitCode == 0;
        }
    }

    public static final class CommandFailedException extends IOException {
        private final Result result;

        public CommandFailedException(Result result) {
            super("Command '%s' failed with code %d: %s".formatted(
                String.join(" ", result.command()), result.exitCode(), result.output().strip()));
            this.result = result;
        }

        public Result result() {
            return result;
        }
    }
}
