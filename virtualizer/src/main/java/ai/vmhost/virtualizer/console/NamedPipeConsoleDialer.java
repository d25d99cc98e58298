package ai.vmhost.virtualizer.console;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

@Singleton
@Requires(os = Requires.Family.WINDOWS)
public class NamedPipeConsoleDialer implements ConsoleDialer {
    private static final Logger LOG = LogManager.getLogger(NamedPipeConsoleDialer.class);
    private static final Duration RETRY_INTERVAL = Duration.ofMillis(100);

    @Override
    public ConsoleConnection dial(Path endpoint, Duration timeout) throws IOException, InterruptedException {
        var deadline = Instant.now().plus(timeout);
        while (true) {
            try {
                var pipe = new RandomAccessFile(endpoint.toString(), "rw");
                LOG.debug("Connected to console pipe {}", endpoint);
                return new Connection(pipe);
            } catch (FileNotFoundException e) {
                // pipe is not created yet or is busy
                if (Instant.now().isAfter(deadline)) {
                    throw new IOException("cannot open console pipe " + endpoint + ": " + e.getMessage(), e);
                }
            }
            Thread.sleep(RETRY_INTERVAL.toMillis());
        }
    }

    private static final class Connection implements ConsoleConnection {
        private final RandomAccessFile pipe;
        private final InputStream input;
        private final OutputStream output;

        Connection(RandomAccessFile pipe) throws IOException {
            this.pipe = pipe;
            this.input = new FileInputStream(pipe.getFD());
            this.output = new FileOutputStream(pipe.getFD());
        }

        @Override
        public InputStream input() {
            return input;
        }

        @Override
        public OutputStream output() {
            return output;
        }

        @Override
        public void close() throws IOException {
            pipe.close();
        }
    }
}
