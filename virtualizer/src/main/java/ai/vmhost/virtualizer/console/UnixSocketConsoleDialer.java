package ai.vmhost.virtualizer.console;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

@Singleton
@Requires(notOs = Requires.Family.WINDOWS)
public class UnixSocketConsoleDialer implements ConsoleDialer {
    private static final Logger LOG = LogManager.getLogger(UnixSocketConsoleDialer.class);
    private static final Duration RETRY_INTERVAL = Duration.ofMillis(100);

    @Override
    public ConsoleConnection dial(Path endpoint, Duration timeout) throws IOException, InterruptedException {
        var deadline = Instant.now().plus(timeout);
        while (true) {
            var channel = SocketChannel.open(StandardProtocolFamily.UNIX);
            try {
                channel.connect(UnixDomainSocketAddress.of(endpoint));
                LOG.debug("Connected to console socket {}", endpoint);
                return new Connection(channel);
            } catch (IOException e) {
                channel.close();
                if (Instant.now().isAfter(deadline)) {
                    throw new IOException("cannot connect to console socket " + endpoint + ": " + e.getMessage(), e);
                }
            }
            Thread.sleep(RETRY_INTERVAL.toMillis());
        }
    }

    // Channels.newInputStream/newOutputStream serialize on the channel's blocking lock, so a pending read would
    // block every write. These streams call the channel directly.
    private static final class Connection implements ConsoleConnection {
        private final SocketChannel channel;
        private final InputStream input;
        private final OutputStream output;

        Connection(SocketChannel channel) {
            this.channel = channel;
            this.input = new InputStream() {
                @Override
                public int read() throws IOException {
                    var b = new byte[1];
                    int n = read(b, 0, 1);
                    return n < 0 ? -1 : b[0] & 0xff;
                }

                @Override
                public int read(byte[] b, int off, int len) throws IOException {
                    if (len == 0) {
                        return 0;
                    }
                    return channel.read(ByteBuffer.wrap(b, off, len));
                }
            };
            this.output = new OutputStream() {
                @Override
                public void write(int b) throws IOException {
                    write(new byte[] {(byte) b}, 0, 1);
                }

                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    var buf = ByteBuffer.wrap(b, off, len);
                    while (buf.hasRemaining()) {
                        channel.write(buf);
                    }
                }
            };
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
            channel.close();
        }
    }
}
