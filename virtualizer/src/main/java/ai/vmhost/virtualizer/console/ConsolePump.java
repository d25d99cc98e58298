package ai.vmhost.virtualizer.console;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Copies a machine's console output into its broadcaster until either side ends.
 */
public final class ConsolePump extends Thread {
    private static final Logger LOG = LogManager.getLogger(ConsolePump.class);

    private final InputStream source;
    private final Broadcaster console;

    public ConsolePump(String vmName, InputStream source, Broadcaster console) {
        super("console-pump-" + vmName);
        setDaemon(true);
        this.source = source;
        this.console = console;
    }

    @Override
    public void run() {
        var buf = new byte[4096];
        try {
            int n;
            while ((n = source.read(buf)) >= 0) {
                if (n > 0) {
                    console.write(buf, 0, n);
                }
            }
            LOG.debug("{}: console source reached end of stream", getName());
        } catch (EOFException e) {
            LOG.debug("{}: console closed", getName());
        } catch (IOException e) {
            if (!console.isClosed()) {
                LOG.warn("{}: console source failed: {}", getName(), e.getMessage());
            }
        } finally {
            try {
                source.close();
            } catch (IOException e) {
                LOG.debug("{}: cannot close console source: {}", getName(), e.getMessage());
            }
        }
    }
}
