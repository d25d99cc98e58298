package ai.vmhost.virtualizer.console;

import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Byte channel to a machine's serial console or monitor. Reading and writing may happen on different threads.
 */
public interface ConsoleConnection extends Closeable {

    InputStream input();

    OutputStream output();
}
