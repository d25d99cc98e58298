package ai.vmhost.virtualizer.console;

/**
 * Keeps the last {@code capacity} bytes written to it. Not thread-safe.
 */
final class CircularByteBuffer {
    private final byte[] data;
    private int start = 0;
    private int size = 0;
    private long written = 0;

    CircularByteBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive");
        }
        this.data = new byte[capacity];
    }

    void write(byte[] b, int off, int len) {
        written += len;
        if (len >= data.length) {
            System.arraycopy(b, off + len - data.length, data, 0, data.length);
            start = 0;
            size = data.length;
            return;
        }

        int end = (start + size) % data.length;
        int first = Math.min(len, data.length - end);
        System.arraycopy(b, off, data, end, first);
        System.arraycopy(b, off + first, data, 0, len - first);

        int overflow = size + len - data.length;
        if (overflow > 0) {
            start = (start + overflow) % data.length;
            size = data.length;
        } else {
            size += len;
        }
    }

    byte[] snapshot() {
        var out = new byte[size];
        int first = Math.min(size, data.length - start);
        System.arraycopy(data, start, out, 0, first);
        System.arraycopy(data, 0, out, first, size - first);
        return out;
    }

    int size() {
        return size;
    }

    int capacity() {
        return data.length;
    }

    long totalWritten() {
        return written;
    }
}
