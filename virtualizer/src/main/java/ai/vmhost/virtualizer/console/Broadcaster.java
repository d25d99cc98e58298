package ai.vmhost.virtualizer.console;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Console output of one machine, fanned out to any number of subscribers.
 *
 * <p>The most recent bytes are retained in a ring buffer and handed to every new subscriber as its first
 * chunk. Later writes are offered to each subscriber without blocking; a subscriber whose queue is full
 * misses that write. The writer is never slowed down by its readers.
 */
public final class Broadcaster implements Closeable {
    private static final Logger LOG = LogManager.getLogger(Broadcaster.class);

    public static final int SUBSCRIBER_QUEUE_CAPACITY = 64;

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final CircularByteBuffer buffer;
    private final Set<Subscription> subscribers = new LinkedHashSet<>();
    private boolean closed = false;

    public Broadcaster(String name, int bufferSize) {
        this.name = name;
        this.buffer = new CircularByteBuffer(bufferSize);
    }

    public void write(byte[] b) throws EOFException {
        write(b, 0, b.length);
    }

    /**
     * Appends a chunk. The caller's buffer is copied once and that copy is shared by all subscribers, so they
     * must not modify it.
     *
     * @throws EOFException if the broadcaster is closed, even for an empty write
     */
    public void write(byte[] b, int off, int len) throws EOFException {
        var chunk = Arrays.copyOfRange(b, off, off + len);

        lock.lock();
        try {
            if (closed) {
                throw new EOFException("console of " + name + " is closed");
            }
            if (len == 0) {
                return;
            }
            buffer.write(chunk, 0, chunk.length);
            for (var sub : subscribers) {
                if (!sub.offer(chunk)) {
                    sub.dropped();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a subscriber. Its first chunk is the retained history, possibly empty. Subscribing to a closed
     * broadcaster yields the history followed by the end of the stream.
     */
    public Subscription subscribe() {
        lock.lock();
        try {
            var sub = new Subscription(this, SUBSCRIBER_QUEUE_CAPACITY);
            sub.offer(buffer.snapshot());
            if (closed) {
                sub.end();
            } else {
                subscribers.add(sub);
            }
            return sub;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return bytes currently retained
     */
    public byte[] snapshot() {
        lock.lock();
        try {
            return buffer.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public int subscribers() {
        lock.lock();
        try {
            return subscribers.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    void unregister(Subscription sub) {
        lock.lock();
        try {
            subscribers.remove(sub);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        final ArrayList<Subscription> live;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            live = new ArrayList<>(subscribers);
            subscribers.clear();
        } finally {
            lock.unlock();
        }

        for (var sub : live) {
            sub.end();
        }
        LOG.debug("Console of {} closed, {} subscriber(s) released", name, live.size());
    }

    /**
     * Adapter for pumping process output into the broadcaster.
     */
    public OutputStream asOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                Broadcaster.this.write(new byte[] {(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                Broadcaster.this.write(b, off, len);
            }
        };
    }
}
