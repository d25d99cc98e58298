package ai.vmhost.virtualizer.console;

import ai.vmhost.longrunning.Inbox;
import ai.vmhost.longrunning.OperationStream;
import jakarta.annotation.Nullable;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One reader of a {@link Broadcaster}. Chunks arrive in write order; the stream ends when either side closes.
 */
public final class Subscription implements Inbox<byte[]>, Closeable {
    private final Broadcaster owner;
    private final OperationStream<byte[]> queue;
    private final AtomicLong dropped = new AtomicLong(0);

    Subscription(Broadcaster owner, int capacity) {
        this.owner = owner;
        this.queue = new OperationStream<>(capacity);
    }

    boolean offer(byte[] chunk) {
        return queue.offer(chunk);
    }

    void dropped() {
        dropped.incrementAndGet();
    }

    void end() {
        queue.close();
    }

    @Override
    @Nullable
    public byte[] take() throws InterruptedException {
        return queue.take();
    }

    @Override
    @Nullable
    public byte[] poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout);
    }

    @Override
    @Nullable
    public byte[] poll() {
        return queue.poll();
    }

    @Override
    public boolean isDrained() {
        return queue.isDrained();
    }

    /**
     * True once the stream has ended and every queued chunk was consumed.
     */
    public boolean isEnded() {
        return queue.isDrained();
    }

    /**
     * @return number of writes this subscriber missed because its queue was full
     */
    public long droppedChunks() {
        return dropped.get();
    }

    /**
     * Unregisters from the broadcaster, then discards whatever is still queued.
     */
    @Override
    public void close() {
        owner.unregister(this);
        queue.close();
        while (queue.poll() != null) {
            // discard
        }
    }
}
