package ai.vmhost.longrunning;

import jakarta.annotation.Nullable;

import java.time.Duration;

/**
 * Receiving side of a one-directional notification stream.
 *
 * <p>Closure is the only completion signal: once {@link #isDrained()} is true no more items will arrive.
 */
public interface Inbox<T> {

    /**
     * Blocks until an item is available or the stream is closed.
     *
     * @return the next item, or {@code null} when the stream is closed and empty
     */
    @Nullable
    T take() throws InterruptedException;

    /**
     * @return the next item, or {@code null} if nothing arrived within {@code timeout} or the stream ended
     */
    @Nullable
    T poll(Duration timeout) throws InterruptedException;

    @Nullable
    T poll();

    boolean isDrained();
}
