package ai.vmhost.virtualizer.console;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.EOFException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public class BroadcasterTest {
    private Broadcaster console;

    @Before
    public void setUp() {
        console = new Broadcaster("vm-test", 16);
    }

    @Test
    public void newSubscriberGetsHistoryFirst() throws Exception {
        console.write(bytes("hello "));
        console.write(bytes("world"));

        try (var sub = console.subscribe()) {
            Assert.assertEquals("hello world", text(sub.take()));

            console.write(bytes("!"));
            Assert.assertEquals("!", text(sub.take()));
        }
    }

    @Test
    public void emptyHistoryIsStillDelivered() throws Exception {
        try (var sub = console.subscribe()) {
            var first = sub.poll(Duration.ofSeconds(1));
            Assert.assertNotNull(first);
            Assert.assertEquals(0, first.length);
        }
    }

    @Test
    public void historyKeepsOnlyTheTail() throws Exception {
        console.write(bytes("0123456789"));
        console.write(bytes("abcdefghij"));

        Assert.assertEquals("456789abcdefghij", text(console.snapshot()));
        try (var sub = console.subscribe()) {
            Assert.assertEquals("456789abcdefghij", text(sub.take()));
        }
    }

    @Test
    public void everySubscriberSeesEveryWrite() throws Exception {
        var first = console.subscribe();
        var second = console.subscribe();
        Assert.assertEquals(2, console.subscribers());

        console.write(bytes("boot"));

        for (var sub : new Subscription[] {first, second}) {
            Assert.assertEquals(0, sub.take().length);
            Assert.assertEquals("boot", text(sub.take()));
            sub.close();
        }
        Assert.assertEquals(0, console.subscribers());
    }

    @Test
    public void closeEndsSubscriptions() throws Exception {
        var sub = console.subscribe();
        console.write(bytes("bye"));
        console.close();

        Assert.assertTrue(console.isClosed());
        Assert.assertEquals(0, sub.take().length);
        Assert.assertEquals("bye", text(sub.take()));
        Assert.assertNull(sub.take());
        Assert.assertTrue(sub.isEnded());

        Assert.assertThrows(EOFException.class, () -> console.write(bytes("late")));
    }

    @Test
    public void emptyWriteIsSkippedWhileOpenAndRejectedAfterClose() throws Exception {
        var sub = console.subscribe();
        Assert.assertEquals(0, sub.take().length);

        console.write(new byte[0]);
        Assert.assertNull(sub.poll());
        Assert.assertEquals(0, console.snapshot().length);

        console.close();
        Assert.assertThrows(EOFException.class, () -> console.write(new byte[0]));
        Assert.assertThrows(EOFException.class, () -> console.write(bytes("abc"), 1, 0));
    }

    @Test
    public void subscribersShareOneCopyOfTheCallersBuffer() throws Exception {
        var first = console.subscribe();
        var second = console.subscribe();
        first.take();
        second.take();

        var buf = bytes("boot");
        console.write(buf);
        buf[0] = 'X';

        var seenByFirst = first.take();
        Assert.assertEquals("boot", text(seenByFirst));
        Assert.assertSame(seenByFirst, second.take());
        first.close();
        second.close();
    }

    @Test
    public void subscribeAfterCloseGetsHistoryOnly() throws Exception {
        console.write(bytes("last words"));
        console.close();

        var sub = console.subscribe();
        Assert.assertEquals("last words", text(sub.take()));
        Assert.assertNull(sub.take());
        Assert.assertEquals(0, console.subscribers());
    }

    @Test
    public void slowSubscriberMissesWritesWithoutBlockingWriter() throws Exception {
        var sub = console.subscribe();

        for (int i = 0; i < 100; i++) {
            console.write(bytes("x"));
        }

        // the history chunk takes one slot of the queue
        int expected = Broadcaster.SUBSCRIBER_QUEUE_CAPACITY - 1;
        Assert.assertEquals(100 - expected, sub.droppedChunks());

        Assert.assertEquals(0, sub.take().length);
        int received = 0;
        while (sub.poll() != null) {
            received++;
        }
        Assert.assertEquals(expected, received);
        sub.close();
    }

    @Test
    public void closedSubscriptionStopsReceiving() throws Exception {
        var sub = console.subscribe();
        sub.close();

        console.write(bytes("ignored"));

        Assert.assertNull(sub.poll());
        Assert.assertTrue(sub.isEnded());
        Assert.assertEquals(0, console.subscribers());
    }

    @Test
    public void outputStreamAdapter() throws Exception {
        try (var out = console.asOutputStream()) {
            out.write('a');
            out.write(bytes("xbcx"), 1, 2);
        }
        Assert.assertEquals("abc", text(console.snapshot()));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }
}
