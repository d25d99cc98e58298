package ai.vmhost.virtualizer.backend.firecracker;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import com.sun.net.httpserver.HttpServer;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.atomic.AtomicInteger;

public class KernelCacheTest {
    private static final byte[] VMLINUX = "vmlinux-4.19-contents".getBytes(StandardCharsets.UTF_8);

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private HttpServer server;
    private final AtomicInteger requests = new AtomicInteger(0);
    private KernelCache cache;

    @Before
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/kernels/", exchange -> {
            requests.incrementAndGet();
            if (exchange.getRequestURI().getPath().endsWith("/firecracker-4.19")) {
                exchange.sendResponseHeaders(200, VMLINUX.length);
                exchange.getResponseBody().write(VMLINUX);
            } else {
                exchange.sendResponseHeaders(404, -1);
            }
            exchange.close();
        });
        server.start();

        var config = new VirtualizerConfig.Firecracker();
        config.setKernelCache(tmp.getRoot().toPath().resolve("kernels").toString());
        config.setKernelDownloadUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/kernels");
        cache = new KernelCache(config, HttpClient.newHttpClient());
    }

    @After
    public void tearDown() {
        server.stop(0);
    }

    @Test
    public void downloadsOnceThenServesFromDisk() throws Exception {
        var op = new Operation("op-1", "fetch");
        var path = cache.fetch("4.19", op);

        Assert.assertEquals("firecracker-4.19", path.getFileName().toString());
        Assert.assertArrayEquals(VMLINUX, Files.readAllBytes(path));

        var again = cache.fetch("4.19", new Operation("op-2", "fetch"));
        Assert.assertEquals(path, again);
        Assert.assertEquals(1, requests.get());

        try (var files = Files.list(path.getParent())) {
            Assert.assertEquals(1, files.count());
        }
    }

    @Test
    public void missingKernel() throws Exception {
        var e = Assert.assertThrows(IOException.class, () -> cache.fetch("9.99", new Operation("op", "fetch")));

        Assert.assertEquals("kernel vmlinux 'firecracker-9.99' does not exist", e.getMessage());
        Assert.assertFalse(Files.exists(tmp.getRoot().toPath().resolve("kernels").resolve("firecracker-9.99")));
    }

    @Test
    public void kernelIsRequired() {
        Assert.assertThrows(IOException.class, () -> cache.fetch("", new Operation("op", "fetch")));
    }

    @Test
    public void humanReadableSizes() {
        Assert.assertEquals("999 B", KernelCache.bytes(999));
        Assert.assertEquals("1.5 kB", KernelCache.bytes(1500));
        Assert.assertEquals("21.0 MB", KernelCache.bytes(21_000_000));
    }
}
