package ai.vmhost.virtualizer;

import ai.vmhost.longrunning.Operations;
import ai.vmhost.model.db.exceptions.AlreadyExistsException;
import ai.vmhost.model.db.exceptions.NotFoundException;
import ai.vmhost.test.TimeUtils;
import ai.vmhost.virtualizer.backend.TestBackend;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.model.CatalogEntry;
import ai.vmhost.virtualizer.model.DiskFormat;
import ai.vmhost.virtualizer.model.PrepareArgs;
import ai.vmhost.virtualizer.model.VmConfig;
import ai.vmhost.virtualizer.model.VmState;
import io.micronaut.context.ApplicationContext;
import io.micronaut.context.env.Environment;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

public class VirtualizerManagerTest {
    private static final Duration OP_TIMEOUT = Duration.ofSeconds(10);

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private ApplicationContext context;
    private VirtualizerManager manager;
    private TestBackend backend;
    private Path disk;

    @Before
    public void setUp() throws IOException {
        context = ApplicationContext.run(Environment.TEST);
        manager = context.getBean(VirtualizerManager.class);
        backend = context.getBean(TestBackend.class);
        disk = tmp.newFile("disk.raw").toPath();
        Files.write(disk, new byte[] {0, 1, 2, 3});
    }

    @After
    public void tearDown() throws Exception {
        manager.close();
        for (var entry : manager.list()) {
            manager.deleteVirtualizer(entry.name());
        }
        backend.reset();
        context.close();
    }

    @Test
    public void catalogCrud() throws Exception {
        manager.createVirtualizer("beta", TestBackend.IDENTITY, json("{\"mode\": \"fast\"}"));
        manager.createVirtualizer("alpha", TestBackend.IDENTITY, json("{}"));

        Assert.assertEquals(List.of("alpha", "beta"), manager.list().stream().map(CatalogEntry::name).toList());

        var beta = manager.virtualizerData("beta");
        Assert.assertEquals(TestBackend.IDENTITY, beta.type());
        Assert.assertEquals("{\"mode\": \"fast\"}", new String(beta.data(), StandardCharsets.UTF_8));
        Assert.assertEquals(DiskFormat.RAW, manager.diskFormat("beta"));
        Assert.assertEquals(4096, manager.diskAlignment("beta"));
        manager.validate("beta");

        manager.deleteVirtualizer("beta");
        manager.deleteVirtualizer("beta");
        Assert.assertEquals(List.of("alpha"), manager.list().stream().map(CatalogEntry::name).toList());
        Assert.assertThrows(NotFoundException.class, () -> manager.virtualizerData("beta"));
    }

    @Test
    public void duplicateVirtualizer() throws Exception {
        manager.createVirtualizer("dup", TestBackend.IDENTITY, json("{}"));

        var e = Assert.assertThrows(AlreadyExistsException.class,
            () -> manager.createVirtualizer("dup", TestBackend.IDENTITY, json("{\"mode\": \"other\"}")));
        Assert.assertEquals("virtualizer named 'dup' already exists", e.getMessage());
        Assert.assertEquals("{}", new String(manager.virtualizerData("dup").data(), StandardCharsets.UTF_8));
    }

    @Test
    public void invalidConfigurationIsNotStored() throws Exception {
        Assert.assertThrows(InvalidConfigurationException.class,
            () -> manager.createVirtualizer("bad", TestBackend.IDENTITY, json("{\"mode\": \"invalid\"}")));
        Assert.assertThrows(InvalidConfigurationException.class,
            () -> manager.createVirtualizer("bad", TestBackend.IDENTITY, json("not json")));
        Assert.assertThrows(InvalidConfigurationException.class,
            () -> manager.createVirtualizer("bad", TestBackend.IDENTITY, new byte[0]));
        Assert.assertThrows(InvalidConfigurationException.class,
            () -> manager.createVirtualizer("bad", TestBackend.IDENTITY, json("{\"unknown\": 1}")));
        Assert.assertThrows(InvalidConfigurationException.class,
            () -> manager.createVirtualizer(" ", TestBackend.IDENTITY, json("{}")));

        Assert.assertTrue(manager.list().isEmpty());
    }

    @Test
    public void unknownType() {
        var e = Assert.assertThrows(InvalidConfigurationException.class,
            () -> manager.createVirtualizer("x", "hyperv", json("{}")));
        Assert.assertEquals("unknown virtualizer type 'hyperv', supported: [test]", e.getMessage());
    }

    @Test
    public void availableBackends() {
        Assert.assertEquals(List.of(TestBackend.IDENTITY), manager.availableBackends());
    }

    @Test
    public void prepareAndLookup() throws Exception {
        manager.createVirtualizer("local", TestBackend.IDENTITY, json("{}"));

        var outcome = Operations.await(manager.prepare("local", args("web")), OP_TIMEOUT);
        Assert.assertTrue(String.valueOf(outcome.error()), outcome.success());

        var vm = manager.get("web");
        Assert.assertNotNull(vm);
        Assert.assertEquals(VmState.READY, vm.state());
        Assert.assertEquals("local", vm.virtualizer());
        Assert.assertEquals(TestBackend.IDENTITY, vm.type());
        Assert.assertEquals(12, vm.id().length());
        Assert.assertEquals(Set.of("web"), manager.activeVms());

        vm.start();
        Assert.assertEquals(VmState.ALIVE, vm.state());
        vm.close(false);
        Assert.assertNull(manager.get("web"));
        Assert.assertTrue(manager.activeVms().isEmpty());
    }

    @Test
    public void prepareFromUnknownVirtualizer() {
        Assert.assertThrows(NotFoundException.class, () -> manager.prepare("missing", args("web")));
    }

    @Test
    public void activeNameCannotBeReused() throws Exception {
        manager.createVirtualizer("local", TestBackend.IDENTITY, json("{}"));
        Assert.assertTrue(Operations.await(manager.prepare("local", args("web")), OP_TIMEOUT).success());

        var e = Assert.assertThrows(AlreadyExistsException.class, () -> manager.prepare("local", args("web")));
        Assert.assertEquals("virtual machine already exists", e.getMessage());
    }

    @Test
    public void shutdownClosesEveryMachine() throws Exception {
        manager.createVirtualizer("local", TestBackend.IDENTITY, json("{}"));
        Assert.assertTrue(Operations.await(manager.prepare("local", args("first")), OP_TIMEOUT).success());
        var failing = backend.lastDriver();
        Assert.assertTrue(Operations.await(manager.prepare("local", args("second")), OP_TIMEOUT).success());
        var healthy = backend.lastDriver();

        manager.get("first").start();
        manager.get("second").start();
        failing.releaseError = new IOException("tap device busy");

        manager.close();

        Assert.assertTrue(manager.activeVms().isEmpty());
        Assert.assertEquals(1, failing.releases.get());
        Assert.assertEquals(1, healthy.releases.get());
        Assert.assertFalse(healthy.isRunning());
        Assert.assertTrue(TimeUtils.waitFlagUp(() -> !failing.isRunning(), 5, TimeUnit.SECONDS));
    }

    private PrepareArgs args(String name) {
        return new PrepareArgs(name, new VmConfig("4.19", 1, 128, name, List.of()), disk, false);
    }

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
