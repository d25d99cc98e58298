package ai.vmhost.virtualizer.backend.virtualbox;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.virtualizer.backend.HandleFactory;
import ai.vmhost.virtualizer.backend.PrepareContext;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.console.Broadcaster;
import ai.vmhost.virtualizer.console.ConsoleConnection;
import ai.vmhost.virtualizer.console.ConsoleDialer;
import ai.vmhost.virtualizer.model.PrepareArgs;
import ai.vmhost.virtualizer.model.RouteTable;
import ai.vmhost.virtualizer.model.VmConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;

public class VirtualBoxDriverTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private VBoxManage vbox;
    private ConsoleDialer dialer;
    private VirtualBoxDriver driver;

    @Before
    public void setUp() throws Exception {
        vbox = Mockito.mock(VBoxManage.class);
        Mockito.when(vbox.vmState(anyString())).thenReturn("poweroff");
        dialer = Mockito.mock(ConsoleDialer.class);
        var backend = new VirtualBoxBackend(new VirtualizerConfig(), vbox, dialer,
            Mockito.mock(HandleFactory.class), new ObjectMapper());
        driver = new VirtualBoxDriver(backend, vbox, dialer, Duration.ofSeconds(1), Duration.ofMillis(10));
        driver.initialize("{\"headless\": true}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void restartReplacesSerialConnection() throws Exception {
        var first = connection();
        var second = connection();
        Mockito.when(dialer.dial(any(), any())).thenReturn(first, second);
        driver.prepare(context("vm0000000001"));
        var console = new Broadcaster("web", 1024);

        driver.launch(console);
        Mockito.verify(first, Mockito.never()).close();

        driver.launch(console);
        Mockito.verify(first).close();
        Mockito.verify(second, Mockito.never()).close();

        driver.release();
        Mockito.verify(second).close();
        Mockito.verify(first).close();
        Mockito.verify(vbox).run("unregistervm", "vmhost-vm0000000001", "--delete");
    }

    @Test
    public void serialCloseFailureDoesNotBlockRestart() throws Exception {
        var first = connection();
        Mockito.doThrow(new IOException("pipe busy")).when(first).close();
        var second = connection();
        Mockito.when(dialer.dial(any(), any())).thenReturn(first, second);
        driver.prepare(context("vm0000000002"));
        var console = new Broadcaster("web", 1024);

        driver.launch(console);
        driver.launch(console);

        Mockito.verify(vbox, Mockito.times(2)).run("startvm", "vmhost-vm0000000002", "--type", "headless");
        Mockito.verify(first).close();
    }

    private static ConsoleConnection connection() {
        var conn = Mockito.mock(ConsoleConnection.class);
        Mockito.when(conn.input()).thenReturn(new ByteArrayInputStream(new byte[0]));
        Mockito.when(conn.output()).thenReturn(new ByteArrayOutputStream());
        return conn;
    }

    private PrepareContext context(String vmId) throws IOException {
        var config = new VmConfig("4.19", 1, 256, "guest", List.of());
        return new PrepareContext(vmId, new PrepareArgs("web", config, tmp.newFile("disk.vmdk").toPath(), false),
            new Operation(vmId, "Prepare vm web"), RouteTable.from(List.of()), tmp.newFolder(vmId).toPath());
    }
}
