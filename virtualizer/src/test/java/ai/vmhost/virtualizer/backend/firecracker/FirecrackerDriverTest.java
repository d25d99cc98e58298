package ai.vmhost.virtualizer.backend.firecracker;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.netprov.NetworkProvisioningClient;
import ai.vmhost.virtualizer.backend.PrepareContext;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.console.ConsoleDialer;
import ai.vmhost.virtualizer.model.NicConfig;
import ai.vmhost.virtualizer.model.PrepareArgs;
import ai.vmhost.virtualizer.model.RouteTable;
import ai.vmhost.virtualizer.model.VmConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;

public class FirecrackerDriverTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ObjectMapper mapper = new ObjectMapper();
    private KernelCache kernels;
    private NetworkProvisioningClient networkHelper;
    private FirecrackerDriver driver;
    private Path kernel;
    private Path disk;

    @Before
    public void setUp() throws Exception {
        kernels = Mockito.mock(KernelCache.class);
        networkHelper = Mockito.mock(NetworkProvisioningClient.class);
        kernel = tmp.newFile("firecracker-4.19").toPath();
        disk = tmp.newFile("rootfs.raw").toPath();
        Mockito.when(kernels.fetch(Mockito.eq("4.19"), any())).thenReturn(kernel);

        driver = new FirecrackerDriver(Mockito.mock(FirecrackerBackend.class), new VirtualizerConfig.Firecracker(),
            Duration.ofSeconds(1), kernels, networkHelper, Mockito.mock(ConsoleDialer.class), mapper);
    }

    @Test
    public void writesMachineConfiguration() throws Exception {
        Mockito.when(networkHelper.createDevices("abcdef12", 2)).thenReturn(List.of("abcdef12-0", "abcdef12-1"));
        var ctx = context("abcdef1234567", List.of(
            new NicConfig("10.10.0.2", "255.255.255.0", "10.10.0.1", List.of("22"), List.of(), List.of(), List.of()),
            NicConfig.dhcp(List.of("80"))));

        driver.prepare(ctx);

        var json = mapper.readTree(ctx.workDir().resolve("config.json").toFile());
        Assert.assertEquals(kernel.toString(), json.at("/boot-source/kernel_image_path").asText());
        Assert.assertEquals("console=ttyS0 reboot=k panic=1 pci=off", json.at("/boot-source/boot_args").asText());
        Assert.assertEquals("rootfs", json.at("/drives/0/drive_id").asText());
        Assert.assertEquals(disk.toString(), json.at("/drives/0/path_on_host").asText());
        Assert.assertTrue(json.at("/drives/0/is_root_device").asBoolean());
        Assert.assertFalse(json.at("/drives/0/is_read_only").asBoolean());
        Assert.assertEquals(2, json.at("/machine-config/vcpu_count").asInt());
        Assert.assertEquals(512, json.at("/machine-config/mem_size_mib").asInt());
        Assert.assertEquals("eth1", json.at("/network-interfaces/1/iface_id").asText());
        Assert.assertEquals("abcdef12-1", json.at("/network-interfaces/1/host_dev_name").asText());

        var nics = ctx.routes().interfaces();
        Assert.assertEquals("10.10.0.2:22", nics.get(0).routes().get(0).address());
        Assert.assertNull(nics.get(1).routes().get(0).address());
        Assert.assertEquals(disk, driver.disk());
    }

    @Test
    public void noNetworkNoDevices() throws Exception {
        var ctx = context("vm0000000001", List.of());

        driver.prepare(ctx);
        driver.release();

        Mockito.verify(networkHelper, Mockito.never()).createDevices(anyString(), anyInt());
        Mockito.verify(networkHelper, Mockito.never()).deleteDevices(any());
        var json = mapper.readTree(ctx.workDir().resolve("config.json").toFile());
        Assert.assertEquals(0, json.at("/network-interfaces").size());
    }

    @Test
    public void releaseDeletesTapDevices() throws Exception {
        Mockito.when(networkHelper.createDevices("vm000000", 1)).thenReturn(List.of("vm000000-0"));
        driver.prepare(context("vm0000000001", List.of(NicConfig.dhcp(List.of()))));

        driver.release();
        driver.release();

        Mockito.verify(networkHelper, Mockito.times(1)).deleteDevices(List.of("vm000000-0"));
        Assert.assertFalse(driver.isRunning());
    }

    @Test
    public void kernelDownloadFailureFailsPreparation() throws Exception {
        Mockito.when(kernels.fetch(Mockito.eq("4.19"), any()))
            .thenThrow(new IOException("kernel vmlinux 'firecracker-4.19' does not exist"));

        var e = Assert.assertThrows(IOException.class,
            () -> driver.prepare(context("vm0000000001", List.of(NicConfig.dhcp(List.of())))));
        Assert.assertTrue(e.getMessage().contains("does not exist"));
        Mockito.verifyNoInteractions(networkHelper);
    }

    private PrepareContext context(String vmId, List<NicConfig> nics) throws IOException {
        var config = new VmConfig("4.19", 2, 512, "guest", nics);
        return new PrepareContext(vmId, new PrepareArgs("web", config, disk, false),
            new Operation(vmId, "Prepare vm web"), RouteTable.from(nics), tmp.newFolder(vmId).toPath());
    }
}
