package ai.vmhost.virtualizer.backend.firecracker;

import ai.vmhost.netprov.NetworkProvisioningClient;
import ai.vmhost.virtualizer.backend.AbstractBackend;
import ai.vmhost.virtualizer.backend.HandleFactory;
import ai.vmhost.virtualizer.backend.MachineDriver;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.console.ConsoleDialer;
import ai.vmhost.virtualizer.model.DiskFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

@Singleton
@Requires(property = "virtualizer.firecracker.enabled", value = "true")
@Requires(os = Requires.Family.LINUX)
public class FirecrackerBackend extends AbstractBackend<FirecrackerBackend.Settings> {
    public static final String IDENTITY = "firecracker";

    private final VirtualizerConfig config;
    private final VirtualizerConfig.Firecracker firecrackerConfig;
    private final KernelCache kernels;
    private final NetworkProvisioningClient networkHelper;
    private final ConsoleDialer dialer;

    /**
     * Firecracker takes no settings.
     */
    public static final class Settings {
    }

    public FirecrackerBackend(VirtualizerConfig config, VirtualizerConfig.Firecracker firecrackerConfig,
                              KernelCache kernels, NetworkProvisioningClient networkHelper, ConsoleDialer dialer,
                              HandleFactory handleFactory, ObjectMapper mapper)
    {
        super(Settings.class, handleFactory, mapper);
        this.config = config;
        this.firecrackerConfig = firecrackerConfig;
        this.kernels = kernels;
        this.networkHelper = networkHelper;
        this.dialer = dialer;
    }

    @Override
    public String identity() {
        return IDENTITY;
    }

    @Override
    public long diskAlignment() {
        return 2L * 1024 * 1024;
    }

    @Override
    public DiskFormat diskFormat() {
        return DiskFormat.RAW;
    }

    @Override
    protected String executable() {
        return firecrackerConfig.getBinary();
    }

    @Override
    protected MachineDriver newDriver() {
        return new FirecrackerDriver(this, firecrackerConfig, config.getConsoleDialTimeout(), kernels, networkHelper,
            dialer, mapper);
    }
}
