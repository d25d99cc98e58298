package ai.vmhost.virtualizer.backend.virtualbox;

import ai.vmhost.common.ProcessRunner;
import ai.vmhost.virtualizer.backend.AbstractBackend;
import ai.vmhost.virtualizer.backend.HandleFactory;
import ai.vmhost.virtualizer.backend.MachineDriver;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.console.ConsoleDialer;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.model.DiskFormat;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.util.Locale;

@Singleton
@Requires(property = "virtualizer.virtualbox.enabled", value = "true")
public class VirtualBoxBackend extends AbstractBackend<VirtualBoxBackend.Settings> {
    public static final String IDENTITY = "virtualbox";

    public static final String NETWORK_NAT = "nat";
    public static final String NETWORK_BRIDGED = "bridged";
    public static final String NETWORK_HOSTONLY = "hostonly";

    private final VirtualizerConfig config;
    private final VBoxManage vboxManage;
    private final ConsoleDialer dialer;

    public record Settings(
        @JsonProperty("headless") boolean headless,
        @JsonProperty("networkType") String networkType,
        @JsonProperty("networkDevice") @Nullable String networkDevice
    ) {
        @JsonCreator
        public Settings {
            networkType = networkType == null || networkType.isBlank()
                ? NETWORK_NAT
                : networkType.toLowerCase(Locale.ROOT);
        }
    }

    public VirtualBoxBackend(VirtualizerConfig config, VirtualizerConfig.VirtualBox vboxConfig, ConsoleDialer dialer,
                             HandleFactory handleFactory, ObjectMapper mapper)
    {
        this(config, new VBoxManage(vboxConfig.getBinary(), new ProcessRunner(config.getCommandTimeout())), dialer,
            handleFactory, mapper);
    }

    VirtualBoxBackend(VirtualizerConfig config, VBoxManage vboxManage, ConsoleDialer dialer,
                      HandleFactory handleFactory, ObjectMapper mapper)
    {
        super(Settings.class, handleFactory, mapper);
        this.config = config;
        this.vboxManage = vboxManage;
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
        return DiskFormat.VMDK;
    }

    @Override
    protected String executable() {
        return vboxManage.binary();
    }

    /**
     * Bridged and host-only networking need an adapter that exists on this host.
     */
    @Override
    protected void validate(Settings settings) throws InvalidConfigurationException {
        var kind = switch (settings.networkType()) {
            case NETWORK_NAT -> null;
            case NETWORK_BRIDGED -> "bridgedifs";
            case NETWORK_HOSTONLY -> "hostonlyifs";
            default -> throw new InvalidConfigurationException(
                "unsupported network type '%s', expected one of: nat, bridged, hostonly"
                    .formatted(settings.networkType()));
        };
        if (kind == null) {
            return;
        }

        var device = settings.networkDevice();
        if (device == null || device.isBlank()) {
            throw new InvalidConfigurationException(
                "network type '%s' requires a network device".formatted(settings.networkType()));
        }

        try {
            var devices = vboxManage.listInterfaces(kind);
            if (!devices.contains(device)) {
                throw new InvalidConfigurationException("network device '%s' is not a valid %s device, available: %s"
                    .formatted(device, settings.networkType(), devices));
            }
        } catch (IOException e) {
            throw new InvalidConfigurationException("cannot list %s network devices: %s"
                .formatted(settings.networkType(), e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvalidConfigurationException("interrupted while listing network devices", e);
        }
    }

    @Override
    protected MachineDriver newDriver() {
        return new VirtualBoxDriver(this, vboxManage, dialer, config.getConsoleDialTimeout(),
            config.getStopPollInterval());
    }
}
