package ai.vmhost.virtualizer.backend.qemu;

import ai.vmhost.virtualizer.backend.AbstractBackend;
import ai.vmhost.virtualizer.backend.HandleFactory;
import ai.vmhost.virtualizer.backend.MachineDriver;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import ai.vmhost.virtualizer.console.ConsoleDialer;
import ai.vmhost.virtualizer.model.DiskFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

@Singleton
@Requires(property = "virtualizer.qemu.enabled", value = "true")
public class QemuBackend extends AbstractBackend<QemuBackend.Settings> {
    public static final String IDENTITY = "qemu";

    private final VirtualizerConfig config;
    private final VirtualizerConfig.Qemu qemuConfig;
    private final ConsoleDialer dialer;

    public record Settings(
        @JsonProperty("headless") boolean headless
    ) {}

    public QemuBackend(VirtualizerConfig config, VirtualizerConfig.Qemu qemuConfig, ConsoleDialer dialer,
                       HandleFactory handleFactory, ObjectMapper mapper)
    {
        super(Settings.class, handleFactory, mapper);
        this.config = config;
        this.qemuConfig = qemuConfig;
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
        return DiskFormat.QCOW2;
    }

    @Override
    protected String executable() {
        return qemuConfig.getBinary();
    }

    @Override
    protected MachineDriver newDriver() {
        return new QemuDriver(this, qemuConfig, config.getConsoleDialTimeout(), dialer);
    }
}
