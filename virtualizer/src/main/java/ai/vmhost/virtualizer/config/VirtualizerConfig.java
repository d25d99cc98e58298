package ai.vmhost.virtualizer.config;

import ai.vmhost.model.db.DatabaseConfiguration;
import io.micronaut.context.annotation.ConfigurationBuilder;
import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties("virtualizer")
public class VirtualizerConfig {
    // per-machine working directories live here
    private String vmDrive = System.getProperty("java.io.tmpdir") + "/vmhost/machines";
    private int consoleBufferSize = 20 * 1024;
    private int stopAttempts = 10;
    private Duration stopPollInterval = Duration.ofSeconds(1);
    private Duration ipLookupTimeout = Duration.ofSeconds(30);
    private Duration commandTimeout = Duration.ofSeconds(30);
    private Duration consoleDialTimeout = Duration.ofSeconds(10);

    @ConfigurationBuilder("database")
    private final DatabaseConfiguration database = new DatabaseConfiguration();

    @Getter
    @Setter
    @ConfigurationProperties("executor")
    public static final class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
    }

    @Getter
    @Setter
    @ConfigurationProperties("network-helper")
    public static final class NetworkHelper {
        private String address = "127.0.0.1:7476";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    @ConfigurationProperties("firecracker")
    public static final class Firecracker {
        private boolean enabled = false;
        private String binary = "firecracker";
        private String kernelCache = System.getProperty("java.io.tmpdir") + "/vmhost/kernels";
        private String kernelDownloadUrl = "https://storage.googleapis.com/vorteil-dl/firecracker-vmlinux/";
        private String bootArgs = "console=ttyS0 reboot=k panic=1 pci=off";
    }

    @Getter
    @Setter
    @ConfigurationProperties("qemu")
    public static final class Qemu {
        private boolean enabled = false;
        private String binary = "qemu-system-x86_64";
    }

    @Getter
    @Setter
    @ConfigurationProperties("virtualbox")
    public static final class VirtualBox {
        private boolean enabled = false;
        private String binary = "VBoxManage";
    }
}
