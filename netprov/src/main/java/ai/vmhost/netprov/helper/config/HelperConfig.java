package ai.vmhost.netprov.helper.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties("network-helper")
public class HelperConfig {
    private String bridgeName = "vmhost-bridge";
    private String bridgeCidr = "174.72.0.1/24";
    private Duration commandTimeout = Duration.ofSeconds(10);

    @Getter
    @Setter
    @ConfigurationProperties("dhcp")
    public static final class Dhcp {
        private boolean enabled = true;
        private int port = 67;
        private Duration leaseTime = Duration.ofHours(1);
        private List<String> dnsServers = new ArrayList<>(List.of("8.8.8.8"));
    }
}
