package ai.vmhost.virtualizer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Network interface of a machine as configured by the user. An empty ip or {@code dhcp} means the guest obtains
 * its address over DHCP.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NicConfig(
    @JsonProperty("ip") @Nullable String ip,
    @JsonProperty("mask") @Nullable String mask,
    @JsonProperty("gateway") @Nullable String gateway,
    @JsonProperty("tcp") List<String> tcp,
    @JsonProperty("udp") List<String> udp,
    @JsonProperty("http") List<String> http,
    @JsonProperty("https") List<String> https
) {
    @JsonCreator
    public NicConfig {
        tcp = tcp == null ? List.of() : List.copyOf(tcp);
        udp = udp == null ? List.of() : List.copyOf(udp);
        http = http == null ? List.of() : List.copyOf(http);
        https = https == null ? List.of() : List.copyOf(https);
    }

    public static NicConfig dhcp(List<String> http) {
        return new NicConfig("dhcp", null, null, List.of(), List.of(), http, List.of());
    }

    public boolean usesDhcp() {
        return ip == null || ip.isBlank() || "dhcp".equalsIgnoreCase(ip);
    }

    public List<String> ports(NetworkProtocol protocol) {
        return switch (protocol) {
            case UDP -> udp;
            case TCP -> tcp;
            case HTTP -> http;
            case HTTPS -> https;
        };
    }
}
