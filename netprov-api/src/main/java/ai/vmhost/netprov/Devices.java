package ai.vmhost.netprov;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ordered tap device names of one machine; index {@code i} belongs to the machine's {@code i}-th interface.
 */
public record Devices(
    @JsonProperty("devices") List<String> devices
) {
    @JsonCreator
    public Devices {
        devices = devices == null ? List.of() : List.copyOf(devices);
    }
}
