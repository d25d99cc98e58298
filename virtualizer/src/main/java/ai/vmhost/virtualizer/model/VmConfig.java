package ai.vmhost.virtualizer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VmConfig(
    @JsonProperty("kernel") String kernel,
    @JsonProperty("cpus") int cpus,
    @JsonProperty("ram_mib") int memoryMib,
    @JsonProperty("hostname") String hostname,
    @JsonProperty("networks") List<NicConfig> networks
) {
    @JsonCreator
    public VmConfig {
        networks = networks == null ? List.of() : List.copyOf(networks);
        if (cpus <= 0) {
            cpus = 1;
        }
        if (memoryMib <= 0) {
            memoryMib = 256;
        }
    }
}
