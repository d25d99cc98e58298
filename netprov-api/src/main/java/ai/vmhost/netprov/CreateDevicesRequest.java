package ai.vmhost.netprov;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateDevicesRequest(
    @JsonProperty("id") String id,
    @JsonProperty("count") int count
) {
    @JsonCreator
    public CreateDevicesRequest {
    }
}
