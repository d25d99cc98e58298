package ai.vmhost.virtualizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.List;

public record VmDetails(
    @JsonProperty("id") String id,
    @JsonProperty("name") @Nullable String name,
    @JsonProperty("virtualizer") String virtualizer,
    @JsonProperty("platform") String backend,
    @JsonProperty("status") VmState state,
    @JsonProperty("created") Instant created,
    @JsonProperty("kernel") @Nullable String kernel,
    @JsonProperty("cpus") int cpus,
    @JsonProperty("ram_mib") int memoryMib,
    @JsonProperty("hostname") @Nullable String hostname,
    @JsonProperty("networks") List<Nic> networks
) {
    public record Nic(
        @JsonProperty("ip") @Nullable String ip,
        @JsonProperty("mask") @Nullable String mask,
        @JsonProperty("gateway") @Nullable String gateway,
        @JsonProperty("routes") List<Route> routes
    ) {}

    public record Route(
        @JsonProperty("protocol") NetworkProtocol protocol,
        @JsonProperty("port") String port,
        @JsonProperty("address") @Nullable String address
    ) {}

    public static List<Nic> describe(RouteTable routes) {
        return routes.interfaces().stream()
            .map(nic -> new Nic(nic.ip(), nic.mask(), nic.gateway(), nic.routes().stream()
                .map(r -> new Route(r.protocol(), r.port(), r.address()))
                .toList()))
            .toList();
    }
}
