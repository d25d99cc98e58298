package ai.vmhost.virtualizer.model;

import jakarta.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;

public final class NetworkInterface {
    private final int index;
    @Nullable
    private volatile String ip;
    @Nullable
    private final String mask;
    @Nullable
    private final String gateway;
    private final boolean dhcp;
    private final List<RouteMap> routes;

    NetworkInterface(int index, NicConfig config) {
        this.index = index;
        this.dhcp = config.usesDhcp();
        this.ip = dhcp ? null : config.ip();
        this.mask = config.mask();
        this.gateway = config.gateway();

        var list = new ArrayList<RouteMap>();
        for (var protocol : NetworkProtocol.values()) {
            for (var port : config.ports(protocol)) {
                list.add(new RouteMap(protocol, port));
            }
        }
        this.routes = List.copyOf(list);
    }

    public int index() {
        return index;
    }

    @Nullable
    public String ip() {
        return ip;
    }

    @Nullable
    public String mask() {
        return mask;
    }

    @Nullable
    public String gateway() {
        return gateway;
    }

    public boolean dhcp() {
        return dhcp;
    }

    public List<RouteMap> routes() {
        return routes;
    }

    public List<RouteMap> routes(NetworkProtocol protocol) {
        return routes.stream().filter(r -> r.protocol() == protocol).toList();
    }

    /**
     * Records the guest-reported address and points every route at it.
     */
    public void assignAddress(String address) {
        this.ip = address;
        for (var route : routes) {
            route.setAddress(address + ":" + route.port());
        }
    }
}
