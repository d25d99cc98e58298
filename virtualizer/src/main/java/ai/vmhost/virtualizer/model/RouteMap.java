package ai.vmhost.virtualizer.model;

import jakarta.annotation.Nullable;

/**
 * Guest port and the externally reachable address it is mapped to, once known.
 */
public final class RouteMap {
    private final NetworkProtocol protocol;
    private final String port;
    @Nullable
    private volatile String address;

    public RouteMap(NetworkProtocol protocol, String port) {
        this.protocol = protocol;
        this.port = port;
    }

    public NetworkProtocol protocol() {
        return protocol;
    }

    public String port() {
        return port;
    }

    @Nullable
    public String address() {
        return address;
    }

    public void setAddress(@Nullable String address) {
        this.address = address;
    }

    @Override
    public String toString() {
        return protocol.value() + "/" + port + " -> " + (address == null ? "?" : address);
    }
}
