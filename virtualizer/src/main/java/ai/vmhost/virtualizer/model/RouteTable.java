package ai.vmhost.virtualizer.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Configured interfaces of one machine with their port mappings.
 */
public final class RouteTable {
    private final List<NetworkInterface> interfaces;

    private RouteTable(List<NetworkInterface> interfaces) {
        this.interfaces = List.copyOf(interfaces);
    }

    public static RouteTable from(List<NicConfig> nics) {
        var list = new ArrayList<NetworkInterface>(nics.size());
        for (int i = 0; i < nics.size(); i++) {
            list.add(new NetworkInterface(i, nics.get(i)));
        }
        return new RouteTable(list);
    }

    public List<NetworkInterface> interfaces() {
        return interfaces;
    }

    public int size() {
        return interfaces.size();
    }

    /**
     * True when some routes have no address yet and the guest has to report it.
     */
    public boolean needsAddressLookup() {
        return interfaces.stream()
            .anyMatch(nic -> nic.routes().stream().anyMatch(r -> r.address() == null));
    }

    /**
     * Back-fills interface {@code i} with {@code addresses[i]}.
     */
    public void assignAddresses(List<String> addresses) {
        for (int i = 0; i < Math.min(addresses.size(), interfaces.size()); i++) {
            interfaces.get(i).assignAddress(addresses.get(i));
        }
    }
}
