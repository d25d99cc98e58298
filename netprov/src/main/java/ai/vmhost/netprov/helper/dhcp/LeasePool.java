package ai.vmhost.netprov.helper.dhcp;

import jakarta.annotation.Nullable;

import java.net.Inet4Address;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Address leases of the bridge subnet keyed by client MAC. The network, broadcast and gateway addresses are
 * never leased.
 */
public final class LeasePool {
    private final Ipv4Cidr subnet;
    private final Duration leaseTime;
    private final Clock clock;
    private final Map<String, Lease> byMac = new HashMap<>();
    private final Map<Inet4Address, String> byAddress = new HashMap<>();

    private record Lease(Inet4Address address, Instant expiresAt) {}

    public LeasePool(Ipv4Cidr subnet, Duration leaseTime, Clock clock) {
        this.subnet = subnet;
        this.leaseTime = leaseTime;
        this.clock = clock;
    }

    public Duration leaseTime() {
        return leaseTime;
    }

    /**
     * Picks an address for {@code mac}: its current lease, the requested address if it is free, or the lowest
     * free one.
     *
     * @return {@code null} when the pool is exhausted
     */
    @Nullable
    public synchronized Inet4Address offer(String mac, @Nullable Inet4Address requested) {
        var now = clock.instant();
        var current = byMac.get(mac);
        if (current != null) {
            return assign(mac, current.address(), now);
        }
        if (requested != null && isAvailable(requested, mac, now)) {
            return assign(mac, requested, now);
        }
        for (long i = 0; i < subnet.hostCount(); i++) {
            var candidate = subnet.hostAt(i);
            if (isAvailable(candidate, mac, now)) {
                return assign(mac, candidate, now);
            }
        }
        return null;
    }

    /**
     * Confirms a client's request for {@code address}, renewing the lease.
     */
    public synchronized boolean acknowledge(String mac, Inet4Address address) {
        var now = clock.instant();
        if (!isAvailable(address, mac, now)) {
            return false;
        }
        assign(mac, address, now);
        return true;
    }

    public synchronized void release(String mac) {
        var lease = byMac.remove(mac);
        if (lease != null) {
            byAddress.remove(lease.address());
        }
    }

    @Nullable
    public synchronized Inet4Address leaseOf(String mac) {
        var lease = byMac.get(mac);
        return lease == null ? null : lease.address();
    }

    private boolean isAvailable(Inet4Address address, String mac, Instant now) {
        if (!subnet.contains(address) || address.equals(subnet.address())) {
            return false;
        }
        var owner = byAddress.get(address);
        if (owner == null || owner.equals(mac)) {
            return true;
        }
        var lease = byMac.get(owner);
        if (lease.expiresAt().isBefore(now)) {
            byMac.remove(owner);
            byAddress.remove(address);
            return true;
        }
        return false;
    }

    private Inet4Address assign(String mac, Inet4Address address, Instant now) {
        var previous = byMac.put(mac, new Lease(address, now.plus(leaseTime)));
        if (previous != null && !previous.address().equals(address)) {
            byAddress.remove(previous.address());
        }
        byAddress.put(address, mac);
        return address;
    }
}
