package ai.vmhost.netprov.helper.dhcp;

import com.google.common.net.InetAddresses;
import org.apache.commons.net.util.SubnetUtils;

import java.net.Inet4Address;

/**
 * Host address with its prefix length, e.g. {@code 174.72.0.1/24}. Only prefixes from /8 to /30 are accepted:
 * anything longer leaves no address to lease.
 */
public final class Ipv4Cidr {
    private static final int MIN_PREFIX = 8;
    private static final int MAX_PREFIX = 30;

    private final Inet4Address address;
    private final int prefix;
    private final SubnetUtils.SubnetInfo info;

    private Ipv4Cidr(Inet4Address address, int prefix, SubnetUtils.SubnetInfo info) {
        this.address = address;
        this.prefix = prefix;
        this.info = info;
    }

    public static Ipv4Cidr parse(String cidr) {
        SubnetUtils.SubnetInfo info;
        try {
            info = new SubnetUtils(cidr).getInfo();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Not an IPv4 CIDR: " + cidr, e);
        }

        var prefix = Integer.parseInt(cidr.substring(cidr.indexOf('/') + 1));
        if (prefix < MIN_PREFIX || prefix > MAX_PREFIX) {
            throw new IllegalArgumentException("Unsupported prefix length /%d, expected /%d to /%d"
                .formatted(prefix, MIN_PREFIX, MAX_PREFIX));
        }
        return new Ipv4Cidr(toInet4(info.getAddress()), prefix, info);
    }

    public Inet4Address address() {
        return address;
    }

    public int prefix() {
        return prefix;
    }

    public Inet4Address mask() {
        return toInet4(info.getNetmask());
    }

    public Inet4Address network() {
        return toInet4(info.getNetworkAddress());
    }

    public Inet4Address broadcast() {
        return toInet4(info.getBroadcastAddress());
    }

    /**
     * @return whether {@code other} is a host address of this subnet; network and broadcast are not
     */
    public boolean contains(Inet4Address other) {
        return info.isInRange(other.getHostAddress());
    }

    /**
     * @return number of host addresses, network and broadcast excluded
     */
    public long hostCount() {
        return info.getAddressCountLong();
    }

    /**
     * @param index zero-based, {@code 0} is the lowest host address
     */
    public Inet4Address hostAt(long index) {
        if (index < 0 || index >= hostCount()) {
            throw new IndexOutOfBoundsException("Host index %d out of range for %s".formatted(index, this));
        }
        return InetAddresses.fromInteger(info.asInteger(info.getLowAddress()) + (int) index);
    }

    @Override
    public String toString() {
        return address.getHostAddress() + "/" + prefix;
    }

    private static Inet4Address toInet4(String address) {
        return (Inet4Address) InetAddresses.forString(address);
    }
}
