package ai.vmhost.netprov.helper.dhcp;

import com.google.common.net.InetAddresses;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.Inet4Address;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;

/**
 * Minimal DHCP server handing out addresses of the bridge subnet to the guests attached to it.
 */
public class DhcpResponder implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(DhcpResponder.class);

    private static final int CLIENT_PORT = 68;
    private static final Inet4Address BROADCAST = InetAddresses.fromInteger(-1);

    private final Ipv4Cidr subnet;
    private final LeasePool pool;
    private final List<Inet4Address> dnsServers;
    private final int port;

    private volatile DatagramSocket socket;
    private Thread thread;

    public DhcpResponder(Ipv4Cidr subnet, LeasePool pool, List<Inet4Address> dnsServers, int port) {
        this.subnet = subnet;
        this.pool = pool;
        this.dnsServers = List.copyOf(dnsServers);
        this.port = port;
    }

    public synchronized void start() throws SocketException {
        if (socket != null) {
            throw new IllegalStateException("DHCP responder is already started");
        }
        var s = new DatagramSocket(null);
        s.setReuseAddress(true);
        s.setBroadcast(true);
        s.bind(new InetSocketAddress(port));
        socket = s;

        thread = new Thread(this::serve, "dhcp-responder");
        thread.setDaemon(true);
        thread.start();
        LOG.info("DHCP responder for {} listens on port {}", subnet, port);
    }

    private void serve() {
        var buf = new byte[1500];
        while (!socket.isClosed()) {
            var packet = new DatagramPacket(buf, buf.length);
            try {
                socket.receive(packet);
            } catch (IOException e) {
                if (!socket.isClosed()) {
                    LOG.error("DHCP receive failed: {}", e.getMessage(), e);
                }
                continue;
            }

            try {
                var request = DhcpMessage.parse(packet.getData(), packet.getLength());
                var reply = handle(request);
                if (reply.isPresent()) {
                    var data = reply.get().encode();
                    socket.send(new DatagramPacket(data, data.length, BROADCAST, CLIENT_PORT));
                }
            } catch (DhcpMessage.MalformedMessageException e) {
                LOG.debug("Ignore malformed DHCP packet from {}: {}", packet.getSocketAddress(), e.getMessage());
            } catch (IOException e) {
                LOG.error("DHCP reply failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Computes the answer to a client message, if any.
     */
    public Optional<DhcpMessage> handle(DhcpMessage request) {
        if (request.op() != DhcpMessage.BOOT_REQUEST || request.type() == null) {
            return Optional.empty();
        }

        var mac = request.clientMac();
        var server = subnet.address();
        switch (request.type()) {
            case DISCOVER -> {
                var offered = pool.offer(mac, request.requestedAddress());
                if (offered == null) {
                    LOG.warn("No free address for {}", mac);
                    return Optional.empty();
                }
                LOG.info("Offer {} to {}", offered.getHostAddress(), mac);
                return Optional.of(withLeaseOptions(request.reply(DhcpMessage.Type.OFFER, offered, server)));
            }
            case REQUEST -> {
                var requested = request.requestedAddress();
                if (requested == null) {
                    requested = pool.leaseOf(mac);
                }
                if (requested != null && pool.acknowledge(mac, requested)) {
                    LOG.info("Lease {} to {}", requested.getHostAddress(), mac);
                    return Optional.of(withLeaseOptions(request.reply(DhcpMessage.Type.ACK, requested, server)));
                }
                LOG.info("Reject request of {} for {}", mac, requested);
                return Optional.of(request.reply(DhcpMessage.Type.NAK, InetAddresses.fromInteger(0), server));
            }
            case RELEASE, DECLINE -> {
                LOG.info("Release lease of {}", mac);
                pool.release(mac);
                return Optional.empty();
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    private DhcpMessage withLeaseOptions(DhcpMessage reply) {
        reply.setOption(DhcpMessage.OPTION_LEASE_TIME,
            ByteBuffer.allocate(4).putInt((int) pool.leaseTime().toSeconds()).array());
        reply.setOption(DhcpMessage.OPTION_SUBNET_MASK, subnet.mask().getAddress());
        reply.setOption(DhcpMessage.OPTION_ROUTER, subnet.address().getAddress());
        if (!dnsServers.isEmpty()) {
            var dns = new ByteArrayOutputStream();
            for (var server : dnsServers) {
                dns.writeBytes(server.getAddress());
            }
            reply.setOption(DhcpMessage.OPTION_DNS, dns.toByteArray());
        }
        return reply;
    }

    @Nullable
    public Integer localPort() {
        var s = socket;
        return s == null ? null : s.getLocalPort();
    }

    @Override
    public synchronized void close() {
        if (socket == null) {
            return;
        }
        socket.close();
        try {
            thread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("DHCP responder stopped");
    }
}
