package ai.vmhost.virtualizer.net;

import ai.vmhost.virtualizer.model.NetworkProtocol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.BindException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Picks host ports for forwarding guest ports on NAT backends.
 */
public final class PortBinder {
    private static final Logger LOG = LogManager.getLogger(PortBinder.class);

    private PortBinder() {
    }

    public record Binding(
        NetworkProtocol protocol,
        int guestPort,
        int hostPort
    ) {
        public String address() {
            return "localhost:" + hostPort;
        }
    }

    /**
     * Reserves the guest port on the host when it is free, otherwise any free port. The port is released
     * again before returning; the hypervisor binds it right after.
     */
    public static Binding bind(NetworkProtocol protocol, int guestPort) throws IOException {
        if (guestPort <= 0 || guestPort > 65535) {
            throw new IllegalArgumentException("invalid port " + guestPort);
        }

        int hostPort;
        try {
            hostPort = tryBind(protocol, guestPort);
        } catch (BindException e) {
            hostPort = tryBind(protocol, 0);
            LOG.debug("Host port {}/{} is taken, using {}", guestPort, protocol.transport(), hostPort);
        }
        return new Binding(protocol, guestPort, hostPort);
    }

    public static Binding bind(NetworkProtocol protocol, String guestPort) throws IOException {
        try {
            return bind(protocol, Integer.parseInt(guestPort.strip()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port '" + guestPort + "'", e);
        }
    }

    private static int tryBind(NetworkProtocol protocol, int port) throws IOException {
        var address = new InetSocketAddress(InetAddress.getLoopbackAddress(), port);
        if ("udp".equals(protocol.transport())) {
            try (var socket = new DatagramSocket(null)) {
                socket.bind(address);
                return socket.getLocalPort();
            }
        }
        try (var socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(address);
            return socket.getLocalPort();
        }
    }
}
