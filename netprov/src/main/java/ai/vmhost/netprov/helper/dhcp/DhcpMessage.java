package ai.vmhost.netprov.helper.dhcp;

import com.google.common.net.InetAddresses;
import jakarta.annotation.Nullable;

import java.net.Inet4Address;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * BOOTP/DHCP message (RFC 2131) with its options (RFC 2132).
 */
public final class DhcpMessage {
    public static final int BOOT_REQUEST = 1;
    public static final int BOOT_REPLY = 2;

    public static final int OPTION_PAD = 0;
    public static final int OPTION_SUBNET_MASK = 1;
    public static final int OPTION_ROUTER = 3;
    public static final int OPTION_DNS = 6;
    public static final int OPTION_HOSTNAME = 12;
    public static final int OPTION_REQUESTED_IP = 50;
    public static final int OPTION_LEASE_TIME = 51;
    public static final int OPTION_MESSAGE_TYPE = 53;
    public static final int OPTION_SERVER_ID = 54;
    public static final int OPTION_END = 255;

    private static final int MAGIC_COOKIE = 0x63825363;
    private static final int FIXED_PART = 236;
    private static final int MIN_REPLY_SIZE = 300;
    private static final Inet4Address ANY = InetAddresses.fromInteger(0);

    public enum Type {
        DISCOVER(1),
        OFFER(2),
        REQUEST(3),
        DECLINE(4),
        ACK(5),
        NAK(6),
        RELEASE(7),
        INFORM(8);

        private final int code;

        Type(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        @Nullable
        public static Type of(int code) {
            for (var t : values()) {
                if (t.code == code) {
                    return t;
                }
            }
            return null;
        }
    }

    private int op = BOOT_REQUEST;
    private int hardwareType = 1;
    private int hardwareLength = 6;
    private int xid;
    private int flags;
    private Inet4Address clientAddress = ANY;
    private Inet4Address yourAddress = ANY;
    private Inet4Address serverAddress = ANY;
    private Inet4Address relayAddress = ANY;
    private byte[] hardwareAddress = new byte[16];
    private final Map<Integer, byte[]> options = new LinkedHashMap<>();

    public static DhcpMessage parse(byte[] data, int length) throws MalformedMessageException {
        if (length < FIXED_PART + 4) {
            throw new MalformedMessageException("message too short: " + length + " bytes");
        }
        var buf = ByteBuffer.wrap(data, 0, length);
        var msg = new DhcpMessage();
        try {
            msg.op = Byte.toUnsignedInt(buf.get());
            msg.hardwareType = Byte.toUnsignedInt(buf.get());
            msg.hardwareLength = Byte.toUnsignedInt(buf.get());
            buf.get(); // hops
            msg.xid = buf.getInt();
            buf.getShort(); // secs
            msg.flags = Short.toUnsignedInt(buf.getShort());
            msg.clientAddress = readAddress(buf);
            msg.yourAddress = readAddress(buf);
            msg.serverAddress = readAddress(buf);
            msg.relayAddress = readAddress(buf);
            buf.get(msg.hardwareAddress);
            buf.position(buf.position() + 64 + 128); // sname, file

            if (buf.getInt() != MAGIC_COOKIE) {
                throw new MalformedMessageException("bad magic cookie");
            }
            while (buf.hasRemaining()) {
                int code = Byte.toUnsignedInt(buf.get());
                if (code == OPTION_PAD) {
                    continue;
                }
                if (code == OPTION_END) {
                    break;
                }
                int len = Byte.toUnsignedInt(buf.get());
                var value = new byte[len];
                buf.get(value);
                msg.options.put(code, value);
            }
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new MalformedMessageException("truncated message");
        }
        if (msg.hardwareLength > 16) {
            throw new MalformedMessageException("bad hardware address length " + msg.hardwareLength);
        }
        return msg;
    }

    public byte[] encode() {
        int optionsSize = 4 + 1;
        for (var value : options.values()) {
            optionsSize += 2 + value.length;
        }
        var buf = ByteBuffer.allocate(Math.max(MIN_REPLY_SIZE, FIXED_PART + optionsSize));
        buf.put((byte) op);
        buf.put((byte) hardwareType);
        buf.put((byte) hardwareLength);
        buf.put((byte) 0);
        buf.putInt(xid);
        buf.putShort((short) 0);
        buf.putShort((short) flags);
        buf.put(clientAddress.getAddress());
        buf.put(yourAddress.getAddress());
        buf.put(serverAddress.getAddress());
        buf.put(relayAddress.getAddress());
        buf.put(hardwareAddress);
        buf.position(buf.position() + 64 + 128);
        buf.putInt(MAGIC_COOKIE);
        for (var option : options.entrySet()) {
            buf.put(option.getKey().byteValue());
            buf.put((byte) option.getValue().length);
            buf.put(option.getValue());
        }
        buf.put((byte) OPTION_END);
        return buf.array();
    }

    /**
     * Reply skeleton sharing the transaction id, flags, relay and client hardware address of this request.
     */
    public DhcpMessage reply(Type type, Inet4Address offered, Inet4Address server) {
        var reply = new DhcpMessage();
        reply.op = BOOT_REPLY;
        reply.hardwareType = hardwareType;
        reply.hardwareLength = hardwareLength;
        reply.xid = xid;
        reply.flags = flags;
        reply.yourAddress = offered;
        reply.serverAddress = server;
        reply.relayAddress = relayAddress;
        reply.hardwareAddress = hardwareAddress.clone();
        reply.setOption(OPTION_MESSAGE_TYPE, new byte[] {(byte) type.code()});
        reply.setOption(OPTION_SERVER_ID, server.getAddress());
        return reply;
    }

    @Nullable
    public Type type() {
        var value = options.get(OPTION_MESSAGE_TYPE);
        return value == null || value.length != 1 ? null : Type.of(Byte.toUnsignedInt(value[0]));
    }

    public String clientMac() {
        var sb = new StringBuilder();
        for (int i = 0; i < Math.min(hardwareLength, 16); i++) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append("%02x".formatted(hardwareAddress[i]));
        }
        return sb.toString();
    }

    @Nullable
    public Inet4Address requestedAddress() {
        var value = options.get(OPTION_REQUESTED_IP);
        if (value != null && value.length == 4) {
            return toAddress(value);
        }
        return clientAddress.equals(ANY) ? null : clientAddress;
    }

    public DhcpMessage setOption(int code, byte[] value) {
        if (value.length > 255) {
            throw new IllegalArgumentException("Option " + code + " is too long");
        }
        options.put(code, value.clone());
        return this;
    }

    @Nullable
    public byte[] option(int code) {
        var value = options.get(code);
        return value == null ? null : value.clone();
    }

    public int op() {
        return op;
    }

    public int xid() {
        return xid;
    }

    public DhcpMessage setXid(int xid) {
        this.xid = xid;
        return this;
    }

    public Inet4Address yourAddress() {
        return yourAddress;
    }

    public DhcpMessage setHardwareAddress(byte[] mac) {
        if (mac.length > 16) {
            throw new IllegalArgumentException("Hardware address is too long");
        }
        this.hardwareAddress = Arrays.copyOf(mac, 16);
        this.hardwareLength = mac.length;
        return this;
    }

    private static Inet4Address readAddress(ByteBuffer buf) {
        var raw = new byte[4];
        buf.get(raw);
        return toAddress(raw);
    }

    private static Inet4Address toAddress(byte[] raw) {
        return InetAddresses.fromInteger(ByteBuffer.wrap(raw).getInt());
    }

    public static final class MalformedMessageException extends Exception {
        public MalformedMessageException(String message) {
            super(message);
        }
    }
}
