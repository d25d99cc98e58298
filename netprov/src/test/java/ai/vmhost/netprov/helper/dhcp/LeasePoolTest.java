package ai.vmhost.netprov.helper.dhcp;

import com.google.common.net.InetAddresses;
import org.junit.Assert;
import org.junit.Test;

import java.net.Inet4Address;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

public class LeasePoolTest {

    private static Inet4Address ip(String s) {
        return (Inet4Address) InetAddresses.forString(s);
    }

    @Test
    public void smallSubnetIsExhausted() {
        // /30: network .0, gateway .1, one host .2, broadcast .3
        var pool = new LeasePool(Ipv4Cidr.parse("10.0.0.1/30"), Duration.ofMinutes(5), Clock.systemUTC());

        Assert.assertEquals(ip("10.0.0.2"), pool.offer("aa", null));
        Assert.assertNull(pool.offer("bb", null));
    }

    @Test
    public void expiredLeaseIsReused() {
        var clock = new MovingClock(Instant.parse("2024-01-01T00:00:00Z"));
        var pool = new LeasePool(Ipv4Cidr.parse("10.0.0.1/30"), Duration.ofMinutes(5), clock);
        Assert.assertEquals(ip("10.0.0.2"), pool.offer("aa", null));
        Assert.assertNull(pool.offer("bb", null));

        clock.now = clock.now.plus(Duration.ofMinutes(10));
        Assert.assertEquals(ip("10.0.0.2"), pool.offer("bb", null));
        Assert.assertNull(pool.leaseOf("aa"));
    }

    @Test
    public void requestedAddressIsHonoured() {
        var pool = new LeasePool(Ipv4Cidr.parse("174.72.0.1/24"), Duration.ofMinutes(5), Clock.systemUTC());

        Assert.assertEquals(ip("174.72.0.77"), pool.offer("aa", ip("174.72.0.77")));
        Assert.assertEquals(ip("174.72.0.2"), pool.offer("bb", ip("10.1.1.1")));
        Assert.assertFalse(pool.acknowledge("cc", ip("174.72.0.77")));
        Assert.assertTrue(pool.acknowledge("aa", ip("174.72.0.77")));
    }

    private static final class MovingClock extends Clock {
        Instant now;

        MovingClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
