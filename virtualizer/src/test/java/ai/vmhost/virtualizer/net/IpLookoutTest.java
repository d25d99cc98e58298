package ai.vmhost.virtualizer.net;

import ai.vmhost.virtualizer.console.Broadcaster;
import ai.vmhost.virtualizer.model.NicConfig;
import ai.vmhost.virtualizer.model.RouteTable;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

public class IpLookoutTest {

    @Test
    public void extractsOneAddressPerLine() {
        var text = """
            [    0.000000] Linux version 4.19.0
            eth0: ip 10.0.2.15 mask 255.255.255.0 gw 10.0.2.2
            Starting sshd on 0.0.0.0:22
            eth1 IP address: 192.168.56.101
            """;

        Assert.assertEquals(List.of("10.0.2.15", "192.168.56.101"), IpLookout.extractAddresses(text));
    }

    @Test
    public void ignoresInvalidAndRepeatedAddresses() {
        var text = "ip 999.1.1.1\nip 10.1.1.1\nip again 10.1.1.1\n";

        Assert.assertEquals(List.of("10.1.1.1"), IpLookout.extractAddresses(text));
    }

    @Test
    public void nothingToExtract() {
        Assert.assertTrue(IpLookout.extractAddresses("").isEmpty());
        Assert.assertTrue(IpLookout.extractAddresses("route 10.0.0.1 added").isEmpty());
    }

    @Test
    public void backFillsRoutesFromConsole() throws Exception {
        var console = new Broadcaster("vm", 4096);
        var routes = RouteTable.from(List.of(NicConfig.dhcp(List.of("80")), NicConfig.dhcp(List.of("8080"))));
        var lookout = new Thread(new IpLookout("vm", console.subscribe(), routes, Duration.ofSeconds(10)));
        lookout.start();

        console.write("eth0 ip: 172.16.0.2\n".getBytes(StandardCharsets.UTF_8));
        console.write("eth1 ip: 172.16.1.2\n".getBytes(StandardCharsets.UTF_8));
        lookout.join(Duration.ofSeconds(5).toMillis());

        Assert.assertFalse(lookout.isAlive());
        Assert.assertEquals("172.16.0.2", routes.interfaces().get(0).ip());
        Assert.assertEquals("172.16.0.2:80", routes.interfaces().get(0).routes().get(0).address());
        Assert.assertEquals("172.16.1.2:8080", routes.interfaces().get(1).routes().get(0).address());
        Assert.assertEquals(0, console.subscribers());
    }

    @Test
    public void givesUpAfterTimeout() {
        var console = new Broadcaster("vm", 4096);
        var routes = RouteTable.from(List.of(NicConfig.dhcp(List.of("80"))));

        new IpLookout("vm", console.subscribe(), routes, Duration.ofMillis(100)).run();

        Assert.assertNull(routes.interfaces().get(0).ip());
        Assert.assertTrue(routes.needsAddressLookup());
    }

    @Test
    public void stopsWhenConsoleCloses() throws Exception {
        var console = new Broadcaster("vm", 4096);
        var routes = RouteTable.from(List.of(NicConfig.dhcp(List.of("80"))));
        console.write("eth0 ip 10.9.9.9\n".getBytes(StandardCharsets.UTF_8));
        var sub = console.subscribe();
        console.close();

        long started = System.nanoTime();
        new IpLookout("vm", sub, routes, Duration.ofSeconds(30)).run();

        Assert.assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(5)) < 0);
        Assert.assertEquals("10.9.9.9", routes.interfaces().get(0).ip());
    }

    @Test
    public void multibyteCharacterSplitAcrossChunksIsDecoded() throws Exception {
        var console = new Broadcaster("vm", 4096);
        var routes = RouteTable.from(List.of(NicConfig.dhcp(List.of("80"))));
        var line = "réseau eth0 ip 10.4.4.4\n".getBytes(StandardCharsets.UTF_8);
        var sub = console.subscribe();
        // 'é' is bytes 1 and 2
        console.write(line, 0, 2);
        console.write(line, 2, line.length - 2);
        console.close();

        var lookout = new IpLookout("vm", sub, routes, Duration.ofSeconds(30));
        lookout.run();

        Assert.assertEquals("réseau eth0 ip 10.4.4.4\n", lookout.consoleText());
        Assert.assertEquals("10.4.4.4", routes.interfaces().get(0).ip());
    }
}
