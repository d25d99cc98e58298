package ai.vmhost.netprov;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.HostAndPort;
import com.sun.net.httpserver.HttpServer;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class HttpNetworkProvisioningClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> requests = new ArrayList<>();
    private HttpServer server;

    @Before
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            synchronized (requests) {
                requests.add(exchange.getRequestMethod() + " " + body);
            }
            final int code;
            final String answer;
            if ("POST".equals(exchange.getRequestMethod())) {
                var req = mapper.readValue(body, CreateDevicesRequest.class);
                if (req.id().equals("broken")) {
                    code = 400;
                    answer = "bridge vmhost-bridge not found";
                } else {
                    var names = new ArrayList<String>();
                    for (int i = 0; i < req.count(); i++) {
                        names.add(NetworkProvisioning.deviceName(req.id(), i));
                    }
                    code = 200;
                    answer = mapper.writeValueAsString(new Devices(names));
                }
            } else {
                code = 200;
                answer = "";
            }
            var bytes = answer.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) {
                exchange.getResponseBody().write(bytes);
            }
            exchange.close();
        });
        server.start();
    }

    @After
    public void tearDown() {
        server.stop(0);
    }

    private HttpNetworkProvisioningClient client(int port) {
        return new HttpNetworkProvisioningClient(HostAndPort.fromParts("127.0.0.1", port),
            Duration.ofSeconds(1), Duration.ofSeconds(5), mapper);
    }

    @Test
    public void createAndDelete() throws Exception {
        var client = client(server.getAddress().getPort());

        var devices = client.createDevices("vm1", 2);
        Assert.assertEquals(List.of("vm1-0", "vm1-1"), devices);

        client.deleteDevices(devices);
        Assert.assertEquals(2, requests.size());
        Assert.assertTrue(requests.get(1).startsWith("DELETE "));
        Assert.assertEquals(devices, mapper.readValue(requests.get(1).substring(7), Devices.class).devices());
    }

    @Test
    public void rejectedRequestCarriesHelperMessage() {
        var client = client(server.getAddress().getPort());
        try {
            client.createDevices("broken", 1);
            Assert.fail();
        } catch (ProvisioningException e) {
            Assert.assertEquals(400, e.status());
            Assert.assertTrue(e.getMessage().contains("bridge vmhost-bridge not found"));
        }
    }

    @Test
    public void unreachableHelperIsActionable() throws Exception {
        int port;
        try (var socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        var client = client(port);
        try {
            client.createDevices("vm1", 1);
            Assert.fail();
        } catch (HelperUnavailableException e) {
            Assert.assertTrue(e.getMessage().contains("start the 'netprov' helper"));
        }
    }

    @Test
    public void emptyDeleteIsNoop() throws Exception {
        client(server.getAddress().getPort()).deleteDevices(List.of());
        Assert.assertTrue(requests.isEmpty());
    }
}
