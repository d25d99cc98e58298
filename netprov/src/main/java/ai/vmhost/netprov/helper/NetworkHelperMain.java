package ai.vmhost.netprov.helper;

import ai.vmhost.netprov.helper.config.HelperConfig;
import ai.vmhost.netprov.helper.dhcp.DhcpResponder;
import ai.vmhost.netprov.helper.dhcp.Ipv4Cidr;
import ai.vmhost.netprov.helper.dhcp.LeasePool;
import ai.vmhost.netprov.helper.service.NetworkDeviceException;
import ai.vmhost.netprov.helper.service.TapDeviceManager;
import com.google.common.net.InetAddresses;
import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.Micronaut;
import io.micronaut.runtime.server.EmbeddedServer;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.apache.commons.lang3.SystemUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.Inet4Address;
import java.net.SocketException;
import java.time.Clock;

/**
 * Privileged side process: owns the bridge, answers DHCP on it and serves tap device requests on loopback.
 */
@Singleton
public class NetworkHelperMain {
    private static final Logger LOG = LogManager.getLogger(NetworkHelperMain.class);

    private final TapDeviceManager deviceManager;
    private final HelperConfig config;
    private final HelperConfig.Dhcp dhcpConfig;
    private DhcpResponder dhcp;

    public NetworkHelperMain(TapDeviceManager deviceManager, HelperConfig config, HelperConfig.Dhcp dhcpConfig) {
        this.deviceManager = deviceManager;
        this.config = config;
        this.dhcpConfig = dhcpConfig;
    }

    public synchronized void start() throws NetworkDeviceException, SocketException {
        var subnet = Ipv4Cidr.parse(config.getBridgeCidr());
        LOG.info("Setup bridge {} with {}", config.getBridgeName(), subnet);
        deviceManager.setupBridge(config.getBridgeName(), subnet.toString());

        if (dhcpConfig.isEnabled()) {
            var dns = dhcpConfig.getDnsServers().stream()
                .map(s -> (Inet4Address) InetAddresses.forString(s))
                .toList();
            dhcp = new DhcpResponder(subnet, new LeasePool(subnet, dhcpConfig.getLeaseTime(), Clock.systemUTC()),
                dns, dhcpConfig.getPort());
            dhcp.start();
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (dhcp != null) {
            dhcp.close();
            dhcp = null;
        }
    }

    public static void main(String[] args) {
        if (!SystemUtils.IS_OS_LINUX) {
            LOG.error("Tap devices are only supported on Linux, current OS is {}", SystemUtils.OS_NAME);
            System.exit(-1);
        }

        final ApplicationContext context = Micronaut.build(args)
            .mainClass(NetworkHelperMain.class)
            .start();
        try {
            context.getBean(NetworkHelperMain.class).start();
        } catch (NetworkDeviceException | SocketException e) {
            LOG.error("Cannot start network helper (is it running with elevated privileges?): {}", e.getMessage());
            context.close();
            System.exit(-1);
        }

        var server = context.getBean(EmbeddedServer.class);
        LOG.info("Network helper listens on {}", server.getURI());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Stopping network helper");
            context.close();
        }));
    }
}
