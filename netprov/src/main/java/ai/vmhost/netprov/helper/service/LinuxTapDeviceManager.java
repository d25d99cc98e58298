package ai.vmhost.netprov.helper.service;

import ai.vmhost.common.ProcessRunner;
import ai.vmhost.netprov.helper.config.HelperConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.env.Environment;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

@Singleton
@Requires(notEnv = Environment.TEST)
@Requires(os = Requires.Family.LINUX)
public class LinuxTapDeviceManager implements TapDeviceManager {
    private static final Logger LOG = LogManager.getLogger(LinuxTapDeviceManager.class);

    private final ProcessRunner runner;

    public LinuxTapDeviceManager(HelperConfig config) {
        this.runner = new ProcessRunner(config.getCommandTimeout());
    }

    @Override
    public void setupBridge(String bridge, String cidr) throws NetworkDeviceException {
        var add = exec("ip", "link", "add", "name", bridge, "type", "bridge");
        if (!add.success() && !add.output().contains("File exists")) {
            throw new NetworkDeviceException("cannot create bridge %s: %s".formatted(bridge, add.output().strip()));
        }

        checked("ip", "link", "set", "dev", bridge, "up");

        var addr = exec("ip", "addr", "add", cidr, "dev", bridge);
        if (!addr.success() && !addr.output().contains("File exists")) {
            throw new NetworkDeviceException("cannot assign %s to bridge %s: %s"
                .formatted(cidr, bridge, addr.output().strip()));
        }
        LOG.info("Bridge {} is up with address {}", bridge, cidr);
    }

    @Override
    public void checkBridge(String bridge) throws NetworkDeviceException {
        var res = exec("ip", "link", "show", "dev", bridge);
        if (!res.success()) {
            throw new NetworkDeviceException(res.output().strip());
        }
    }

    @Override
    public void createTap(String name, String bridge) throws NetworkDeviceException {
        checked("ip", "tuntap", "add", "dev", name, "mode", "tap");
        checked("ip", "link", "set", "dev", name, "master", bridge);
        checked("ip", "link", "set", "dev", name, "up");
    }

    @Override
    public boolean deleteLink(String name) throws NetworkDeviceException {
        var res = exec("ip", "link", "delete", "dev", name);
        if (res.success()) {
            return true;
        }
        if (res.output().contains("Cannot find device") || res.output().contains("does not exist")) {
            return false;
        }
        throw new NetworkDeviceException("cannot delete %s: %s".formatted(name, res.output().strip()));
    }

    private void checked(String... cmd) throws NetworkDeviceException {
        var res = exec(cmd);
        if (!res.success()) {
            throw new NetworkDeviceException(res.output().strip());
        }
    }

    private ProcessRunner.Result exec(String... cmd) throws NetworkDeviceException {
        try {
            return runner.run(cmd);
        } catch (IOException e) {
            throw new NetworkDeviceException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkDeviceException("interrupted while running " + cmd[0], e);
        }
    }
}
