package ai.vmhost.netprov.helper.service;

import ai.vmhost.netprov.NetworkProvisioning;
import ai.vmhost.netprov.helper.config.HelperConfig;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Singleton
public class TapDeviceService {
    private static final Logger LOG = LogManager.getLogger(TapDeviceService.class);

    // Linux IFNAMSIZ minus the terminating zero
    private static final int MAX_DEVICE_NAME = 15;
    private static final Pattern VALID_ID = Pattern.compile("[a-zA-Z0-9_.]+");

    private final TapDeviceManager manager;
    private final HelperConfig config;

    public TapDeviceService(TapDeviceManager manager, HelperConfig config) {
        this.manager = manager;
        this.config = config;
    }

    /**
     * Creates {@code id-0 .. id-(count-1)} in index order. On failure the devices created so far are removed.
     */
    public List<String> createDevices(String id, int count) throws NetworkDeviceException {
        validate(id, count);
        manager.checkBridge(config.getBridgeName());

        var created = new ArrayList<String>(count);
        for (int i = 0; i < count; i++) {
            var name = NetworkProvisioning.deviceName(id, i);
            try {
                manager.createTap(name, config.getBridgeName());
            } catch (NetworkDeviceException e) {
                LOG.error("Cannot create tap device {}: {}", name, e.getMessage());
                rollback(name, created);
                throw e;
            }
            created.add(name);
            LOG.info("Tap device {} attached to {}", name, config.getBridgeName());
        }
        return created;
    }

    public void deleteDevices(List<String> devices) throws NetworkDeviceException {
        NetworkDeviceException error = null;
        for (var device : devices) {
            try {
                if (manager.deleteLink(device)) {
                    LOG.info("Tap device {} deleted", device);
                } else {
                    LOG.info("Tap device {} does not exist, skip", device);
                }
            } catch (NetworkDeviceException e) {
                LOG.error("Cannot delete tap device {}: {}", device, e.getMessage());
                if (error == null) {
                    error = e;
                } else {
                    error.addSuppressed(e);
                }
            }
        }
        if (error != null) {
            throw error;
        }
    }

    private void rollback(String failed, List<String> created) {
        try {
            manager.deleteLink(failed);
        } catch (NetworkDeviceException e) {
            LOG.debug("Half-created device {} not removed: {}", failed, e.getMessage());
        }
        for (var name : created) {
            try {
                manager.deleteLink(name);
            } catch (NetworkDeviceException e) {
                LOG.error("Cannot roll back tap device {}: {}", name, e.getMessage());
            }
        }
    }

    private static void validate(String id, int count) throws NetworkDeviceException {
        if (id == null || !VALID_ID.matcher(id).matches()) {
            throw new NetworkDeviceException("invalid device id '%s'".formatted(id));
        }
        if (count < 0) {
            throw new NetworkDeviceException("invalid device count " + count);
        }
        if (count > 0 && NetworkProvisioning.deviceName(id, count - 1).length() > MAX_DEVICE_NAME) {
            throw new NetworkDeviceException("device id '%s' is too long for %d device(s)".formatted(id, count));
        }
    }
}
