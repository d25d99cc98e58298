package ai.vmhost.netprov.helper.service;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.env.Environment;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Singleton
@Requires(env = Environment.TEST)
public class FakeTapDeviceManager implements TapDeviceManager {
    private final Set<String> bridges = new LinkedHashSet<>();
    private final Set<String> links = new LinkedHashSet<>();
    private final List<String> history = new ArrayList<>();
    private final Set<String> failOn = new LinkedHashSet<>();

    @Override
    public synchronized void setupBridge(String bridge, String cidr) {
        bridges.add(bridge);
    }

    @Override
    public synchronized void checkBridge(String bridge) throws NetworkDeviceException {
        if (!bridges.contains(bridge)) {
            throw new NetworkDeviceException("Device \"%s\" does not exist.".formatted(bridge));
        }
    }

    @Override
    public synchronized void createTap(String name, String bridge) throws NetworkDeviceException {
        history.add("create " + name);
        if (failOn.contains(name)) {
            throw new NetworkDeviceException("ioctl(TUNSETIFF): Operation not permitted");
        }
        links.add(name);
    }

    @Override
    public synchronized boolean deleteLink(String name) {
        history.add("delete " + name);
        return links.remove(name);
    }

    public synchronized Set<String> links() {
        return Set.copyOf(links);
    }

    public synchronized List<String> history() {
        return List.copyOf(history);
    }

    public synchronized void failOn(String name) {
        failOn.add(name);
    }

    public synchronized void removeExternally(String name) {
        links.remove(name);
    }

    public synchronized void reset(boolean withBridge, String bridge) {
        bridges.clear();
        links.clear();
        history.clear();
        failOn.clear();
        if (withBridge) {
            bridges.add(bridge);
        }
    }
}
