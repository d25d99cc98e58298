package ai.vmhost.virtualizer.registry;

import ai.vmhost.virtualizer.backend.VmHandle;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Machines that are prepared and not yet closed, keyed by name.
 */
@Singleton
public class ActiveVms {
    private static final Logger LOG = LogManager.getLogger(ActiveVms.class);

    private final ConcurrentHashMap<String, VmHandle> vms = new ConcurrentHashMap<>();

    /**
     * @return {@code false} if another machine already holds the name
     */
    public boolean register(String name, VmHandle vm) {
        var prev = vms.putIfAbsent(name, vm);
        if (prev != null && prev != vm) {
            LOG.warn("Machine name '{}' is already taken by {}", name, prev.id());
            return false;
        }
        LOG.debug("Machine {} registered as '{}'", vm.id(), name);
        return true;
    }

    /**
     * Removes the entry only if it still belongs to {@code vm}.
     */
    public boolean remove(String name, VmHandle vm) {
        var removed = vms.remove(name, vm);
        if (removed) {
            LOG.debug("Machine {} ('{}') unregistered", vm.id(), name);
        }
        return removed;
    }

    @Nullable
    public VmHandle get(String name) {
        return vms.get(name);
    }

    public boolean contains(String name) {
        return vms.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(vms.keySet());
    }

    public List<VmHandle> all() {
        return List.copyOf(vms.values());
    }

    public int size() {
        return vms.size();
    }
}
