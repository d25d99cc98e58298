package ai.vmhost.virtualizer.registry;

import ai.vmhost.virtualizer.backend.Backend;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Enabled backends by identity.
 */
@Singleton
public class BackendRegistry {
    private static final Logger LOG = LogManager.getLogger(BackendRegistry.class);

    private final Map<String, Backend> backends = new TreeMap<>();

    public BackendRegistry(List<Backend> backends) {
        for (var backend : backends) {
            var prev = this.backends.putIfAbsent(backend.identity(), backend);
            if (prev != null) {
                throw new IllegalStateException("Backend '%s' is registered twice: %s and %s".formatted(
                    backend.identity(), prev.getClass().getName(), backend.getClass().getName()));
            }
        }
        LOG.info("Enabled backends: {}", this.backends.keySet());
    }

    @Nullable
    public Backend get(String identity) {
        return backends.get(identity);
    }

    public List<String> identities() {
        return List.copyOf(backends.keySet());
    }

    /**
     * @return enabled backends whose hypervisor is installed on this host
     */
    public List<Backend> available() {
        return backends.values().stream().filter(Backend::isAvailable).toList();
    }
}
