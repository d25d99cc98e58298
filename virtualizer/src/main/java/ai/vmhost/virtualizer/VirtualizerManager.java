package ai.vmhost.virtualizer;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.model.db.exceptions.AlreadyExistsException;
import ai.vmhost.model.db.exceptions.NotFoundException;
import ai.vmhost.virtualizer.backend.Backend;
import ai.vmhost.virtualizer.backend.VmHandle;
import ai.vmhost.virtualizer.catalog.VirtualizerDao;
import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.exceptions.InvalidStateException;
import ai.vmhost.virtualizer.exceptions.VmTeardownException;
import ai.vmhost.virtualizer.model.CatalogEntry;
import ai.vmhost.virtualizer.model.DiskFormat;
import ai.vmhost.virtualizer.model.PrepareArgs;
import ai.vmhost.virtualizer.registry.ActiveVms;
import ai.vmhost.virtualizer.registry.BackendRegistry;
import jakarta.annotation.Nullable;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;

/**
 * Entry point for the host daemon: the catalog of virtualizers and the machines prepared from them.
 */
@Singleton
public class VirtualizerManager {
    private static final Logger LOG = LogManager.getLogger(VirtualizerManager.class);

    private final VirtualizerDao dao;
    private final BackendRegistry backends;
    private final ActiveVms activeVms;

    public VirtualizerManager(VirtualizerDao dao, BackendRegistry backends, ActiveVms activeVms) {
        this.dao = dao;
        this.backends = backends;
        this.activeVms = activeVms;
    }

    public void createVirtualizer(String name, String type, byte[] data)
        throws InvalidConfigurationException, SQLException
    {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("virtualizer name must not be empty");
        }
        var backend = backend(type);
        backend.validateConfig(data);

        dao.create(new CatalogEntry(name, type, data), null);
        LOG.info("Virtualizer '{}' of type {} created", name, type);
    }

    /**
     * Deleting a missing virtualizer is not an error.
     */
    public void deleteVirtualizer(String name) throws SQLException {
        if (dao.delete(name, null)) {
            LOG.info("Virtualizer '{}' deleted", name);
        }
    }

    public List<CatalogEntry> list() throws SQLException {
        return dao.list(null);
    }

    public CatalogEntry virtualizerData(String name) throws SQLException {
        var entry = dao.get(name, null);
        if (entry == null) {
            throw new NotFoundException("no virtualizer named '%s'".formatted(name));
        }
        return entry;
    }

    /**
     * Checks the stored configuration against its backend.
     */
    public void validate(String name) throws SQLException, InvalidConfigurationException {
        var entry = virtualizerData(name);
        backend(entry.type()).validateConfig(entry.data());
    }

    public DiskFormat diskFormat(String name) throws SQLException, InvalidConfigurationException {
        return backend(virtualizerData(name).type()).diskFormat();
    }

    public long diskAlignment(String name) throws SQLException, InvalidConfigurationException {
        return backend(virtualizerData(name).type()).diskAlignment();
    }

    /**
     * Allocates a machine from virtualizer {@code virtualizer} and starts its preparation.
     *
     * @return preparation operation; the machine is available through {@link #get(String)} once it completes
     */
    public Operation prepare(String virtualizer, PrepareArgs args)
        throws SQLException, InvalidConfigurationException, InvalidStateException
    {
        var entry = virtualizerData(virtualizer);
        var backend = backend(entry.type());

        if (activeVms.contains(args.name())) {
            throw new AlreadyExistsException("virtual machine already exists");
        }

        var vm = backend.allocate(entry.name());
        vm.initialize(entry.data());
        return vm.prepare(args);
    }

    @Nullable
    public VmHandle get(String vmName) {
        return activeVms.get(vmName);
    }

    public Set<String> activeVms() {
        return activeVms.names();
    }

    public List<String> availableBackends() {
        return backends.available().stream().map(Backend::identity).toList();
    }

    /**
     * Force-closes every active machine. Failures are logged and do not stop the others from being closed.
     */
    @PreDestroy
    public void close() {
        var vms = activeVms.all();
        if (vms.isEmpty()) {
            return;
        }

        LOG.info("Closing {} active machine(s)", vms.size());
        for (var vm : vms) {
            try {
                vm.close(true);
            } catch (VmTeardownException e) {
                LOG.error("Error while closing machine '{}': {}", vm.name(), e.getMessage(), e);
            } catch (RuntimeException e) {
                LOG.error("Unexpected error while closing machine '{}': {}", vm.name(), e.getMessage(), e);
            }
        }
    }

    private Backend backend(String type) throws InvalidConfigurationException {
        var backend = backends.get(type);
        if (backend == null) {
            throw new InvalidConfigurationException("unknown virtualizer type '%s', supported: %s"
                .formatted(type, backends.identities()));
        }
        return backend;
    }
}
