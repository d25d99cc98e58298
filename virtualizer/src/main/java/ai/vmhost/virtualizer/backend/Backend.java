package ai.vmhost.virtualizer.backend;

import ai.vmhost.virtualizer.exceptions.InvalidConfigurationException;
import ai.vmhost.virtualizer.model.DiskFormat;

/**
 * One hypervisor the host can run machines on.
 */
public interface Backend {

    /**
     * Backend type stored in the catalog, e.g. {@code qemu}.
     */
    String identity();

    /**
     * Checks opaque catalog data before it is stored.
     */
    void validateConfig(byte[] config) throws InvalidConfigurationException;

    /**
     * Disk images must have a size that is a multiple of this many bytes.
     */
    long diskAlignment();

    DiskFormat diskFormat();

    /**
     * @return true if the hypervisor is installed on this host
     */
    boolean isAvailable();

    /**
     * Creates a new machine handle in the initializing state. Nothing is acquired until it is prepared.
     *
     * @param virtualizer name of the catalog entry the machine is created from
     */
    VmHandle allocate(String virtualizer);
}
