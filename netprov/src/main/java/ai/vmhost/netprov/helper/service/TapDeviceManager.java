package ai.vmhost.netprov.helper.service;

/**
 * Host-level operations on the bridge and its tap devices.
 */
public interface TapDeviceManager {

    /**
     * Creates the bridge if it is missing, brings it up and assigns {@code cidr} to it.
     */
    void setupBridge(String bridge, String cidr) throws NetworkDeviceException;

    /**
     * Fails with the system message when the bridge does not exist.
     */
    void checkBridge(String bridge) throws NetworkDeviceException;

    /**
     * Creates a persistent tap device, attaches it to {@code bridge} and brings it up.
     */
    void createTap(String name, String bridge) throws NetworkDeviceException;

    /**
     * @return {@code false} if there was no such device
     */
    boolean deleteLink(String name) throws NetworkDeviceException;
}
