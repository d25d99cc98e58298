package ai.vmhost.netprov;

import java.util.List;

public interface NetworkProvisioningClient {

    /**
     * Asks the helper for {@code count} tap devices attached to its bridge.
     *
     * @return device names {@code id-0 .. id-(count-1)}
     * @throws HelperUnavailableException when the helper is not running
     * @throws ProvisioningException when the helper rejected the request
     */
    List<String> createDevices(String id, int count) throws ProvisioningException;

    /**
     * Deletes the devices. Devices that no longer exist are not an error.
     */
    void deleteDevices(List<String> devices) throws ProvisioningException;
}
