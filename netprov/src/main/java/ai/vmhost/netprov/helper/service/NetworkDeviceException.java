package ai.vmhost.netprov.helper.service;

public class NetworkDeviceException extends Exception {
    public NetworkDeviceException(String message) {
        super(message);
    }

    public NetworkDeviceException(String message, Throwable cause) {
        super(message, cause);
    }
}
