package ai.vmhost.netprov;

/**
 * Constants of the tap device provisioning protocol spoken between the orchestrator and the privileged helper.
 */
public final class NetworkProvisioning {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 7476;

    private NetworkProvisioning() {
    }

    public static String deviceName(String id, int index) {
        return id + "-" + index;
    }
}
