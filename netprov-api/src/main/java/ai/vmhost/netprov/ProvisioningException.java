package ai.vmhost.netprov;

import java.io.IOException;

public class ProvisioningException extends IOException {
    private final int status;

    public ProvisioningException(String message, int status) {
        super(message);
        this.status = status;
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * HTTP status returned by the helper, -1 when no response was received.
     */
    public int status() {
        return status;
    }
}
