package ai.vmhost.netprov;

import java.net.URI;

public class HelperUnavailableException extends ProvisioningException {

    public HelperUnavailableException(URI endpoint, Throwable cause) {
        super(("network helper is not reachable at %s: start the 'netprov' helper with elevated privileges "
            + "(for example with sudo) before preparing machines that need tap devices").formatted(endpoint), cause);
    }
}
