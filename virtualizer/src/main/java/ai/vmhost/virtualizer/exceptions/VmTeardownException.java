package ai.vmhost.virtualizer.exceptions;

import java.util.List;

/**
 * Some resources of a machine could not be released. The machine is gone from the registry regardless.
 */
public class VmTeardownException extends Exception {

    public VmTeardownException(String vmName, List<? extends Exception> errors) {
        super("failed to tear down '%s': %s".formatted(vmName, errors.get(0).getMessage()), errors.get(0));
        for (int i = 1; i < errors.size(); i++) {
            addSuppressed(errors.get(i));
        }
    }
}
