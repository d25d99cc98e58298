package ai.vmhost.virtualizer.exceptions;

import ai.vmhost.virtualizer.model.VmState;

/**
 * Requested transition is not allowed from the machine's current state.
 */
public class InvalidStateException extends Exception {
    private final VmState state;

    public InvalidStateException(String message, VmState state) {
        super(message);
        this.state = state;
    }

    public VmState state() {
        return state;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
