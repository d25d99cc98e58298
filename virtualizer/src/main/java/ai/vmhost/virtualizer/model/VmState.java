package ai.vmhost.virtualizer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a machine. Held in memory only.
 */
public enum VmState {
    INITIALIZING("initializing"),
    READY("ready"),
    CHANGING("changing"),
    ALIVE("alive"),
    BROKEN("broken"),
    DELETED("deleted");

    private final String value;

    VmState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
