package ai.vmhost.virtualizer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NetworkProtocol {
    UDP("udp"),
    TCP("tcp"),
    HTTP("http"),
    HTTPS("https");

    private final String value;

    NetworkProtocol(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Transport used for host port forwarding.
     */
    public String transport() {
        return this == UDP ? "udp" : "tcp";
    }
}
