package ai.vmhost.virtualizer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiskFormat {
    RAW("raw"),
    QCOW2("qcow2"),
    VMDK("vmdk"),
    VHD("vhd");

    private final String value;

    DiskFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
