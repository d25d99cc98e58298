package ai.vmhost.virtualizer.backend.firecracker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Document passed to {@code firecracker --config-file}.
 */
record FirecrackerMachineConfig(
    @JsonProperty("boot-source") BootSource bootSource,
    @JsonProperty("drives") List<Drive> drives,
    @JsonProperty("machine-config") MachineConfig machineConfig,
    @JsonProperty("network-interfaces") List<NetworkInterface> networkInterfaces
) {
    record BootSource(
        @JsonProperty("kernel_image_path") String kernelImagePath,
        @JsonProperty("boot_args") String bootArgs
    ) {}

    record Drive(
        @JsonProperty("drive_id") String driveId,
        @JsonProperty("path_on_host") String pathOnHost,
        @JsonProperty("is_root_device") boolean rootDevice,
        @JsonProperty("is_read_only") boolean readOnly
    ) {}

    record MachineConfig(
        @JsonProperty("vcpu_count") int vcpuCount,
        @JsonProperty("mem_size_mib") int memSizeMib
    ) {}

    record NetworkInterface(
        @JsonProperty("iface_id") String ifaceId,
        @JsonProperty("host_dev_name") String hostDevName
    ) {}
}
