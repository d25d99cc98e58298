package ai.vmhost.virtualizer.model;

import java.nio.file.Path;

/**
 * @param name      unique name of the machine among the active ones
 * @param config    machine description
 * @param disk      disk image in the backend's format
 * @param autoStart start the machine as soon as it is ready
 */
public record PrepareArgs(
    String name,
    VmConfig config,
    Path disk,
    boolean autoStart
) {}
