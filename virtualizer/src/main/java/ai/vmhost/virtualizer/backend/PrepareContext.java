package ai.vmhost.virtualizer.backend;

import ai.vmhost.longrunning.Operation;
import ai.vmhost.virtualizer.model.PrepareArgs;
import ai.vmhost.virtualizer.model.RouteTable;

import java.nio.file.Path;

/**
 * @param vmId    id of the machine
 * @param args    what the caller asked for
 * @param op      preparation operation, for progress reporting
 * @param routes  network interfaces of the machine; drivers fill in addresses they know
 * @param workDir per-machine directory, removed on release
 */
public record PrepareContext(
    String vmId,
    PrepareArgs args,
    Operation op,
    RouteTable routes,
    Path workDir
) {}
