package org.tanzu.proxmoxmcp.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.request.SnapshotAction;
import org.tanzu.proxmoxmcp.model.request.SnapshotRequest;
import org.tanzu.proxmoxmcp.orchestration.OperationService;

import java.util.Locale;

/**
 * MCP tools for VM and container snapshots. The guest type is selected with
 * {@code vm_type} ("qemu" or "lxc", default qemu); a guest of the other type
 * with the same id fails with KIND_MISMATCH rather than being acted on.
 */
@Service
public class SnapshotTools {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotTools.class);

    private final OperationService operations;

    public SnapshotTools(OperationService operations) {
        this.operations = operations;
        logger.info("SnapshotTools initialized");
    }

    @Tool(name = "list_snapshots", description = "List all snapshots of a VM or container")
    public OperationOutcome listSnapshots(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM or container ID") Integer vmid,
            @ToolParam(description = "'qemu' for VMs (default), 'lxc' for containers", required = false) String vm_type) {
        logger.info("=== MCP TOOL CALLED: list_snapshots({}, {}, {}) ===", node, vmid, vm_type);
        return execute(SnapshotAction.LIST, node, vmid, vm_type, null, null, false);
    }

    @Tool(name = "create_snapshot", description = "Create a snapshot of a VM or container. vmstate=true also saves VM memory (VMs only).")
    public OperationOutcome createSnapshot(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM or container ID") Integer vmid,
            @ToolParam(description = "Snapshot name: starts with a letter, then letters, digits, '-' or '_' (max 40)") String snapname,
            @ToolParam(description = "Optional description", required = false) String description,
            @ToolParam(description = "Include memory state (VMs only, default false)", required = false) Boolean vmstate,
            @ToolParam(description = "'qemu' for VMs (default), 'lxc' for containers", required = false) String vm_type) {
        logger.info("=== MCP TOOL CALLED: create_snapshot({}, {}, {}) ===", node, vmid, snapname);
        return execute(SnapshotAction.CREATE, node, vmid, vm_type, snapname, ToolInputs.blankToNull(description),
                ToolInputs.orDefault(vmstate, false));
    }

    @Tool(name = "delete_snapshot", description = "Delete a snapshot of a VM or container")
    public OperationOutcome deleteSnapshot(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM or container ID") Integer vmid,
            @ToolParam(description = "Name of the snapshot to delete") String snapname,
            @ToolParam(description = "'qemu' for VMs (default), 'lxc' for containers", required = false) String vm_type) {
        logger.info("=== MCP TOOL CALLED: delete_snapshot({}, {}, {}) ===", node, vmid, snapname);
        return execute(SnapshotAction.DELETE, node, vmid, vm_type, snapname, null, false);
    }

    /**
     * MCP tool: Rolls a guest back to a snapshot. Snapshots taken on top of the
     * target are deleted first.
     */
    @Tool(name = "rollback_snapshot", description = "Roll back a VM or container to a snapshot. Snapshots taken after it are deleted first. The guest is stopped during rollback.")
    public OperationOutcome rollbackSnapshot(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM or container ID") Integer vmid,
            @ToolParam(description = "Name of the snapshot to restore") String snapname,
            @ToolParam(description = "'qemu' for VMs (default), 'lxc' for containers", required = false) String vm_type) {
        logger.info("=== MCP TOOL CALLED: rollback_snapshot({}, {}, {}) ===", node, vmid, snapname);
        return execute(SnapshotAction.ROLLBACK, node, vmid, vm_type, snapname, null, false);
    }

    private OperationOutcome execute(SnapshotAction action, String node, Integer vmid, String vmType,
                                     String snapname, String description, boolean vmstate) {
        String operation = action.name().toLowerCase(Locale.ROOT) + (action == SnapshotAction.LIST ? "_snapshots" : "_snapshot");
        if (!ToolInputs.isValidVmType(vmType)) {
            return ToolInputs.invalidVmType(operation, vmType);
        }
        ResourceKind kind = ResourceKind.fromApiType(vmType);
        return operations.execute(new SnapshotRequest(action, ToolInputs.selector(node, vmid), kind,
                snapname, description, vmstate));
    }
}
