package org.tanzu.proxmoxmcp.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.request.BackupRequest;
import org.tanzu.proxmoxmcp.orchestration.OperationService;

/**
 * MCP tools for vzdump backups.
 */
@Service
public class BackupTools {

    private static final Logger logger = LoggerFactory.getLogger(BackupTools.class);

    private final OperationService operations;

    public BackupTools(OperationService operations) {
        this.operations = operations;
        logger.info("BackupTools initialized");
    }

    @Tool(name = "list_backups", description = "List available backups across the cluster, newest first. All filters are optional.")
    public OperationOutcome listBackups(
            @ToolParam(description = "Filter by node", required = false) String node,
            @ToolParam(description = "Filter by storage pool", required = false) String storage,
            @ToolParam(description = "Filter by VM/container ID", required = false) Integer vmid) {
        logger.info("=== MCP TOOL CALLED: list_backups({}, {}, {}) ===", node, storage, vmid);
        return operations.execute(BackupRequest.list(ToolInputs.blankToNull(node), ToolInputs.blankToNull(storage), vmid));
    }

    @Tool(name = "create_backup", description = "Back up a VM or container with vzdump and wait for the backup task to finish")
    public OperationOutcome createBackup(
            @ToolParam(description = "Node where the VM/container runs") String node,
            @ToolParam(description = "VM or container ID to back up") Integer vmid,
            @ToolParam(description = "Target backup storage") String storage,
            @ToolParam(description = "Compression: 0, gzip, lz4 or zstd (default zstd)", required = false) String compress,
            @ToolParam(description = "Backup mode: snapshot, suspend or stop (default snapshot)", required = false) String mode,
            @ToolParam(description = "Optional notes stored with the backup", required = false) String notes) {
        logger.info("=== MCP TOOL CALLED: create_backup({}, {}, {}) ===", node, vmid, storage);
        return operations.execute(BackupRequest.create(node, vmid, storage,
                ToolInputs.blankToNull(compress), ToolInputs.blankToNull(mode), ToolInputs.blankToNull(notes)));
    }

    /**
     * MCP tool: Restores a backup archive as a new guest. Archives named
     * vzdump-lxc-* (or stored under ct/) become containers, all others VMs.
     */
    @Tool(name = "restore_backup", description = "Restore a VM or container from a backup archive into a new ID")
    public OperationOutcome restoreBackup(
            @ToolParam(description = "Target node for the restore") String node,
            @ToolParam(description = "Backup volume ID (from list_backups)") String archive,
            @ToolParam(description = "New VM/container ID for the restored guest") Integer vmid,
            @ToolParam(description = "Target storage for disks (optional)", required = false) String storage,
            @ToolParam(description = "Generate unique MAC addresses (default true)", required = false) Boolean unique) {
        logger.info("=== MCP TOOL CALLED: restore_backup({}, {}, {}) ===", node, archive, vmid);
        return operations.execute(BackupRequest.restore(node, archive, vmid, ToolInputs.blankToNull(storage),
                ToolInputs.orDefault(unique, true)));
    }

    @Tool(name = "delete_backup", description = "Delete a backup file from storage. Protected backups are refused.")
    public OperationOutcome deleteBackup(
            @ToolParam(description = "Node name") String node,
            @ToolParam(description = "Storage pool name") String storage,
            @ToolParam(description = "Backup volume ID to delete") String volid) {
        logger.info("=== MCP TOOL CALLED: delete_backup({}, {}, {}) ===", node, storage, volid);
        return operations.execute(BackupRequest.delete(node, storage, volid));
    }
}
