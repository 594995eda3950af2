package org.tanzu.proxmoxmcp.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.request.CommandRequest;
import org.tanzu.proxmoxmcp.model.request.CreateRequest;
import org.tanzu.proxmoxmcp.model.request.DeleteRequest;
import org.tanzu.proxmoxmcp.model.request.PowerAction;
import org.tanzu.proxmoxmcp.model.request.PowerRequest;
import org.tanzu.proxmoxmcp.orchestration.OperationService;

/**
 * MCP tools for the virtual machine lifecycle.
 * 
 * Each tool builds a request, runs it through {@link OperationService} and returns
 * the resulting {@link OperationOutcome} as JSON. Parameter names are the ones
 * MCP clients already send (snake_case), so they are kept as-is.
 */
@Service
public class VmTools {

    private static final Logger logger = LoggerFactory.getLogger(VmTools.class);

    private final OperationService operations;

    public VmTools(OperationService operations) {
        this.operations = operations;
        logger.info("VmTools initialized");
    }

    /**
     * MCP tool: Creates a VM with one SCSI disk and a virtio NIC on vmbr0.
     * 
     * The disk format follows the storage: raw on block storage (LVM, ZFS, Ceph RBD),
     * qcow2 on file storage (directory, NFS, CIFS). File storage also gets a
     * cloud-init drive. Without a storage the first active pool that holds VM
     * images on the node is used.
     */
    @Tool(name = "create_vm", description = "Create a new virtual machine. Disk format (raw/qcow2) and cloud-init support are derived from the storage type.")
    public OperationOutcome createVm(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "New VM ID number (e.g. 200)") Integer vmid,
            @ToolParam(description = "VM name (e.g. 'web-server')") String name,
            @ToolParam(description = "Number of CPU cores, 1-32") Integer cpus,
            @ToolParam(description = "Memory size in MB, 512-131072 (e.g. 2048 for 2GB)") Integer memory,
            @ToolParam(description = "Disk size in GB, 5-1000") Integer disk_size,
            @ToolParam(description = "Storage name (optional, will auto-detect)", required = false) String storage,
            @ToolParam(description = "OS type (optional, default 'l26' for Linux)", required = false) String ostype,
            @ToolParam(description = "Force disk format 'raw' or 'qcow2' (optional, must be supported by the storage)", required = false) String disk_format) {
        logger.info("=== MCP TOOL CALLED: create_vm({}, {}, {}) ===", node, vmid, name);
        CreateRequest request = CreateRequest.vm()
                .node(node)
                .vmid(vmid)
                .name(name)
                .cores(cpus)
                .memoryMb(memory)
                .diskGb(disk_size)
                .storage(ToolInputs.blankToNull(storage))
                .ostype(ToolInputs.blankToNull(ostype))
                .diskFormat(ToolInputs.blankToNull(disk_format))
                .build();
        return operations.execute(request);
    }

    @Tool(name = "start_vm", description = "Start a virtual machine")
    public OperationOutcome startVm(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM ID number (e.g. 101)") Integer vmid) {
        logger.info("=== MCP TOOL CALLED: start_vm({}, {}) ===", node, vmid);
        return power(node, vmid, PowerAction.START);
    }

    @Tool(name = "stop_vm", description = "Stop a virtual machine immediately (like pulling the power plug)")
    public OperationOutcome stopVm(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM ID number (e.g. 101)") Integer vmid) {
        logger.info("=== MCP TOOL CALLED: stop_vm({}, {}) ===", node, vmid);
        return power(node, vmid, PowerAction.STOP);
    }

    @Tool(name = "shutdown_vm", description = "Shut down a virtual machine gracefully through ACPI")
    public OperationOutcome shutdownVm(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM ID number (e.g. 101)") Integer vmid) {
        logger.info("=== MCP TOOL CALLED: shutdown_vm({}, {}) ===", node, vmid);
        return power(node, vmid, PowerAction.SHUTDOWN);
    }

    @Tool(name = "reset_vm", description = "Hard-reset a virtual machine")
    public OperationOutcome resetVm(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM ID number (e.g. 101)") Integer vmid) {
        logger.info("=== MCP TOOL CALLED: reset_vm({}, {}) ===", node, vmid);
        return power(node, vmid, PowerAction.RESET);
    }

    /**
     * MCP tool: Deletes a VM and its disks. A running VM is only deleted with
     * force, in which case it is stopped first.
     */
    @Tool(name = "delete_vm", description = "Delete a virtual machine and its disks. A running VM requires force=true and is stopped first.")
    public OperationOutcome deleteVm(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM ID number (e.g. 998)") Integer vmid,
            @ToolParam(description = "Force deletion even if the VM is running", required = false) Boolean force) {
        logger.info("=== MCP TOOL CALLED: delete_vm({}, {}, force={}) ===", node, vmid, force);
        return operations.execute(new DeleteRequest(ToolInputs.selector(node, vmid), ResourceKind.VM,
                ToolInputs.orDefault(force, false)));
    }

    /**
     * MCP tool: Runs a shell command in a VM through the QEMU guest agent and
     * waits for it to exit. The guest agent must be installed and running in the VM.
     */
    @Tool(name = "execute_vm_command", description = "Execute a shell command inside a VM via the QEMU guest agent. Returns exit code, stdout and stderr.")
    public OperationOutcome executeVmCommand(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "VM ID number (e.g. 100)") Integer vmid,
            @ToolParam(description = "Shell command to run (e.g. 'uname -a')") String command) {
        logger.info("=== MCP TOOL CALLED: execute_vm_command({}, {}) ===", node, vmid);
        logger.debug("Guest command: {}", command);
        return operations.execute(new CommandRequest(ToolInputs.selector(node, vmid), command));
    }

    private OperationOutcome power(String node, Integer vmid, PowerAction action) {
        return operations.execute(new PowerRequest(ToolInputs.selector(node, vmid), ResourceKind.VM, action, null));
    }
}
