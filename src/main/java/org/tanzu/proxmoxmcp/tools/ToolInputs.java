package org.tanzu.proxmoxmcp.tools;

import org.tanzu.proxmoxmcp.model.OperationError;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.Violation;

import java.util.List;

/**
 * Helpers for turning raw tool arguments into request fields.
 */
final class ToolInputs {

    private ToolInputs() {
    }

    /**
     * Builds a "node:vmid" selector from the node/vmid pair most tools take.
     * Without a node the bare vmid is used and resolved cluster-wide.
     */
    static String selector(String node, Integer vmid) {
        if (vmid == null) {
            return null;
        }
        return node == null || node.isBlank() ? String.valueOf(vmid) : node.trim() + ":" + vmid;
    }

    static OperationOutcome invalidVmType(String operation, String vmType) {
        return OperationOutcome.failed(operation, OperationError.validation(
                List.of(Violation.invalid("vm_type", "must be 'qemu' or 'lxc', got '" + vmType + "'"))));
    }

    static boolean isValidVmType(String vmType) {
        try {
            ResourceKind.fromApiType(vmType);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static boolean orDefault(Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }
}
