package org.tanzu.proxmoxmcp.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.request.IsoRequest;
import org.tanzu.proxmoxmcp.orchestration.OperationService;

/**
 * MCP tools for ISO images and container templates.
 */
@Service
public class IsoTools {

    private static final Logger logger = LoggerFactory.getLogger(IsoTools.class);

    private final OperationService operations;

    public IsoTools(OperationService operations) {
        this.operations = operations;
        logger.info("IsoTools initialized");
    }

    @Tool(name = "list_isos", description = "List ISO images on all storages that hold ISOs. Filters are optional.")
    public OperationOutcome listIsos(
            @ToolParam(description = "Filter by node", required = false) String node,
            @ToolParam(description = "Filter by storage pool", required = false) String storage) {
        logger.info("=== MCP TOOL CALLED: list_isos({}, {}) ===", node, storage);
        return operations.execute(IsoRequest.listIsos(ToolInputs.blankToNull(node), ToolInputs.blankToNull(storage)));
    }

    @Tool(name = "list_templates", description = "List LXC container templates (vztmpl). Filters are optional.")
    public OperationOutcome listTemplates(
            @ToolParam(description = "Filter by node", required = false) String node,
            @ToolParam(description = "Filter by storage pool", required = false) String storage) {
        logger.info("=== MCP TOOL CALLED: list_templates({}, {}) ===", node, storage);
        return operations.execute(IsoRequest.listTemplates(ToolInputs.blankToNull(node), ToolInputs.blankToNull(storage)));
    }

    @Tool(name = "download_iso", description = "Download an ISO image from an http(s) URL to Proxmox storage and wait for the download task")
    public OperationOutcome downloadIso(
            @ToolParam(description = "Target node name") String node,
            @ToolParam(description = "Target storage pool") String storage,
            @ToolParam(description = "URL to download from") String url,
            @ToolParam(description = "Target filename (e.g. 'ubuntu-22.04.iso')") String filename,
            @ToolParam(description = "Optional checksum for verification", required = false) String checksum,
            @ToolParam(description = "Checksum algorithm: md5, sha1, sha224, sha256 (default), sha384 or sha512", required = false) String checksum_algorithm) {
        logger.info("=== MCP TOOL CALLED: download_iso({}, {}, {}) ===", node, storage, filename);
        return operations.execute(IsoRequest.download(node, storage, url, filename,
                ToolInputs.blankToNull(checksum), ToolInputs.blankToNull(checksum_algorithm)));
    }

    @Tool(name = "delete_iso", description = "Delete an ISO image or template from storage, by filename or full volume ID")
    public OperationOutcome deleteIso(
            @ToolParam(description = "Node name") String node,
            @ToolParam(description = "Storage pool name") String storage,
            @ToolParam(description = "ISO/template filename or full volume ID") String filename) {
        logger.info("=== MCP TOOL CALLED: delete_iso({}, {}, {}) ===", node, storage, filename);
        return operations.execute(IsoRequest.delete(node, storage, filename));
    }
}
