package org.tanzu.proxmoxmcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.tanzu.proxmoxmcp.tools.BackupTools;
import org.tanzu.proxmoxmcp.tools.ClusterTools;
import org.tanzu.proxmoxmcp.tools.ContainerTools;
import org.tanzu.proxmoxmcp.tools.IsoTools;
import org.tanzu.proxmoxmcp.tools.SnapshotTools;
import org.tanzu.proxmoxmcp.tools.VmTools;

import java.util.List;

/**
 * Main Spring Boot application class for the Proxmox MCP (Model Context Protocol) Server.
 * 
 * This application exposes Proxmox VE operations as MCP tools for AI assistants and
 * as REST endpoints for plain HTTP clients. Tool calls that change state (VM and
 * container lifecycle, snapshots, backups, ISO images) are validated, submitted to
 * the Proxmox API and followed until the Proxmox task finishes.
 * 
 * Key features:
 * - Connects to Proxmox VE with an API token
 * - Storage-aware VM creation (raw disks on block storage, qcow2 on file storage)
 * - Structured results with a fixed error taxonomy
 * - Configuration through properties, environment variables or a JSON file
 * 
 * @author Proxmox MCP Team
 * @version 1.0.0
 */
@SpringBootApplication
@EnableConfigurationProperties
public class ProxmoxMcpApplication {

    /**
     * Main application entry point.
     * 
     * Sets the MCP server identity as system properties so it wins over any
     * configuration in application.properties or the environment, then starts
     * Spring Boot.
     * 
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "proxmox-mcp");
        System.setProperty("spring.ai.mcp.server.name", "proxmox-mcp");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");
        
        SpringApplication.run(ProxmoxMcpApplication.class, args);
    }

    /**
     * Registers every tool class with the MCP server. The same callbacks back the
     * REST endpoints in {@link org.tanzu.proxmoxmcp.web.ToolController}.
     * 
     * @return List of ToolCallback objects, one per {@code @Tool} method
     */
    @Bean
    public List<ToolCallback> registerTools(ClusterTools clusterTools, VmTools vmTools, ContainerTools containerTools,
                                            SnapshotTools snapshotTools, BackupTools backupTools, IsoTools isoTools) {
        return List.of(ToolCallbacks.from(clusterTools, vmTools, containerTools, snapshotTools, backupTools, isoTools));
    }
}
