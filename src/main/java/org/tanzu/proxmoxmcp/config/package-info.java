/**
 * Configuration for the Proxmox MCP server.
 *
 * <p>Provides Proxmox connection settings ({@link org.tanzu.proxmoxmcp.config.ProxmoxConfig}),
 * task tracking settings ({@link org.tanzu.proxmoxmcp.config.TaskSettings}),
 * JSON config file fallback ({@link org.tanzu.proxmoxmcp.config.ProxmoxConfigProcessor}),
 * and WebClient setup with optional insecure SSL ({@link org.tanzu.proxmoxmcp.config.WebClientConfig}).
 */
package org.tanzu.proxmoxmcp.config;
