/**
 * MCP tool surface.
 *
 * <p>Each {@code *Tools} class is a Spring service whose {@code @Tool} methods are
 * registered with the MCP server and served over REST by
 * {@link org.tanzu.proxmoxmcp.web.ToolController}. State-changing tools delegate to
 * {@link org.tanzu.proxmoxmcp.orchestration.OperationService}; {@link org.tanzu.proxmoxmcp.tools.ClusterTools}
 * reads inventory directly.
 */
package org.tanzu.proxmoxmcp.tools;
