/**
 * The resource orchestration layer.
 *
 * {@link org.tanzu.proxmoxmcp.orchestration.OperationService} validates a request with
 * {@link org.tanzu.proxmoxmcp.orchestration.RequestValidator} and hands it to
 * {@link org.tanzu.proxmoxmcp.orchestration.OperationDispatcher}, which resolves
 * targets ({@link org.tanzu.proxmoxmcp.orchestration.ResourceResolver}), picks disk
 * formats ({@link org.tanzu.proxmoxmcp.orchestration.StorageProfileDetector}), submits
 * the Proxmox call and follows the resulting task
 * ({@link org.tanzu.proxmoxmcp.orchestration.TaskTracker}). Every result passes through
 * {@link org.tanzu.proxmoxmcp.orchestration.ResultNormalizer}.
 */
package org.tanzu.proxmoxmcp.orchestration;
