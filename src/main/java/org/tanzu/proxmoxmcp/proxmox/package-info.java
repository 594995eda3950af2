/**
 * Proxmox VE integration layer.
 *
 * <p>{@link org.tanzu.proxmoxmcp.proxmox.ProxmoxBackend} is the capability set the
 * orchestration layer depends on; {@link org.tanzu.proxmoxmcp.proxmox.ProxmoxClient}
 * implements it over WebClient. Tests substitute an in-memory backend.
 */
package org.tanzu.proxmoxmcp.proxmox;
