/**
 * REST endpoints over the MCP tool catalogue.
 */
package org.tanzu.proxmoxmcp.web;
