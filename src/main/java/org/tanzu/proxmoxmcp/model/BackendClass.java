package org.tanzu.proxmoxmcp.model;

/**
 * How a storage pool stores guest disks: as block devices or as image files.
 */
public enum BackendClass {
    BLOCK_BASED,
    FILE_BASED
}
