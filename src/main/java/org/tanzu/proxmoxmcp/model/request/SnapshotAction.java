package org.tanzu.proxmoxmcp.model.request;

public enum SnapshotAction {
    LIST,
    CREATE,
    DELETE,
    ROLLBACK
}
