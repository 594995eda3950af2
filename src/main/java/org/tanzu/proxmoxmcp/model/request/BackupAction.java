package org.tanzu.proxmoxmcp.model.request;

public enum BackupAction {
    LIST,
    CREATE,
    RESTORE,
    DELETE
}
