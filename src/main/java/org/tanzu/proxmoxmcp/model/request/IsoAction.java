package org.tanzu.proxmoxmcp.model.request;

public enum IsoAction {
    LIST_ISOS,
    LIST_TEMPLATES,
    DOWNLOAD,
    DELETE
}
