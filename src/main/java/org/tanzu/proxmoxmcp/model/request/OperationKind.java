package org.tanzu.proxmoxmcp.model.request;

/**
 * Discriminator of the {@link OperationRequest} union.
 */
public enum OperationKind {
    CREATE,
    DELETE,
    POWER,
    SNAPSHOT,
    BACKUP,
    ISO,
    COMMAND
}
