package org.tanzu.proxmoxmcp.model.request;

import java.util.Locale;

/**
 * vzdump backups: list, create, restore into a new guest, delete.
 *
 * Not every field applies to every action; the validator checks the ones the
 * action needs.
 */
public final class BackupRequest extends OperationRequest {

    private final BackupAction action;
    private final String node;
    private final Integer vmid;
    private final String storage;
    private final String compress;
    private final String mode;
    private final String notes;
    private final String archive;
    private final boolean unique;
    private final String volid;

    private BackupRequest(BackupAction action, String node, Integer vmid, String storage, String compress,
                          String mode, String notes, String archive, boolean unique, String volid) {
        super(OperationKind.BACKUP);
        this.action = action;
        this.node = node;
        this.vmid = vmid;
        this.storage = storage;
        this.compress = compress;
        this.mode = mode;
        this.notes = notes;
        this.archive = archive;
        this.unique = unique;
        this.volid = volid;
    }

    /**
     * Lists backups across the cluster.
     *
     * @param node only this node, or null for all online nodes
     * @param storage only this storage, or null for every storage holding backups
     * @param vmid only backups of this guest, or null for all
     * @return the request
     */
    public static BackupRequest list(String node, String storage, Integer vmid) {
        return new BackupRequest(BackupAction.LIST, node, vmid, storage, null, null, null, null, false, null);
    }

    /**
     * @param node node hosting the guest
     * @param vmid guest to back up
     * @param storage target storage, must accept backup content
     * @param compress 0, gzip, lz4 or zstd; null means zstd
     * @param mode snapshot, suspend or stop; null means snapshot
     * @param notes notes template, may be null
     * @return the request
     */
    public static BackupRequest create(String node, Integer vmid, String storage, String compress, String mode, String notes) {
        return new BackupRequest(BackupAction.CREATE, node, vmid, storage, compress, mode, notes, null, false, null);
    }

    /**
     * Restores an archive as a new guest. Whether it becomes a VM or a container
     * follows from the archive name.
     *
     * @param node node to restore on
     * @param archive backup volume id
     * @param vmid id for the restored guest, must be unused
     * @param storage storage for the restored disks, or null for the archive's own
     * @param unique whether to assign new MAC addresses
     * @return the request
     */
    public static BackupRequest restore(String node, String archive, Integer vmid, String storage, boolean unique) {
        return new BackupRequest(BackupAction.RESTORE, node, vmid, storage, null, null, null, archive, unique, null);
    }

    public static BackupRequest delete(String node, String storage, String volid) {
        return new BackupRequest(BackupAction.DELETE, node, null, storage, null, null, null, null, false, volid);
    }

    @Override
    public String getOperationName() {
        return action == BackupAction.LIST ? "list_backups" : action.name().toLowerCase(Locale.ROOT) + "_backup";
    }

    public BackupAction getAction() { return action; }
    public String getNode() { return node; }
    public Integer getVmid() { return vmid; }
    public String getStorage() { return storage; }
    public String getCompress() { return compress; }
    public String getMode() { return mode; }
    public String getNotes() { return notes; }
    public String getArchive() { return archive; }
    public boolean isUnique() { return unique; }
    public String getVolid() { return volid; }
}
