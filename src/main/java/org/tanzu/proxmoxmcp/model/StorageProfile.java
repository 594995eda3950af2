package org.tanzu.proxmoxmcp.model;

/**
 * Disk-related characteristics of one storage pool, derived from its backend type.
 *
 * The disk format is a function of the backend class: block storage gets raw
 * volumes, file storage gets qcow2 images.
 */
public final class StorageProfile {

    private final String poolName;
    private final String backendType;
    private final BackendClass backendClass;
    private final boolean supportsCloudInit;
    private final boolean supportsSnapshotWhileRunning;

    public StorageProfile(String poolName, String backendType, BackendClass backendClass,
                          boolean supportsCloudInit, boolean supportsSnapshotWhileRunning) {
        this.poolName = poolName;
        this.backendType = backendType;
        this.backendClass = backendClass;
        this.supportsCloudInit = supportsCloudInit;
        this.supportsSnapshotWhileRunning = supportsSnapshotWhileRunning;
    }

    public String getPoolName() { return poolName; }
    public String getBackendType() { return backendType; }
    public BackendClass getBackendClass() { return backendClass; }
    public boolean isSupportsCloudInit() { return supportsCloudInit; }
    public boolean isSupportsSnapshotWhileRunning() { return supportsSnapshotWhileRunning; }

    public DiskFormat getDiskFormat() {
        return backendClass == BackendClass.BLOCK_BASED ? DiskFormat.RAW : DiskFormat.QCOW2;
    }

    /**
     * Whether a caller-forced format can live on this pool. Block storage only holds raw volumes.
     */
    public boolean accepts(DiskFormat format) {
        return backendClass == BackendClass.FILE_BASED || format == DiskFormat.RAW;
    }

    @Override
    public String toString() {
        return "StorageProfile{pool='" + poolName + "', type='" + backendType + "', class=" + backendClass
                + ", format=" + getDiskFormat().token() + ", cloudInit=" + supportsCloudInit
                + ", liveSnapshot=" + supportsSnapshotWhileRunning + "}";
    }
}
