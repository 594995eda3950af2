package org.tanzu.proxmoxmcp.model.request;

import org.tanzu.proxmoxmcp.model.ResourceKind;

/**
 * Creates a VM or a container.
 *
 * For containers {@code name} is the hostname and {@code ostemplate} is the
 * template volume; {@code diskFormat} only applies to VMs.
 */
public final class CreateRequest extends OperationRequest {

    private final ResourceKind resourceKind;
    private final String node;
    private final Integer vmid;
    private final String name;
    private final Integer cores;
    private final Integer memoryMb;
    private final Integer diskGb;
    private final String storage;
    private final String ostype;
    private final String diskFormat;
    private final String ostemplate;
    private final String password;
    private final boolean unprivileged;

    private CreateRequest(Builder builder) {
        super(OperationKind.CREATE);
        this.resourceKind = builder.resourceKind;
        this.node = builder.node;
        this.vmid = builder.vmid;
        this.name = builder.name;
        this.cores = builder.cores;
        this.memoryMb = builder.memoryMb;
        this.diskGb = builder.diskGb;
        this.storage = builder.storage;
        this.ostype = builder.ostype;
        this.diskFormat = builder.diskFormat;
        this.ostemplate = builder.ostemplate;
        this.password = builder.password;
        this.unprivileged = builder.unprivileged;
    }

    /**
     * Starts a VM request. The disk format, when left unset, follows the storage.
     *
     * @return a builder for {@code create_vm}
     */
    public static Builder vm() {
        return new Builder(ResourceKind.VM);
    }

    /**
     * Starts a container request, unprivileged unless stated otherwise.
     *
     * @return a builder for {@code create_container}
     */
    public static Builder container() {
        return new Builder(ResourceKind.CONTAINER);
    }

    @Override
    public String getOperationName() {
        return resourceKind == ResourceKind.VM ? "create_vm" : "create_container";
    }

    public ResourceKind getResourceKind() { return resourceKind; }
    public String getNode() { return node; }
    public Integer getVmid() { return vmid; }
    public String getName() { return name; }
    public Integer getCores() { return cores; }
    public Integer getMemoryMb() { return memoryMb; }
    public Integer getDiskGb() { return diskGb; }
    public String getStorage() { return storage; }
    public String getOstype() { return ostype; }
    public String getDiskFormat() { return diskFormat; }
    public String getOstemplate() { return ostemplate; }
    public String getPassword() { return password; }
    public boolean isUnprivileged() { return unprivileged; }

    /**
     * Collects the create arguments as given. Nothing is checked here; ranges,
     * required fields and the free vmid are left to the validator so that all
     * problems are reported together.
     */
    public static final class Builder {
        private final ResourceKind resourceKind;
        private String node;
        private Integer vmid;
        private String name;
        private Integer cores;
        private Integer memoryMb;
        private Integer diskGb;
        private String storage;
        private String ostype;
        private String diskFormat;
        private String ostemplate;
        private String password;
        private boolean unprivileged = true;

        private Builder(ResourceKind resourceKind) {
            this.resourceKind = resourceKind;
        }

        public Builder node(String node) { this.node = node; return this; }
        /**
         * @param vmid id for the new guest, must be unused cluster-wide
         * @return this builder
         */
        public Builder vmid(Integer vmid) { this.vmid = vmid; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder cores(Integer cores) { this.cores = cores; return this; }
        /**
         * @param memoryMb memory in MiB, 512-131072
         * @return this builder
         */
        public Builder memoryMb(Integer memoryMb) { this.memoryMb = memoryMb; return this; }

        /**
         * @param diskGb size of the first disk (VM) or root filesystem (container) in GiB, 5-1000
         * @return this builder
         */
        public Builder diskGb(Integer diskGb) { this.diskGb = diskGb; return this; }

        /**
         * @param storage pool for the disk; null picks the first active pool holding
         *                the right content type on the node
         * @return this builder
         */
        public Builder storage(String storage) { this.storage = storage; return this; }
        public Builder ostype(String ostype) { this.ostype = ostype; return this; }
        /**
         * @param diskFormat "raw" or "qcow2"; VMs only
         * @return this builder
         */
        public Builder diskFormat(String diskFormat) { this.diskFormat = diskFormat; return this; }
        public Builder ostemplate(String ostemplate) { this.ostemplate = ostemplate; return this; }
        public Builder password(String password) { this.password = password; return this; }
        public Builder unprivileged(boolean unprivileged) { this.unprivileged = unprivileged; return this; }

        /**
         * @return the request, unvalidated
         */
        public CreateRequest build() {
            return new CreateRequest(this);
        }
    }
}
