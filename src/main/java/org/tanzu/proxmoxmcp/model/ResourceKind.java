package org.tanzu.proxmoxmcp.model;

/**
 * The two kinds of guest a Proxmox node hosts.
 *
 * Each kind carries the path segment Proxmox uses for it ("qemu" for virtual
 * machines, "lxc" for containers) so that request paths can be built without
 * branching on the kind.
 */
public enum ResourceKind {

    VM("qemu", "VM"),
    CONTAINER("lxc", "CT");

    private final String apiType;
    private final String label;

    ResourceKind(String apiType, String label) {
        this.apiType = apiType;
        this.label = label;
    }

    /** Path segment and "vm_type" value used by the Proxmox API. */
    public String getApiType() { return apiType; }

    public String getLabel() { return label; }

    /**
     * Parses a "vm_type" tool parameter.
     *
     * @param vmType "qemu" or "lxc" (case-insensitive); null defaults to qemu
     * @return the matching kind
     * @throws IllegalArgumentException if the value is neither qemu nor lxc
     */
    public static ResourceKind fromApiType(String vmType) {
        if (vmType == null || vmType.isBlank()) {
            return VM;
        }
        for (ResourceKind kind : values()) {
            if (kind.apiType.equalsIgnoreCase(vmType.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown vm_type '" + vmType + "', expected 'qemu' or 'lxc'");
    }
}
