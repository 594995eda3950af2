package org.tanzu.proxmoxmcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A VM or container identified cluster-wide by node, kind and id.
 *
 * Instances are produced by the resolver for one operation and never cached:
 * guests migrate between nodes and get renamed outside of this server.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ResourceRef {

    private final String node;
    private final ResourceKind kind;
    private final int vmid;
    private final String name;

    public ResourceRef(String node, ResourceKind kind, int vmid, String name) {
        this.node = Objects.requireNonNull(node, "node");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.vmid = vmid;
        this.name = name;
    }

    public String getNode() { return node; }
    public ResourceKind getKind() { return kind; }
    public int getVmid() { return vmid; }
    public String getName() { return name; }

    /** Label used in log lines and error details, e.g. "VM 200 (web) on pve". */
    public String describe() {
        return kind.getLabel() + " " + vmid + (name != null ? " (" + name + ")" : "") + " on " + node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceRef)) return false;
        ResourceRef that = (ResourceRef) o;
        return vmid == that.vmid && node.equals(that.node) && kind == that.kind && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, kind, vmid, name);
    }

    @Override
    public String toString() {
        return "ResourceRef{node='" + node + "', kind=" + kind + ", vmid=" + vmid + ", name='" + name + "'}";
    }
}
