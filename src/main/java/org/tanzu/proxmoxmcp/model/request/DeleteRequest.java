package org.tanzu.proxmoxmcp.model.request;

import org.tanzu.proxmoxmcp.model.ResourceKind;

/**
 * Destroys a VM or container. With {@code force} a running guest is stopped first.
 */
public final class DeleteRequest extends OperationRequest {

    private final String selector;
    private final ResourceKind expectedKind;
    private final boolean force;

    public DeleteRequest(String selector, ResourceKind expectedKind, boolean force) {
        super(OperationKind.DELETE);
        this.selector = selector;
        this.expectedKind = expectedKind;
        this.force = force;
    }

    @Override
    public String getOperationName() {
        return expectedKind == ResourceKind.CONTAINER ? "delete_container" : "delete_vm";
    }

    public String getSelector() { return selector; }
    public ResourceKind getExpectedKind() { return expectedKind; }
    public boolean isForce() { return force; }
}
