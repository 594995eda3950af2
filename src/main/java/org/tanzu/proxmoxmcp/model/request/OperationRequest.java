package org.tanzu.proxmoxmcp.model.request;

/**
 * Base of all operation requests.
 *
 * Requests are immutable and built from tool or REST arguments. Each subclass
 * corresponds to exactly one {@link OperationKind}, which the dispatcher
 * switches on.
 */
public abstract class OperationRequest {

    private final OperationKind kind;

    protected OperationRequest(OperationKind kind) {
        this.kind = kind;
    }

    public final OperationKind getKind() { return kind; }

    /**
     * Name of the operation as exposed to callers, e.g. "create_vm" or "rollback_snapshot".
     */
    public abstract String getOperationName();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getOperationName() + "}";
    }
}
