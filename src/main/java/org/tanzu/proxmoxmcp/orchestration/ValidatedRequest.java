package org.tanzu.proxmoxmcp.orchestration;

import org.tanzu.proxmoxmcp.model.request.OperationRequest;

/**
 * A request that passed {@link RequestValidator}. Only the validator creates these,
 * so the dispatcher cannot be handed unchecked input.
 */
public final class ValidatedRequest {

    private final OperationRequest request;

    ValidatedRequest(OperationRequest request) {
        this.request = request;
    }

    public OperationRequest getRequest() { return request; }

    @Override
    public String toString() {
        return "ValidatedRequest{" + request + "}";
    }
}
