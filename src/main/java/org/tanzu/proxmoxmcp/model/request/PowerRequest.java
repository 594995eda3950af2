package org.tanzu.proxmoxmcp.model.request;

import org.tanzu.proxmoxmcp.model.ResourceKind;

/**
 * Changes the power state of one VM or container.
 *
 * {@code timeoutSeconds} is passed to graceful shutdown and reboot; it is the
 * guest's grace period, not the tracking deadline.
 */
public final class PowerRequest extends OperationRequest {

    private final String selector;
    private final ResourceKind expectedKind;
    private final PowerAction action;
    private final Integer timeoutSeconds;

    public PowerRequest(String selector, ResourceKind expectedKind, PowerAction action, Integer timeoutSeconds) {
        super(OperationKind.POWER);
        this.selector = selector;
        this.expectedKind = expectedKind;
        this.action = action;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String getOperationName() {
        String suffix = expectedKind == ResourceKind.CONTAINER ? "_container" : "_vm";
        String verb = action == PowerAction.REBOOT ? "restart" : action.getEndpoint();
        return verb + suffix;
    }

    public String getSelector() { return selector; }
    public ResourceKind getExpectedKind() { return expectedKind; }
    public PowerAction getAction() { return action; }
    public Integer getTimeoutSeconds() { return timeoutSeconds; }
}
