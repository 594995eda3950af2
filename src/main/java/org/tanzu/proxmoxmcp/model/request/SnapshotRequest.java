package org.tanzu.proxmoxmcp.model.request;

import org.tanzu.proxmoxmcp.model.ResourceKind;

import java.util.Locale;

/**
 * Lists, creates, deletes or rolls back snapshots of one guest.
 *
 * {@code vmstate} (include RAM) is only meaningful for VMs.
 */
public final class SnapshotRequest extends OperationRequest {

    private final SnapshotAction action;
    private final String selector;
    private final ResourceKind expectedKind;
    private final String snapname;
    private final String description;
    private final boolean vmstate;

    public SnapshotRequest(SnapshotAction action, String selector, ResourceKind expectedKind,
                           String snapname, String description, boolean vmstate) {
        super(OperationKind.SNAPSHOT);
        this.action = action;
        this.selector = selector;
        this.expectedKind = expectedKind;
        this.snapname = snapname;
        this.description = description;
        this.vmstate = vmstate;
    }

    public static SnapshotRequest list(String selector, ResourceKind kind) {
        return new SnapshotRequest(SnapshotAction.LIST, selector, kind, null, null, false);
    }

    @Override
    public String getOperationName() {
        String verb = action.name().toLowerCase(Locale.ROOT);
        return action == SnapshotAction.LIST ? "list_snapshots" : verb + "_snapshot";
    }

    public SnapshotAction getAction() { return action; }
    public String getSelector() { return selector; }
    public ResourceKind getExpectedKind() { return expectedKind; }
    public String getSnapname() { return snapname; }
    public String getDescription() { return description; }
    public boolean isVmstate() { return vmstate; }
}
