package org.tanzu.proxmoxmcp.orchestration;

/**
 * Stages of one dispatch. A dispatch only moves forward; it may jump to
 * {@link #TERMINAL} from any stage.
 */
public enum DispatchState {
    VALIDATED,
    RESOLVING,
    SUBMITTED,
    TRACKING,
    TERMINAL;

    public boolean canAdvanceTo(DispatchState next) {
        return next == TERMINAL ? this != TERMINAL : next.ordinal() > ordinal();
    }
}
