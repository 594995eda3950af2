package org.tanzu.proxmoxmcp.model.request;

/**
 * Power transitions, named after the Proxmox {@code status/<action>} endpoints.
 */
public enum PowerAction {
    START("start"),
    STOP("stop"),
    SHUTDOWN("shutdown"),
    REBOOT("reboot"),
    RESET("reset");

    private final String endpoint;

    PowerAction(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getEndpoint() { return endpoint; }
}
