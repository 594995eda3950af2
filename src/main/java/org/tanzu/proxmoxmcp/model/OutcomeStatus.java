package org.tanzu.proxmoxmcp.model;

public enum OutcomeStatus {
    SUCCESS,
    FAILED,
    TIMED_OUT
}
