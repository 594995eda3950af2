package org.tanzu.proxmoxmcp.model;

/**
 * Closed set of failure categories returned to callers.
 */
public enum ErrorKind {
    /** Bad input; the request never reached Proxmox. */
    VALIDATION,
    /** Resource, storage, snapshot or volume does not exist. */
    NOT_FOUND,
    /** A selector matched more than one resource. */
    AMBIGUOUS,
    /** The resolved resource is of a different kind than requested. */
    KIND_MISMATCH,
    /** Operation or option is not valid for the resource kind or storage. */
    UNSUPPORTED_OPTION,
    /** Proxmox reported a concurrent or conflicting operation. */
    CONFLICT,
    /** Anything Proxmox reported that is not classified above. */
    BACKEND_ERROR,
    /** The task did not finish before the deadline; it may still complete. */
    TIMED_OUT
}
