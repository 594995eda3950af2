package org.tanzu.proxmoxmcp.proxmox;

/**
 * A failed call to the Proxmox API.
 *
 * {@code statusCode} is the HTTP status, or 0 when no response was received
 * (connection refused, reset, timeout). Only the latter is transient: the
 * request may not have reached Proxmox at all.
 */
public class BackendException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public BackendException(int statusCode, String message, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = null;
    }

    public int getStatusCode() { return statusCode; }

    public String getResponseBody() { return responseBody; }

    public boolean isTransient() {
        return statusCode == 0;
    }
}
