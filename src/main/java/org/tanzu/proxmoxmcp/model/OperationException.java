package org.tanzu.proxmoxmcp.model;

/**
 * Thrown by orchestration components to abort an operation with a classified error.
 */
public class OperationException extends RuntimeException {

    private final OperationError error;

    public OperationException(OperationError error) {
        super(error.getDetail());
        this.error = error;
    }

    public OperationException(OperationError error, Throwable cause) {
        super(error.getDetail(), cause);
        this.error = error;
    }

    public OperationException(ErrorKind kind, String detail) {
        this(OperationError.of(kind, detail));
    }

    public OperationError getError() { return error; }

    public ErrorKind getKind() { return error.getKind(); }
}
