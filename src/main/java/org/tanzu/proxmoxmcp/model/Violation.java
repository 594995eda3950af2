package org.tanzu.proxmoxmcp.model;

/**
 * One failed input constraint.
 */
public final class Violation {

    private final String field;
    private final ErrorKind kind;
    private final String message;

    public Violation(String field, ErrorKind kind, String message) {
        this.field = field;
        this.kind = kind;
        this.message = message;
    }

    public static Violation invalid(String field, String message) {
        return new Violation(field, ErrorKind.VALIDATION, message);
    }

    public static Violation unsupported(String field, String message) {
        return new Violation(field, ErrorKind.UNSUPPORTED_OPTION, message);
    }

    public String getField() { return field; }
    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
