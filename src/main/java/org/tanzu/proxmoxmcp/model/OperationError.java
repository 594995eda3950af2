package org.tanzu.proxmoxmcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Structured description of a failure.
 *
 * Upstream layers format errors from these fields rather than by parsing the
 * detail string. {@code backendPayload} holds the raw Proxmox response body
 * when one was received; {@code violations} and {@code candidates} are filled
 * for validation and ambiguity failures respectively.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class OperationError {

    private final ErrorKind kind;
    private final String detail;
    private final String backendPayload;
    private final List<Violation> violations;
    private final List<ResourceRef> candidates;

    public OperationError(ErrorKind kind, String detail, String backendPayload,
                          List<Violation> violations, List<ResourceRef> candidates) {
        this.kind = kind;
        this.detail = detail;
        this.backendPayload = backendPayload;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static OperationError of(ErrorKind kind, String detail) {
        return new OperationError(kind, detail, null, null, null);
    }

    public static OperationError backend(ErrorKind kind, String detail, String backendPayload) {
        return new OperationError(kind, detail, backendPayload, null, null);
    }

    public static OperationError validation(List<Violation> violations) {
        boolean onlyUnsupported = !violations.isEmpty()
                && violations.stream().allMatch(v -> v.getKind() == ErrorKind.UNSUPPORTED_OPTION);
        ErrorKind kind = onlyUnsupported ? ErrorKind.UNSUPPORTED_OPTION : ErrorKind.VALIDATION;
        return new OperationError(kind, violations.size() + " invalid parameter(s)", null, violations, null);
    }

    public static OperationError ambiguous(String selector, List<ResourceRef> candidates) {
        return new OperationError(ErrorKind.AMBIGUOUS,
                "Selector '" + selector + "' matches " + candidates.size() + " resources; use node:vmid to disambiguate",
                null, null, candidates);
    }

    public ErrorKind getKind() { return kind; }
    public String getDetail() { return detail; }
    public String getBackendPayload() { return backendPayload; }
    public List<Violation> getViolations() { return violations; }
    public List<ResourceRef> getCandidates() { return candidates; }

    @Override
    public String toString() {
        return "OperationError{kind=" + kind + ", detail='" + detail + "'"
                + (violations.isEmpty() ? "" : ", violations=" + violations)
                + (candidates.isEmpty() ? "" : ", candidates=" + candidates) + "}";
    }
}
