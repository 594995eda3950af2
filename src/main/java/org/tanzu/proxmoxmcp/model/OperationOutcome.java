package org.tanzu.proxmoxmcp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal result of one operation, returned to MCP and REST callers as JSON.
 *
 * A successful create, snapshot or backup carries a payload describing what was
 * created so callers need not query again. A timed-out outcome means the
 * Proxmox task was left running and may still complete.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OperationOutcome {

    private final OutcomeStatus status;
    private final String operation;
    private final Map<String, Object> payload;
    private final OperationError error;

    private OperationOutcome(OutcomeStatus status, String operation, Map<String, Object> payload, OperationError error) {
        this.status = status;
        this.operation = operation;
        this.payload = payload == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.error = error;
    }

    public static OperationOutcome success(String operation, Map<String, Object> payload) {
        return new OperationOutcome(OutcomeStatus.SUCCESS, operation, payload, null);
    }

    public static OperationOutcome failed(String operation, OperationError error) {
        return new OperationOutcome(OutcomeStatus.FAILED, operation, null, error);
    }

    public static OperationOutcome timedOut(String operation, String detail, Map<String, Object> payload) {
        return new OperationOutcome(OutcomeStatus.TIMED_OUT, operation, payload, OperationError.of(ErrorKind.TIMED_OUT, detail));
    }

    /**
     * Returns a copy carrying additional payload entries; keys already present are replaced.
     */
    public OperationOutcome withPayload(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (payload != null) {
            merged.putAll(payload);
        }
        merged.putAll(extra);
        return new OperationOutcome(status, operation, merged, error);
    }

    public OutcomeStatus getStatus() { return status; }
    public String getOperation() { return operation; }
    public Map<String, Object> getPayload() { return payload; }
    public OperationError getError() { return error; }

    @JsonIgnore
    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    @Override
    public String toString() {
        return "OperationOutcome{status=" + status + ", operation='" + operation + "'"
                + (payload != null ? ", payload=" + payload : "")
                + (error != null ? ", error=" + error : "") + "}";
    }
}
