package org.tanzu.proxmoxmcp.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.proxmoxmcp.model.ErrorKind;
import org.tanzu.proxmoxmcp.model.OperationError;
import org.tanzu.proxmoxmcp.model.OperationException;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.proxmox.BackendException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps Proxmox results and failures onto {@link OperationOutcome}.
 *
 * The qemu and lxc code paths word their errors differently ("VM 100 is
 * locked", "CT 100 is locked (backup)", "can't lock file ... got timeout");
 * classification goes by HTTP status first and message fragments second so
 * both paths land on the same {@link ErrorKind}.
 */
@Component
public class ResultNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ResultNormalizer.class);

    private static final List<String> CONFLICT_MARKERS = List.of(
            "already exists", "is locked", "can't lock file", "got timeout", "already running",
            "not running", "is running", "is a template");

    private static final List<String> NOT_FOUND_MARKERS = List.of(
            "does not exist", "not found", "no such");

    private static final List<String> UNSUPPORTED_MARKERS = List.of(
            "feature is not available", "not supported", "not implemented");

    /**
     * Classifies a failure by HTTP status and message.
     *
     * @param statusCode HTTP status, 0 when no response was received
     * @param message Proxmox error message
     * @return the error kind; BACKEND_ERROR when nothing more specific matches
     */
    public ErrorKind classify(int statusCode, String message) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (statusCode == 409 || containsAny(text, CONFLICT_MARKERS)) {
            return ErrorKind.CONFLICT;
        }
        if (statusCode == 404 || containsAny(text, NOT_FOUND_MARKERS)) {
            return ErrorKind.NOT_FOUND;
        }
        if (containsAny(text, UNSUPPORTED_MARKERS)) {
            return ErrorKind.UNSUPPORTED_OPTION;
        }
        return ErrorKind.BACKEND_ERROR;
    }

    /**
     * Converts a failed API call into an error. Messages from Proxmox are prefixed
     * with "Proxmox: "; a call that got no response keeps its own message.
     *
     * @param e the failed call
     * @return the classified error, carrying the response body as backend detail
     */
    public OperationError fromBackend(BackendException e) {
        ErrorKind kind = classify(e.getStatusCode(), e.getMessage());
        String detail = e.isTransient() ? e.getMessage() : "Proxmox: " + e.getMessage();
        return OperationError.backend(kind, detail, e.getResponseBody());
    }

    /**
     * Classifies the exit status of a stopped task that did not end with OK.
     *
     * @param exitStatus the task's exitstatus, e.g. "can't lock file ... got timeout"
     * @param upid the task, kept as backend detail
     * @return the classified error
     */
    public OperationError fromTaskExitStatus(String exitStatus, String upid) {
        ErrorKind kind = classify(0, exitStatus);
        return OperationError.backend(kind, "Task failed: " + exitStatus, upid);
    }

    /**
     * @param operation operation name for the outcome
     * @param payload result data, may be empty
     * @return a SUCCESS outcome
     */
    public OperationOutcome success(String operation, Map<String, Object> payload) {
        return OperationOutcome.success(operation, payload);
    }

    /**
     * Builds a FAILED outcome for a call Proxmox rejected or never answered.
     *
     * @param operation operation name for the outcome
     * @param e the failed call
     * @return a FAILED outcome with the classified error
     */
    public OperationOutcome failure(String operation, BackendException e) {
        OperationError error = fromBackend(e);
        logger.warn("{} failed: {} ({})", operation, error.getDetail(), error.getKind());
        return OperationOutcome.failed(operation, error);
    }

    /**
     * Builds a FAILED outcome for a request refused before or during dispatch.
     *
     * @param operation operation name for the outcome
     * @param e the refusal, already carrying its error
     * @return a FAILED outcome with that error
     */
    public OperationOutcome failure(String operation, OperationException e) {
        logger.info("{} rejected: {}", operation, e.getError());
        return OperationOutcome.failed(operation, e.getError());
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
