package org.tanzu.proxmoxmcp.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.tanzu.proxmoxmcp.model.OperationException;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.request.OperationRequest;
import org.tanzu.proxmoxmcp.proxmox.BackendException;

/**
 * Entry point for state-changing operations: validates, then dispatches.
 *
 * Never throws for expected failures. A rejected request or an unreachable
 * backend comes back as a FAILED {@link OperationOutcome}.
 */
@Service
public class OperationService {

    private static final Logger logger = LoggerFactory.getLogger(OperationService.class);

    private final RequestValidator validator;
    private final OperationDispatcher dispatcher;
    private final ResultNormalizer normalizer;

    public OperationService(RequestValidator validator, OperationDispatcher dispatcher, ResultNormalizer normalizer) {
        this.validator = validator;
        this.dispatcher = dispatcher;
        this.normalizer = normalizer;
        logger.info("OperationService initialized");
    }

    /**
     * Validates and runs one operation.
     *
     * @param request the request as built from tool or REST arguments
     * @return the terminal outcome; FAILED with VALIDATION or UNSUPPORTED_OPTION when
     *         the request is rejected, in which case nothing is submitted to Proxmox
     */
    public OperationOutcome execute(OperationRequest request) {
        ValidatedRequest validated;
        try {
            validated = validator.validate(request);
        } catch (OperationException e) {
            return normalizer.failure(request.getOperationName(), e);
        } catch (BackendException e) {
            // the vmid precondition reads cluster inventory
            return normalizer.failure(request.getOperationName(), e);
        }
        return dispatcher.dispatch(validated);
    }
}
