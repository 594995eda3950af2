package org.tanzu.proxmoxmcp.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.proxmoxmcp.model.DiskFormat;
import org.tanzu.proxmoxmcp.model.OperationError;
import org.tanzu.proxmoxmcp.model.OperationException;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.Violation;
import org.tanzu.proxmoxmcp.model.request.BackupAction;
import org.tanzu.proxmoxmcp.model.request.BackupRequest;
import org.tanzu.proxmoxmcp.model.request.CommandRequest;
import org.tanzu.proxmoxmcp.model.request.CreateRequest;
import org.tanzu.proxmoxmcp.model.request.DeleteRequest;
import org.tanzu.proxmoxmcp.model.request.IsoAction;
import org.tanzu.proxmoxmcp.model.request.IsoRequest;
import org.tanzu.proxmoxmcp.model.request.OperationRequest;
import org.tanzu.proxmoxmcp.model.request.PowerAction;
import org.tanzu.proxmoxmcp.model.request.PowerRequest;
import org.tanzu.proxmoxmcp.model.request.SnapshotAction;
import org.tanzu.proxmoxmcp.model.request.SnapshotRequest;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks operation requests before anything is sent to Proxmox.
 * 
 * Every constraint is evaluated independently and all violations are reported
 * together, so a caller can fix its input in one round trip. Besides field
 * constraints, Create and Restore require the vmid to be unused cluster-wide,
 * which is checked through the resolver.
 */
@Component
public class RequestValidator {

    private static final Logger logger = LoggerFactory.getLogger(RequestValidator.class);

    static final Range CORES = new Range(1, 32);
    static final Range MEMORY_MB = new Range(512, 131072);
    static final Range DISK_GB = new Range(5, 1000);
    static final Range VMID = new Range(1, 999_999_999);
    static final Range SHUTDOWN_TIMEOUT = new Range(1, 600);

    /** Targets are built from the node/vmid tool arguments, so a missing one is reported on "vmid". */
    static final String TARGET_FIELD = "vmid";

    static final Pattern SNAPNAME = Pattern.compile("[A-Za-z][A-Za-z0-9_-]{0,39}");

    static final Set<String> COMPRESSION = Set.of("0", "gzip", "lz4", "zstd");
    static final Set<String> BACKUP_MODES = Set.of("snapshot", "suspend", "stop");
    static final Set<String> CHECKSUM_ALGORITHMS = Set.of("md5", "sha1", "sha224", "sha256", "sha384", "sha512");

    private final ResourceResolver resolver;

    public RequestValidator(ResourceResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Validates a request.
     * 
     * @param request the request as built from caller input
     * @return the request wrapped as validated
     * @throws OperationException carrying every violation when at least one constraint fails
     */
    public ValidatedRequest validate(OperationRequest request) {
        Checks checks = new Checks();
        switch (request.getKind()) {
            case CREATE:
                checkCreate((CreateRequest) request, checks);
                break;
            case DELETE:
                checks.required(TARGET_FIELD, ((DeleteRequest) request).getSelector());
                break;
            case POWER:
                checkPower((PowerRequest) request, checks);
                break;
            case SNAPSHOT:
                checkSnapshot((SnapshotRequest) request, checks);
                break;
            case BACKUP:
                checkBackup((BackupRequest) request, checks);
                break;
            case ISO:
                checkIso((IsoRequest) request, checks);
                break;
            case COMMAND: {
                CommandRequest command = (CommandRequest) request;
                checks.required(TARGET_FIELD, command.getSelector());
                checks.required("command", command.getCommand());
                break;
            }
            default:
                throw new IllegalStateException("Unhandled operation kind " + request.getKind());
        }

        if (!checks.violations.isEmpty()) {
            logger.info("{} rejected with {} violation(s): {}", request.getOperationName(), checks.violations.size(), checks.violations);
            throw new OperationException(OperationError.validation(checks.violations));
        }
        return new ValidatedRequest(request);
    }

    private void checkCreate(CreateRequest request, Checks checks) {
        boolean vm = request.getResourceKind() == ResourceKind.VM;
        checks.required("node", request.getNode());
        checks.required(vm ? "name" : "hostname", request.getName());
        checks.range(vm ? "cpus" : "cores", request.getCores(), CORES);
        checks.range("memory", request.getMemoryMb(), MEMORY_MB);
        checks.range("disk_size", request.getDiskGb(), DISK_GB);

        if (request.getDiskFormat() != null) {
            if (!vm) {
                checks.unsupported("disk_format", "Containers do not take a disk format");
            } else if (DiskFormat.fromToken(request.getDiskFormat()) == null) {
                checks.invalid("disk_format", "must be one of raw, qcow2");
            }
        }
        if (!vm) {
            checks.required("ostemplate", request.getOstemplate());
        }
        checkFreeVmid(request.getVmid(), checks);
    }

    private void checkPower(PowerRequest request, Checks checks) {
        checks.required(TARGET_FIELD, request.getSelector());
        if (request.getExpectedKind() == ResourceKind.CONTAINER) {
            if (request.getAction() == PowerAction.RESET) {
                checks.unsupported("action", "Hard reset is only available for VMs");
            }
            if (request.getTimeoutSeconds() != null) {
                checks.range("timeout_seconds", request.getTimeoutSeconds(), SHUTDOWN_TIMEOUT);
            }
        }
    }

    private void checkSnapshot(SnapshotRequest request, Checks checks) {
        checks.required(TARGET_FIELD, request.getSelector());
        if (request.getAction() != SnapshotAction.LIST) {
            if (checks.required("snapname", request.getSnapname()) && !SNAPNAME.matcher(request.getSnapname()).matches()) {
                checks.invalid("snapname", "must start with a letter and contain only letters, digits, '-' and '_' (max 40)");
            }
        }
        if (request.isVmstate() && request.getAction() == SnapshotAction.CREATE
                && request.getExpectedKind() == ResourceKind.CONTAINER) {
            checks.unsupported("vmstate", "Memory-state snapshots are only available for VMs");
        }
    }

    private void checkBackup(BackupRequest request, Checks checks) {
        BackupAction action = request.getAction();
        switch (action) {
            case LIST:
                if (request.getVmid() != null) {
                    checks.range("vmid", request.getVmid(), VMID);
                }
                break;
            case CREATE:
                checks.required("node", request.getNode());
                checks.range("vmid", request.getVmid(), VMID);
                checks.required("storage", request.getStorage());
                checks.oneOf("compress", request.getCompress(), COMPRESSION);
                checks.oneOf("mode", request.getMode(), BACKUP_MODES);
                break;
            case RESTORE:
                checks.required("node", request.getNode());
                checks.required("archive", request.getArchive());
                checkFreeVmid(request.getVmid(), checks);
                break;
            case DELETE:
                checks.required("node", request.getNode());
                checks.required("storage", request.getStorage());
                checks.required("volid", request.getVolid());
                break;
            default:
                throw new IllegalStateException("Unhandled backup action " + action);
        }
    }

    private void checkIso(IsoRequest request, Checks checks) {
        IsoAction action = request.getAction();
        if (action == IsoAction.DOWNLOAD) {
            checks.required("node", request.getNode());
            checks.required("storage", request.getStorage());
            if (checks.required("url", request.getUrl()) && !isHttpUrl(request.getUrl())) {
                checks.invalid("url", "must be an http or https URL");
            }
            if (checks.required("filename", request.getFilename()) && request.getFilename().contains("/")) {
                checks.invalid("filename", "must not contain '/'");
            }
            checks.oneOf("checksum_algorithm", request.getChecksumAlgorithm(), CHECKSUM_ALGORITHMS);
        } else if (action == IsoAction.DELETE) {
            checks.required("node", request.getNode());
            checks.required("storage", request.getStorage());
            checks.required("filename", request.getFilename());
        }
    }

    /**
     * The vmid must be in range and not used by any guest. The cluster is only
     * queried when the value itself is valid.
     */
    private void checkFreeVmid(Integer vmid, Checks checks) {
        if (checks.range("vmid", vmid, VMID) && resolver.isInUse(vmid)) {
            checks.invalid("vmid", "vmid " + vmid + " is already in use");
        }
    }

    private static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url.trim());
            return ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /** Inclusive integer bounds. */
    static final class Range {
        final int min;
        final int max;

        Range(int min, int max) {
            this.min = min;
            this.max = max;
        }
    }

    /**
     * Collects violations. Each check returns whether the value passed so that
     * dependent checks on the same field can be skipped.
     */
    private static final class Checks {
        private final List<Violation> violations = new ArrayList<>();

        boolean required(String field, String value) {
            if (value == null || value.isBlank()) {
                violations.add(Violation.invalid(field, "is required"));
                return false;
            }
            return true;
        }

        boolean range(String field, Integer value, Range range) {
            if (value == null) {
                violations.add(Violation.invalid(field, "is required"));
                return false;
            }
            if (value < range.min || value > range.max) {
                violations.add(Violation.invalid(field, "must be between " + range.min + " and " + range.max + ", got " + value));
                return false;
            }
            return true;
        }

        void oneOf(String field, String value, Set<String> allowed) {
            if (value != null && !allowed.contains(value)) {
                violations.add(Violation.invalid(field, "must be one of " + allowed.stream().sorted().toList() + ", got '" + value + "'"));
            }
        }

        void invalid(String field, String message) {
            violations.add(Violation.invalid(field, message));
        }

        void unsupported(String field, String message) {
            violations.add(Violation.unsupported(field, message));
        }
    }
}
