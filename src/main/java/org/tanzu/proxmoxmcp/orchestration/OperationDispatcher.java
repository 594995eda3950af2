package org.tanzu.proxmoxmcp.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.tanzu.proxmoxmcp.config.TaskSettings;
import org.tanzu.proxmoxmcp.model.DiskFormat;
import org.tanzu.proxmoxmcp.model.ErrorKind;
import org.tanzu.proxmoxmcp.model.OperationException;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.OutcomeStatus;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.ResourceRef;
import org.tanzu.proxmoxmcp.model.StorageProfile;
import org.tanzu.proxmoxmcp.model.TaskHandle;
import org.tanzu.proxmoxmcp.model.request.BackupRequest;
import org.tanzu.proxmoxmcp.model.request.CommandRequest;
import org.tanzu.proxmoxmcp.model.request.CreateRequest;
import org.tanzu.proxmoxmcp.model.request.DeleteRequest;
import org.tanzu.proxmoxmcp.model.request.IsoAction;
import org.tanzu.proxmoxmcp.model.request.IsoRequest;
import org.tanzu.proxmoxmcp.model.request.OperationRequest;
import org.tanzu.proxmoxmcp.model.request.PowerAction;
import org.tanzu.proxmoxmcp.model.request.PowerRequest;
import org.tanzu.proxmoxmcp.model.request.SnapshotRequest;
import org.tanzu.proxmoxmcp.proxmox.ApiPath;
import org.tanzu.proxmoxmcp.proxmox.BackendException;
import org.tanzu.proxmoxmcp.proxmox.ProxmoxBackend;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a validated request into Proxmox calls and drives it to a terminal outcome.
 *
 * Each dispatch moves through {@link DispatchState}: the target guest and, for
 * operations that place disks, the storage profile are resolved first; then the
 * API call is built and submitted; a UPID answer is tracked until the task stops.
 * Calls that answer synchronously (lists, deletes of storage content) finish
 * right after submission.
 *
 * A submission that got no response at all is sent again once with the same
 * parameters. Anything Proxmox actually answered is never resent.
 */
@Component
public class OperationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(OperationDispatcher.class);

    static final String DEFAULT_OSTYPE = "l26";
    static final String DEFAULT_COMPRESS = "zstd";
    static final String DEFAULT_BACKUP_MODE = "snapshot";
    static final String DEFAULT_CHECKSUM_ALGORITHM = "sha256";

    private final ProxmoxBackend backend;
    private final ResourceResolver resolver;
    private final StorageProfileDetector detector;
    private final TaskTracker tracker;
    private final ResultNormalizer normalizer;
    private final TaskSettings settings;
    private final Clock clock;

    @Autowired
    public OperationDispatcher(ProxmoxBackend backend, ResourceResolver resolver, StorageProfileDetector detector,
                               TaskTracker tracker, ResultNormalizer normalizer, TaskSettings settings) {
        this(backend, resolver, detector, tracker, normalizer, settings, Clock.systemUTC());
    }

    OperationDispatcher(ProxmoxBackend backend, ResourceResolver resolver, StorageProfileDetector detector,
                        TaskTracker tracker, ResultNormalizer normalizer, TaskSettings settings, Clock clock) {
        this.backend = backend;
        this.resolver = resolver;
        this.detector = detector;
        this.tracker = tracker;
        this.normalizer = normalizer;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Executes a request. Expected failures come back as FAILED outcomes, never as exceptions.
     *
     * @param validated a request that passed {@link RequestValidator}
     * @return the terminal outcome
     */
    public OperationOutcome dispatch(ValidatedRequest validated) {
        OperationRequest request = validated.getRequest();
        Dispatch dispatch = new Dispatch(request.getOperationName());
        try {
            OperationOutcome outcome;
            switch (request.getKind()) {
                case CREATE:
                    outcome = create((CreateRequest) request, dispatch);
                    break;
                case DELETE:
                    outcome = delete((DeleteRequest) request, dispatch);
                    break;
                case POWER:
                    outcome = power((PowerRequest) request, dispatch);
                    break;
                case SNAPSHOT:
                    outcome = snapshot((SnapshotRequest) request, dispatch);
                    break;
                case BACKUP:
                    outcome = backup((BackupRequest) request, dispatch);
                    break;
                case ISO:
                    outcome = iso((IsoRequest) request, dispatch);
                    break;
                case COMMAND:
                    outcome = command((CommandRequest) request, dispatch);
                    break;
                default:
                    throw new IllegalStateException("Unhandled operation kind " + request.getKind());
            }
            dispatch.advance(DispatchState.TERMINAL);
            logger.info("{} finished with {}", dispatch.operation, outcome.getStatus());
            return outcome;
        } catch (OperationException e) {
            dispatch.advance(DispatchState.TERMINAL);
            return normalizer.failure(dispatch.operation, e);
        } catch (BackendException e) {
            dispatch.advance(DispatchState.TERMINAL);
            return normalizer.failure(dispatch.operation, e);
        }
    }

    // ---- create ----

    private OperationOutcome create(CreateRequest request, Dispatch dispatch) {
        boolean vm = request.getResourceKind() == ResourceKind.VM;
        String node = request.getNode();

        dispatch.advance(DispatchState.RESOLVING);
        StorageProfile profile = request.getStorage() != null
                ? detector.detect(node, request.getStorage())
                : detector.autoSelect(node, vm ? "images" : "rootdir");
        String storage = profile.getPoolName();

        Map<String, Object> params = new LinkedHashMap<>();
        Map<String, Object> payload = new LinkedHashMap<>();
        params.put("vmid", request.getVmid());
        params.put("cores", request.getCores());
        params.put("memory", request.getMemoryMb());
        payload.put("vmid", request.getVmid());
        payload.put("node", node);

        if (vm) {
            DiskFormat format = chooseDiskFormat(request, profile);
            String disk = storage + ":" + request.getDiskGb();
            if (format == DiskFormat.QCOW2) {
                disk += ",format=qcow2";
            }
            params.put("name", request.getName());
            params.put("ostype", request.getOstype() != null ? request.getOstype() : DEFAULT_OSTYPE);
            params.put("scsihw", "virtio-scsi-pci");
            params.put("scsi0", disk);
            params.put("net0", "virtio,bridge=vmbr0");
            params.put("boot", "order=scsi0");
            if (profile.isSupportsCloudInit()) {
                params.put("ide2", storage + ":cloudinit");
            }
            payload.put("name", request.getName());
            payload.put("storage", storage);
            payload.put("storageType", profile.getBackendType());
            payload.put("diskFormat", format.token());
            payload.put("diskSizeGb", request.getDiskGb());
            payload.put("cloudInit", profile.isSupportsCloudInit());
        } else {
            params.put("hostname", request.getName());
            params.put("ostemplate", request.getOstemplate());
            params.put("rootfs", storage + ":" + request.getDiskGb());
            params.put("net0", "name=eth0,bridge=vmbr0,ip=dhcp");
            params.put("password", request.getPassword());
            params.put("unprivileged", request.isUnprivileged());
            payload.put("hostname", request.getName());
            payload.put("storage", storage);
            payload.put("storageType", profile.getBackendType());
            payload.put("diskSizeGb", request.getDiskGb());
            payload.put("unprivileged", request.isUnprivileged());
        }

        JsonNode result = submit(dispatch, HttpMethod.POST, ApiPath.of("nodes", node, request.getResourceKind().getApiType()), params);
        return finish(dispatch, result, payload);
    }

    /**
     * The profile decides the format unless the caller forced one; a forced
     * format must be one the backend can store.
     */
    private DiskFormat chooseDiskFormat(CreateRequest request, StorageProfile profile) {
        if (request.getDiskFormat() == null) {
            return profile.getDiskFormat();
        }
        DiskFormat forced = DiskFormat.fromToken(request.getDiskFormat());
        if (!profile.accepts(forced)) {
            throw new OperationException(ErrorKind.UNSUPPORTED_OPTION,
                    "Storage '" + profile.getPoolName() + "' (" + profile.getBackendType() + ") is block-based and only stores raw disks, not "
                            + forced.token());
        }
        return forced;
    }

    // ---- delete ----

    private OperationOutcome delete(DeleteRequest request, Dispatch dispatch) {
        dispatch.advance(DispatchState.RESOLVING);
        ResourceRef ref = resolver.resolve(request.getSelector(), request.getExpectedKind());
        String base = ApiPath.of("nodes", ref.getNode(), ref.getKind().getApiType(), ref.getVmid());

        String status = backend.read(base + "/status/current", null).path("status").asText("");
        boolean stoppedFirst = false;
        if ("running".equals(status)) {
            if (!request.isForce()) {
                throw new OperationException(ErrorKind.CONFLICT,
                        ref.describe() + " is running; stop it first or delete with force");
            }
            logger.info("{} is running, stopping it before deletion", ref.describe());
            OperationOutcome stop = runStep(dispatch, HttpMethod.POST, base + "/status/stop", new LinkedHashMap<>());
            if (!stop.isSuccess()) {
                return stop;
            }
            stoppedFirst = true;
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("purge", true);
        params.put("destroy-unreferenced-disks", true);
        JsonNode result = submit(dispatch, HttpMethod.DELETE, base, params);

        Map<String, Object> payload = refPayload(ref);
        payload.put("stoppedFirst", stoppedFirst);
        return finish(dispatch, result, payload);
    }

    // ---- power ----

    private OperationOutcome power(PowerRequest request, Dispatch dispatch) {
        dispatch.advance(DispatchState.RESOLVING);
        ResourceRef ref = resolver.resolve(request.getSelector(), request.getExpectedKind());
        if (request.getAction() == PowerAction.RESET && ref.getKind() == ResourceKind.CONTAINER) {
            throw new OperationException(ErrorKind.UNSUPPORTED_OPTION, "Hard reset is only available for VMs");
        }

        Map<String, Object> params = new LinkedHashMap<>();
        if (request.getTimeoutSeconds() != null
                && (request.getAction() == PowerAction.SHUTDOWN || request.getAction() == PowerAction.REBOOT)) {
            params.put("timeout", request.getTimeoutSeconds());
        }
        String path = ApiPath.of("nodes", ref.getNode(), ref.getKind().getApiType(), ref.getVmid(),
                "status", request.getAction().getEndpoint());
        JsonNode result = submit(dispatch, HttpMethod.POST, path, params);

        Map<String, Object> payload = refPayload(ref);
        payload.put("action", request.getAction().name().toLowerCase(Locale.ROOT));
        return finish(dispatch, result, payload);
    }

    // ---- snapshots ----

    private OperationOutcome snapshot(SnapshotRequest request, Dispatch dispatch) {
        dispatch.advance(DispatchState.RESOLVING);
        ResourceRef ref = resolver.resolve(request.getSelector(), request.getExpectedKind());
        String base = ApiPath.of("nodes", ref.getNode(), ref.getKind().getApiType(), ref.getVmid(), "snapshot");
        Map<String, Object> payload = refPayload(ref);

        switch (request.getAction()) {
            case LIST: {
                ArrayNode snapshots = JsonNodeFactory.instance.arrayNode();
                for (JsonNode snap : backend.read(base, null)) {
                    if (!"current".equals(snap.path("name").asText())) {
                        snapshots.add(snap);
                    }
                }
                payload.put("snapshots", snapshots);
                payload.put("count", snapshots.size());
                return immediate(dispatch, payload);
            }
            case CREATE: {
                if (request.isVmstate() && ref.getKind() == ResourceKind.CONTAINER) {
                    throw new OperationException(ErrorKind.UNSUPPORTED_OPTION, "Memory-state snapshots are only available for VMs");
                }
                Map<String, Object> params = new LinkedHashMap<>();
                params.put("snapname", request.getSnapname());
                params.put("description", request.getDescription());
                if (ref.getKind() == ResourceKind.VM) {
                    params.put("vmstate", request.isVmstate());
                }
                payload.put("snapname", request.getSnapname());
                payload.put("vmstate", request.isVmstate());
                return finish(dispatch, submit(dispatch, HttpMethod.POST, base, params), payload);
            }
            case DELETE: {
                payload.put("snapname", request.getSnapname());
                String path = base + ApiPath.of(request.getSnapname());
                return finish(dispatch, submit(dispatch, HttpMethod.DELETE, path, null), payload);
            }
            case ROLLBACK:
                return rollback(request, ref, base, payload, dispatch);
            default:
                throw new IllegalStateException("Unhandled snapshot action " + request.getAction());
        }
    }

    /**
     * Rolls back to a snapshot. Snapshots taken on top of the target are removed
     * first, since ZFS can only roll back to the most recent snapshot.
     */
    private OperationOutcome rollback(SnapshotRequest request, ResourceRef ref, String base,
                                      Map<String, Object> payload, Dispatch dispatch) {
        String target = request.getSnapname();
        boolean exists = false;
        List<String> children = new ArrayList<>();
        for (JsonNode snap : backend.read(base, null)) {
            String name = snap.path("name").asText();
            if (target.equals(name)) {
                exists = true;
            } else if (!"current".equals(name) && target.equals(snap.path("parent").asText())) {
                children.add(name);
            }
        }
        if (!exists) {
            throw new OperationException(ErrorKind.NOT_FOUND, "Snapshot '" + target + "' not found on " + ref.describe());
        }

        List<String> removed = new ArrayList<>();
        for (String child : children) {
            OperationOutcome step = runStep(dispatch, HttpMethod.DELETE, base + ApiPath.of(child), null);
            if (step.isSuccess()) {
                removed.add(child);
            } else if (step.getStatus() == OutcomeStatus.TIMED_OUT) {
                // the child may still be going away; rolling back now would race it
                logger.warn("Removal of child snapshot '{}' of '{}' on {} did not finish, not rolling back",
                        child, target, ref.describe());
                payload.put("snapname", target);
                payload.put("removedSnapshots", removed);
                payload.put("pendingSnapshot", child);
                return step.withPayload(payload);
            } else {
                logger.warn("Could not remove child snapshot '{}' of '{}' on {}: {}", child, target, ref.describe(), step.getError());
            }
        }

        payload.put("snapname", target);
        payload.put("removedSnapshots", removed);
        JsonNode result = submit(dispatch, HttpMethod.POST, base + ApiPath.of(target, "rollback"), null);
        return finish(dispatch, result, payload);
    }

    // ---- guest agent ----

    /**
     * Starts a command through the QEMU guest agent and waits for it to exit.
     * The command line runs under {@code /bin/sh -c}; Proxmox takes the argv as
     * a repeated "command" parameter.
     */
    private OperationOutcome command(CommandRequest request, Dispatch dispatch) {
        dispatch.advance(DispatchState.RESOLVING);
        ResourceRef ref = resolver.resolve(request.getSelector(), ResourceKind.VM);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("command", List.of("/bin/sh", "-c", request.getCommand()));
        String path = ApiPath.of("nodes", ref.getNode(), "qemu", ref.getVmid(), "agent", "exec");
        JsonNode started = submit(dispatch, HttpMethod.POST, path, params);
        if (started == null || !started.path("pid").canConvertToLong()) {
            throw new OperationException(ErrorKind.BACKEND_ERROR,
                    "Guest agent of " + ref.describe() + " did not return a pid: " + started);
        }

        dispatch.advance(DispatchState.TRACKING);
        OperationOutcome outcome = tracker.trackCommand(dispatch.operation, ref.getNode(), ref.getVmid(),
                started.path("pid").asLong(), settings.getTimeout());
        return outcome.isSuccess() && ref.getName() != null
                ? outcome.withPayload(Map.of("name", ref.getName())) : outcome;
    }

    // ---- backups ----

    private OperationOutcome backup(BackupRequest request, Dispatch dispatch) {
        switch (request.getAction()) {
            case LIST: {
                dispatch.advance(DispatchState.RESOLVING);
                Map<String, Object> query = new LinkedHashMap<>();
                query.put("content", "backup");
                query.put("vmid", request.getVmid());
                List<String> skipped = new ArrayList<>();
                ArrayNode backups = scanContent("backup", request.getNode(), request.getStorage(), query, skipped);
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("backups", backups);
                payload.put("count", backups.size());
                putSkipped(payload, skipped);
                return immediate(dispatch, payload);
            }
            case CREATE: {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put("vmid", request.getVmid());
                params.put("storage", request.getStorage());
                params.put("compress", request.getCompress() != null ? request.getCompress() : DEFAULT_COMPRESS);
                params.put("mode", request.getMode() != null ? request.getMode() : DEFAULT_BACKUP_MODE);
                params.put("notes-template", request.getNotes());

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("vmid", request.getVmid());
                payload.put("node", request.getNode());
                payload.put("storage", request.getStorage());
                payload.put("compress", params.get("compress"));
                payload.put("mode", params.get("mode"));
                JsonNode result = submit(dispatch, HttpMethod.POST, ApiPath.of("nodes", request.getNode(), "vzdump"), params);
                return finish(dispatch, result, payload);
            }
            case RESTORE:
                return restore(request, dispatch);
            case DELETE: {
                dispatch.advance(DispatchState.RESOLVING);
                String node = request.getNode();
                String storage = request.getStorage();
                JsonNode entry = findContent(node, storage, "backup", request.getVolid());
                if (entry == null) {
                    throw new OperationException(ErrorKind.NOT_FOUND,
                            "Backup '" + request.getVolid() + "' not found in storage '" + storage + "' on node '" + node + "'");
                }
                if (entry.path("protected").asBoolean(false)) {
                    throw new OperationException(ErrorKind.UNSUPPORTED_OPTION,
                            "Backup '" + request.getVolid() + "' is protected; remove the protection before deleting it");
                }
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("volid", request.getVolid());
                payload.put("node", node);
                payload.put("storage", storage);
                String path = ApiPath.of("nodes", node, "storage", storage, "content", request.getVolid());
                return finish(dispatch, submit(dispatch, HttpMethod.DELETE, path, null), payload);
            }
            default:
                throw new IllegalStateException("Unhandled backup action " + request.getAction());
        }
    }

    /**
     * Restores an archive as a new guest. Container archives are recreated through
     * the lxc endpoint with {@code restore=1}, VM archives through the qemu endpoint.
     */
    private OperationOutcome restore(BackupRequest request, Dispatch dispatch) {
        ResourceKind kind = kindOfArchive(request.getArchive());
        String node = request.getNode();

        dispatch.advance(DispatchState.RESOLVING);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("vmid", request.getVmid());
        payload.put("node", node);
        payload.put("kind", kind);
        payload.put("archive", request.getArchive());
        if (request.getStorage() != null) {
            StorageProfile profile = detector.detect(node, request.getStorage());
            payload.put("storage", profile.getPoolName());
            payload.put("storageType", profile.getBackendType());
            payload.put("diskFormat", profile.getDiskFormat().token());
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("vmid", request.getVmid());
        if (kind == ResourceKind.CONTAINER) {
            params.put("ostemplate", request.getArchive());
            params.put("restore", true);
        } else {
            params.put("archive", request.getArchive());
        }
        params.put("storage", request.getStorage());
        if (request.isUnique()) {
            params.put("unique", true);
        }
        payload.put("unique", request.isUnique());

        JsonNode result = submit(dispatch, HttpMethod.POST, ApiPath.of("nodes", node, kind.getApiType()), params);
        return finish(dispatch, result, payload);
    }

    static ResourceKind kindOfArchive(String archive) {
        String lower = archive.toLowerCase(Locale.ROOT);
        return lower.contains("/ct/") || lower.contains("vzdump-lxc") ? ResourceKind.CONTAINER : ResourceKind.VM;
    }

    // ---- ISO images and templates ----

    private OperationOutcome iso(IsoRequest request, Dispatch dispatch) {
        IsoAction action = request.getAction();
        switch (action) {
            case LIST_ISOS:
            case LIST_TEMPLATES: {
                dispatch.advance(DispatchState.RESOLVING);
                String contentType = action == IsoAction.LIST_ISOS ? "iso" : "vztmpl";
                Map<String, Object> query = new LinkedHashMap<>();
                query.put("content", contentType);
                List<String> skipped = new ArrayList<>();
                ArrayNode items = scanContent(contentType, request.getNode(), request.getStorage(), query, skipped);
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put(action == IsoAction.LIST_ISOS ? "isos" : "templates", items);
                payload.put("count", items.size());
                putSkipped(payload, skipped);
                return immediate(dispatch, payload);
            }
            case DOWNLOAD: {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put("url", request.getUrl());
                params.put("filename", request.getFilename());
                params.put("content", "iso");
                if (request.getChecksum() != null && !request.getChecksum().isBlank()) {
                    params.put("checksum", request.getChecksum());
                    params.put("checksum-algorithm", request.getChecksumAlgorithm() != null
                            ? request.getChecksumAlgorithm() : DEFAULT_CHECKSUM_ALGORITHM);
                }
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("filename", request.getFilename());
                payload.put("node", request.getNode());
                payload.put("storage", request.getStorage());
                payload.put("volid", request.getStorage() + ":iso/" + request.getFilename());
                String path = ApiPath.of("nodes", request.getNode(), "storage", request.getStorage(), "download-url");
                return finish(dispatch, submit(dispatch, HttpMethod.POST, path, params), payload);
            }
            case DELETE: {
                dispatch.advance(DispatchState.RESOLVING);
                String volid = resolveVolid(request.getNode(), request.getStorage(), request.getFilename());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("volid", volid);
                payload.put("node", request.getNode());
                payload.put("storage", request.getStorage());
                String path = ApiPath.of("nodes", request.getNode(), "storage", request.getStorage(), "content", volid);
                return finish(dispatch, submit(dispatch, HttpMethod.DELETE, path, null), payload);
            }
            default:
                throw new IllegalStateException("Unhandled ISO action " + action);
        }
    }

    /**
     * Accepts a full volume id ("local:iso/debian.iso") or a bare file name,
     * which is looked up in the storage content.
     */
    private String resolveVolid(String node, String storage, String filename) {
        if (filename.contains(":")) {
            return filename;
        }
        for (JsonNode item : backend.read(ApiPath.of("nodes", node, "storage", storage, "content"), null)) {
            String volid = item.path("volid").asText("");
            if (volid.endsWith("/" + filename) || volid.endsWith(":" + filename)) {
                return volid;
            }
        }
        throw new OperationException(ErrorKind.NOT_FOUND,
                "'" + filename + "' not found in storage '" + storage + "' on node '" + node + "'");
    }

    private JsonNode findContent(String node, String storage, String contentType, String volid) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("content", contentType);
        for (JsonNode item : backend.read(ApiPath.of("nodes", node, "storage", storage, "content"), query)) {
            if (volid.equals(item.path("volid").asText())) {
                return item;
            }
        }
        return null;
    }

    /**
     * Collects storage content of one type across online nodes, newest first.
     * A storage that Proxmox refuses to list is skipped with a warning and added
     * to {@code skipped} as "node/storage". A listing that arrived but could not
     * be read fails the whole scan, since its items would go missing unnoticed.
     */
    private ArrayNode scanContent(String contentType, String onlyNode, String onlyStorage, Map<String, Object> query,
                                  List<String> skipped) {
        List<JsonNode> items = new ArrayList<>();
        boolean nodeSeen = false;
        for (JsonNode node : backend.listNodes()) {
            String nodeName = node.path("node").asText(null);
            if (nodeName == null || (onlyNode != null && !onlyNode.equals(nodeName))) {
                continue;
            }
            nodeSeen = true;
            if ("offline".equals(node.path("status").asText())) {
                logger.warn("Skipping offline node {}", nodeName);
                continue;
            }
            for (JsonNode storage : backend.listStorage(nodeName)) {
                String storageName = storage.path("storage").asText(null);
                if (storageName == null || (onlyStorage != null && !onlyStorage.equals(storageName))
                        || !StorageProfileDetector.hasContent(storage.path("content").asText(""), contentType)) {
                    continue;
                }
                try {
                    for (JsonNode item : backend.read(ApiPath.of("nodes", nodeName, "storage", storageName, "content"), query)) {
                        ObjectNode copy = item.deepCopy();
                        copy.put("node", nodeName);
                        copy.put("storage", storageName);
                        items.add(copy);
                    }
                } catch (BackendException e) {
                    if (e.getStatusCode() >= 200 && e.getStatusCode() < 300) {
                        throw e;
                    }
                    logger.warn("Skipping storage {} on {} while listing {}: {}", storageName, nodeName, contentType, e.getMessage());
                    skipped.add(nodeName + "/" + storageName);
                }
            }
        }
        if (onlyNode != null && !nodeSeen) {
            throw new OperationException(ErrorKind.NOT_FOUND, "Node '" + onlyNode + "' not found");
        }
        items.sort(Comparator.comparingLong((JsonNode item) -> item.path("ctime").asLong(0)).reversed());
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        result.addAll(items);
        return result;
    }

    // ---- submission and tracking ----

    private JsonNode submit(Dispatch dispatch, HttpMethod method, String path, Map<String, Object> params) {
        dispatch.advance(DispatchState.SUBMITTED);
        return submitWithRetry(dispatch.operation, method, path, params);
    }

    private JsonNode submitWithRetry(String operation, HttpMethod method, String path, Map<String, Object> params) {
        int retries = 0;
        while (true) {
            try {
                return backend.submitTask(method, path, params);
            } catch (BackendException e) {
                if (!e.isTransient() || retries >= settings.getSubmitRetries()) {
                    throw e;
                }
                retries++;
                logger.warn("{}: no response to {} {}, resubmitting ({}/{})", operation, method, path, retries, settings.getSubmitRetries());
            }
        }
    }

    /**
     * Runs a preparatory call (stop before delete, child snapshot removal) to completion.
     */
    private OperationOutcome runStep(Dispatch dispatch, HttpMethod method, String path, Map<String, Object> params) {
        try {
            JsonNode result = submitWithRetry(dispatch.operation, method, path, params);
            if (TaskHandle.isUpid(result.asText(null))) {
                return tracker.track(dispatch.operation, TaskHandle.fromUpid(result.asText(), clock.instant()), settings.getTimeout());
            }
            return normalizer.success(dispatch.operation, new LinkedHashMap<>());
        } catch (BackendException e) {
            return normalizer.failure(dispatch.operation, e);
        }
    }

    private OperationOutcome finish(Dispatch dispatch, JsonNode result, Map<String, Object> payload) {
        String answer = result == null ? null : result.asText(null);
        if (TaskHandle.isUpid(answer)) {
            TaskHandle handle = TaskHandle.fromUpid(answer, clock.instant());
            dispatch.advance(DispatchState.TRACKING);
            OperationOutcome outcome = tracker.track(dispatch.operation, handle, settings.getTimeout());
            return outcome.isSuccess() || outcome.getPayload() != null ? outcome.withPayload(payload) : outcome;
        }
        if (result != null && !result.isNull() && !result.isMissingNode()) {
            payload.put("result", result);
        }
        return normalizer.success(dispatch.operation, payload);
    }

    private OperationOutcome immediate(Dispatch dispatch, Map<String, Object> payload) {
        dispatch.advance(DispatchState.SUBMITTED);
        return normalizer.success(dispatch.operation, payload);
    }

    private static void putSkipped(Map<String, Object> payload, List<String> skipped) {
        if (!skipped.isEmpty()) {
            payload.put("skippedStorages", skipped);
        }
    }

    private static Map<String, Object> refPayload(ResourceRef ref) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("vmid", ref.getVmid());
        payload.put("node", ref.getNode());
        payload.put("kind", ref.getKind());
        if (ref.getName() != null) {
            payload.put("name", ref.getName());
        }
        return payload;
    }

    /** State of one dispatch. */
    private static final class Dispatch {
        private final String operation;
        private DispatchState state = DispatchState.VALIDATED;

        private Dispatch(String operation) {
            this.operation = operation;
        }

        void advance(DispatchState next) {
            if (!state.canAdvanceTo(next)) {
                throw new IllegalStateException(operation + ": cannot move from " + state + " to " + next);
            }
            logger.info("{}: {} -> {}", operation, state, next);
            state = next;
        }
    }
}
