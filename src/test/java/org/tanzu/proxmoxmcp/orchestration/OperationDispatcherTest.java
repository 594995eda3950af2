package org.tanzu.proxmoxmcp.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.tanzu.proxmoxmcp.config.TaskSettings;
import org.tanzu.proxmoxmcp.model.ErrorKind;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.OutcomeStatus;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.request.BackupRequest;
import org.tanzu.proxmoxmcp.model.request.CommandRequest;
import org.tanzu.proxmoxmcp.model.request.CreateRequest;
import org.tanzu.proxmoxmcp.model.request.DeleteRequest;
import org.tanzu.proxmoxmcp.model.request.IsoRequest;
import org.tanzu.proxmoxmcp.model.request.OperationRequest;
import org.tanzu.proxmoxmcp.model.request.PowerAction;
import org.tanzu.proxmoxmcp.model.request.PowerRequest;
import org.tanzu.proxmoxmcp.model.request.SnapshotAction;
import org.tanzu.proxmoxmcp.model.request.SnapshotRequest;
import org.tanzu.proxmoxmcp.proxmox.BackendException;
import org.tanzu.proxmoxmcp.proxmox.FakeProxmoxBackend;
import org.tanzu.proxmoxmcp.proxmox.FakeProxmoxBackend.Submission;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OperationDispatcherTest {

    private final FakeProxmoxBackend backend = new FakeProxmoxBackend()
            .node("pve")
            .storage("pve", "local", "dir", "iso,vztmpl,backup")
            .storage("pve", "local-lvm", "lvmthin", "images,rootdir")
            .storage("pve", "nfs-share", "nfs", "images,backup")
            .vm("pve", 100, "web", "running")
            .vm("pve", 102, "db", "stopped")
            .container("pve", 101, "proxy", "running");

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-20T10:00:00Z"));
    private final TaskSettings settings = new TaskSettings(300, 1500, 1);
    private final ResultNormalizer normalizer = new ResultNormalizer();
    private final ResourceResolver resolver = new ResourceResolver(backend);

    private final OperationDispatcher dispatcher = new OperationDispatcher(backend, resolver,
            new StorageProfileDetector(backend),
            new TaskTracker(backend, settings, normalizer, clock, clock::advance),
            normalizer, settings, clock);

    private OperationOutcome run(OperationRequest request) {
        return dispatcher.dispatch(new ValidatedRequest(request));
    }

    private CreateRequest.Builder vm() {
        return CreateRequest.vm().node("pve").vmid(200).name("app").cores(2).memoryMb(2048).diskGb(20);
    }

    // ---- create ----

    @Test
    void blockStorageGetsRawDiskWithoutCloudInit() {
        OperationOutcome outcome = run(vm().storage("local-lvm").build());

        assertEquals(OutcomeStatus.SUCCESS, outcome.getStatus());
        Submission create = backend.lastSubmission();
        assertEquals(HttpMethod.POST, create.getMethod());
        assertEquals("/nodes/pve/qemu", create.getPath());
        assertEquals("local-lvm:20", create.getParams().get("scsi0"));
        assertFalse(create.getParams().containsKey("ide2"));
        assertEquals("l26", create.getParams().get("ostype"));

        Map<String, Object> payload = outcome.getPayload();
        assertEquals(200, payload.get("vmid"));
        assertEquals("raw", payload.get("diskFormat"));
        assertEquals("lvmthin", payload.get("storageType"));
        assertEquals(false, payload.get("cloudInit"));
        assertNotNull(payload.get("upid"));
    }

    @Test
    void fileStorageGetsQcow2AndCloudInitDrive() {
        OperationOutcome outcome = run(vm().storage("nfs-share").build());

        assertTrue(outcome.isSuccess());
        Map<String, ?> params = backend.lastSubmission().getParams();
        assertEquals("nfs-share:20,format=qcow2", params.get("scsi0"));
        assertEquals("nfs-share:cloudinit", params.get("ide2"));
        assertEquals("qcow2", outcome.getPayload().get("diskFormat"));
        assertEquals(true, outcome.getPayload().get("cloudInit"));
    }

    @Test
    void forcedQcow2OnBlockStorageIsRejectedBeforeSubmission() {
        OperationOutcome outcome = run(vm().storage("local-lvm").diskFormat("qcow2").build());

        assertEquals(OutcomeStatus.FAILED, outcome.getStatus());
        assertEquals(ErrorKind.UNSUPPORTED_OPTION, outcome.getError().getKind());
        assertTrue(backend.getSubmissions().isEmpty());
    }

    @Test
    void forcedRawOnFileStorageIsAccepted() {
        OperationOutcome outcome = run(vm().storage("nfs-share").diskFormat("raw").build());

        assertTrue(outcome.isSuccess());
        assertEquals("nfs-share:20", backend.lastSubmission().getParams().get("scsi0"));
    }

    @Test
    void storageIsAutoSelectedByContentType() {
        run(vm().build());
        assertEquals("local-lvm:20", backend.lastSubmission().getParams().get("scsi0"));

        run(CreateRequest.container().node("pve").vmid(300).name("cache").cores(1).memoryMb(512).diskGb(8)
                .ostemplate("local:vztmpl/debian-12-standard_12.2-1_amd64.tar.zst").unprivileged(true).build());
        Submission ct = backend.lastSubmission();
        assertEquals("/nodes/pve/lxc", ct.getPath());
        assertEquals("local-lvm:8", ct.getParams().get("rootfs"));
        assertEquals("cache", ct.getParams().get("hostname"));
        assertEquals(true, ct.getParams().get("unprivileged"));
    }

    @Test
    void unknownStorageIsNotFound() {
        OperationOutcome outcome = run(vm().storage("ceph-pool").build());

        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().getKind());
        assertTrue(backend.getSubmissions().isEmpty());
    }

    @Test
    void unansweredSubmissionIsSentOnceMore() {
        backend.queueSubmitFailure(new BackendException("Connection reset", new IOException("reset")));

        OperationOutcome outcome = run(vm().storage("local-lvm").build());

        assertTrue(outcome.isSuccess());
        assertEquals(2, backend.getSubmissions().size());
        assertEquals(backend.getSubmissions().get(0).getParams(), backend.getSubmissions().get(1).getParams());
    }

    @Test
    void secondUnansweredSubmissionIsReported() {
        backend.queueSubmitFailure(new BackendException("Connection reset", new IOException("reset")))
                .queueSubmitFailure(new BackendException("Connection refused", new IOException("refused")));

        OperationOutcome outcome = run(vm().storage("local-lvm").build());

        assertEquals(OutcomeStatus.FAILED, outcome.getStatus());
        assertEquals(ErrorKind.BACKEND_ERROR, outcome.getError().getKind());
        assertEquals(2, backend.getSubmissions().size());
    }

    @Test
    void configuredRetriesAboveOneAreCapped() {
        TaskSettings generous = new TaskSettings(300, 1500, 5);
        OperationDispatcher capped = new OperationDispatcher(backend, resolver, new StorageProfileDetector(backend),
                new TaskTracker(backend, generous, normalizer, clock, clock::advance), normalizer, generous, clock);
        for (int i = 0; i < 3; i++) {
            backend.queueSubmitFailure(new BackendException("Connection reset", new IOException("reset")));
        }

        OperationOutcome outcome = capped.dispatch(new ValidatedRequest(vm().storage("local-lvm").build()));

        assertEquals(OutcomeStatus.FAILED, outcome.getStatus());
        assertEquals(2, backend.getSubmissions().size());
    }

    @Test
    void answeredErrorIsNeverResent() {
        backend.queueSubmitFailure(new BackendException(500, "VM 200 already exists on node 'pve'", null));

        OperationOutcome outcome = run(vm().storage("local-lvm").build());

        assertEquals(ErrorKind.CONFLICT, outcome.getError().getKind());
        assertEquals(1, backend.getSubmissions().size());
    }

    @Test
    void failedTaskIsReportedWithItsExitStatus() {
        backend.queuePoll("{status: 'stopped', exitstatus: \"storage 'local-lvm' does not exist\"}");

        OperationOutcome outcome = run(vm().storage("local-lvm").build());

        assertEquals(OutcomeStatus.FAILED, outcome.getStatus());
        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().getKind());
        assertEquals("create_vm", outcome.getOperation());
    }

    @Test
    void timedOutTaskKeepsCreatePayload() {
        for (int i = 0; i < 400; i++) {
            backend.queuePoll("{status: 'running'}");
        }

        OperationOutcome outcome = run(vm().storage("local-lvm").build());

        assertEquals(OutcomeStatus.TIMED_OUT, outcome.getStatus());
        assertNotNull(outcome.getPayload().get("upid"));
        assertEquals(200, outcome.getPayload().get("vmid"));
    }

    // ---- delete ----

    @Test
    void runningGuestIsNotDeletedWithoutForce() {
        OperationOutcome outcome = run(new DeleteRequest("pve:100", ResourceKind.VM, false));

        assertEquals(ErrorKind.CONFLICT, outcome.getError().getKind());
        assertTrue(backend.getSubmissions().isEmpty());
    }

    @Test
    void forcedDeleteStopsFirstThenPurges() {
        OperationOutcome outcome = run(new DeleteRequest("web", ResourceKind.VM, true));

        assertTrue(outcome.isSuccess());
        List<Submission> submissions = backend.getSubmissions();
        assertEquals(2, submissions.size());
        assertEquals("/nodes/pve/qemu/100/status/stop", submissions.get(0).getPath());
        assertEquals(HttpMethod.DELETE, submissions.get(1).getMethod());
        assertEquals("/nodes/pve/qemu/100", submissions.get(1).getPath());
        assertEquals(true, submissions.get(1).getParams().get("purge"));
        assertEquals(true, outcome.getPayload().get("stoppedFirst"));
    }

    @Test
    void failedStopAbortsDelete() {
        backend.queueSubmitFailure(new BackendException(500, "VM 100 is locked (backup)", null));

        OperationOutcome outcome = run(new DeleteRequest("pve:100", ResourceKind.VM, true));

        assertEquals(ErrorKind.CONFLICT, outcome.getError().getKind());
        assertEquals(1, backend.getSubmissions().size());
    }

    @Test
    void stoppedGuestIsDeletedDirectly() {
        OperationOutcome outcome = run(new DeleteRequest("102", null, false));

        assertTrue(outcome.isSuccess());
        assertEquals(1, backend.getSubmissions().size());
        assertEquals(false, outcome.getPayload().get("stoppedFirst"));
    }

    // ---- power ----

    @Test
    void powerActionsHitStatusEndpoints() {
        assertTrue(run(new PowerRequest("pve:102", ResourceKind.VM, PowerAction.START, null)).isSuccess());
        assertEquals("/nodes/pve/qemu/102/status/start", backend.lastSubmission().getPath());

        OperationOutcome shutdown = run(new PowerRequest("proxy", ResourceKind.CONTAINER, PowerAction.SHUTDOWN, 30));
        assertEquals("/nodes/pve/lxc/101/status/shutdown", backend.lastSubmission().getPath());
        assertEquals(30, backend.lastSubmission().getParams().get("timeout"));
        assertEquals("shutdown", shutdown.getPayload().get("action"));
    }

    @Test
    void kindMismatchIsReported() {
        OperationOutcome outcome = run(new PowerRequest("pve:101", ResourceKind.VM, PowerAction.START, null));

        assertEquals(ErrorKind.KIND_MISMATCH, outcome.getError().getKind());
        assertTrue(backend.getSubmissions().isEmpty());
    }

    @Test
    void containerResetIsUnsupported() {
        OperationOutcome outcome = run(new PowerRequest("101", null, PowerAction.RESET, null));

        assertEquals(ErrorKind.UNSUPPORTED_OPTION, outcome.getError().getKind());
    }

    // ---- snapshots ----

    @Test
    void snapshotListHidesCurrentState() {
        backend.stubRead("/nodes/pve/qemu/100/snapshot",
                "[{name: 'base', snaptime: 1700000000}, {name: 'current', parent: 'base', running: 1}]");

        OperationOutcome outcome = run(SnapshotRequest.list("pve:100", ResourceKind.VM));

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getPayload().get("count"));
        assertEquals("base", ((ArrayNode) outcome.getPayload().get("snapshots")).get(0).path("name").asText());
        assertTrue(backend.getSubmissions().isEmpty());
    }

    @Test
    void containerSnapshotOmitsVmstate() {
        run(new SnapshotRequest(SnapshotAction.CREATE, "pve:101", ResourceKind.CONTAINER, "pre", "before upgrade", false));

        Submission submission = backend.lastSubmission();
        assertEquals("/nodes/pve/lxc/101/snapshot", submission.getPath());
        assertFalse(submission.getParams().containsKey("vmstate"));
        assertEquals("before upgrade", submission.getParams().get("description"));
    }

    @Test
    void rollbackRemovesNewerSnapshotsFirst() {
        backend.stubRead("/nodes/pve/qemu/100/snapshot",
                "[{name: 'base'}, {name: 'upgrade', parent: 'base'}, {name: 'hotfix', parent: 'upgrade'},"
                        + " {name: 'current', parent: 'hotfix'}]");

        OperationOutcome outcome = run(new SnapshotRequest(SnapshotAction.ROLLBACK, "pve:100", ResourceKind.VM, "upgrade", null, false));

        assertTrue(outcome.isSuccess());
        List<Submission> submissions = backend.getSubmissions();
        assertEquals(2, submissions.size());
        assertEquals(HttpMethod.DELETE, submissions.get(0).getMethod());
        assertEquals("/nodes/pve/qemu/100/snapshot/hotfix", submissions.get(0).getPath());
        assertEquals("/nodes/pve/qemu/100/snapshot/upgrade/rollback", submissions.get(1).getPath());
        assertEquals(List.of("hotfix"), outcome.getPayload().get("removedSnapshots"));
    }

    @Test
    void rollbackStopsWhenChildRemovalTimesOut() {
        backend.stubRead("/nodes/pve/qemu/100/snapshot",
                "[{name: 'base'}, {name: 'upgrade', parent: 'base'}, {name: 'hotfix', parent: 'upgrade'},"
                        + " {name: 'current', parent: 'hotfix'}]");
        for (int i = 0; i < 250; i++) {
            backend.queuePoll("{status: 'running'}");
        }

        OperationOutcome outcome = run(new SnapshotRequest(SnapshotAction.ROLLBACK, "pve:100", ResourceKind.VM, "upgrade", null, false));

        assertEquals(OutcomeStatus.TIMED_OUT, outcome.getStatus());
        assertEquals(1, backend.getSubmissions().size());
        assertEquals("/nodes/pve/qemu/100/snapshot/hotfix", backend.lastSubmission().getPath());
        assertEquals("hotfix", outcome.getPayload().get("pendingSnapshot"));
        assertNotNull(outcome.getPayload().get("upid"));
    }

    @Test
    void cancelledChildRemovalDoesNotRollBack() {
        backend.stubRead("/nodes/pve/qemu/100/snapshot",
                "[{name: 'upgrade'}, {name: 'hotfix', parent: 'upgrade'}, {name: 'current', parent: 'hotfix'}]");

        OperationOutcome outcome;
        Thread.currentThread().interrupt();
        try {
            outcome = run(new SnapshotRequest(SnapshotAction.ROLLBACK, "pve:100", ResourceKind.VM, "upgrade", null, false));
        } finally {
            Thread.interrupted();
        }

        assertEquals(OutcomeStatus.TIMED_OUT, outcome.getStatus());
        assertTrue(outcome.getError().getDetail().contains("polling cancelled"));
        assertEquals(1, backend.getSubmissions().size());
    }

    @Test
    void rollbackToMissingSnapshotIsNotFound() {
        backend.stubRead("/nodes/pve/qemu/100/snapshot", "[{name: 'current'}]");

        OperationOutcome outcome = run(new SnapshotRequest(SnapshotAction.ROLLBACK, "pve:100", ResourceKind.VM, "gone", null, false));

        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().getKind());
        assertTrue(backend.getSubmissions().isEmpty());
    }

    // ---- guest agent ----

    @Test
    void guestCommandIsPolledUntilItExits() {
        backend.queueSubmitResult(FakeProxmoxBackend.json("{pid: 812}"))
                .queueRead("/nodes/pve/qemu/100/agent/exec-status", "{exited: 0}")
                .queueRead("/nodes/pve/qemu/100/agent/exec-status", "{exited: 0}")
                .stubRead("/nodes/pve/qemu/100/agent/exec-status",
                        "{exited: 1, exitcode: 2, 'err-data': 'ls: cannot access /nope'}");

        OperationOutcome outcome = run(new CommandRequest("pve:100", "ls /nope"));

        assertEquals(OutcomeStatus.SUCCESS, outcome.getStatus());
        assertEquals(HttpMethod.POST, backend.lastSubmission().getMethod());
        assertEquals("/nodes/pve/qemu/100/agent/exec", backend.lastSubmission().getPath());
        assertEquals(2, outcome.getPayload().get("exitcode"));
        assertEquals("ls: cannot access /nope", outcome.getPayload().get("stderr"));
        assertEquals(812L, outcome.getPayload().get("pid"));
        assertEquals(3, backend.getReadPaths().size());
        assertEquals(812L, backend.getReadQueries().get(2).get("pid"));
    }

    @Test
    void guestCommandThatNeverExitsTimesOut() {
        backend.queueSubmitResult(FakeProxmoxBackend.json("{pid: 90}"))
                .stubRead("/nodes/pve/qemu/100/agent/exec-status", "{exited: 0}");

        OperationOutcome outcome = run(new CommandRequest("100", "sleep 3600"));

        assertEquals(OutcomeStatus.TIMED_OUT, outcome.getStatus());
        assertEquals(90L, outcome.getPayload().get("pid"));
        assertFalse(outcome.getPayload().containsKey("exitcode"));
    }

    @Test
    void guestCommandOnContainerIsKindMismatch() {
        OperationOutcome outcome = run(new CommandRequest("pve:101", "id"));

        assertEquals(ErrorKind.KIND_MISMATCH, outcome.getError().getKind());
        assertTrue(backend.getSubmissions().isEmpty());
    }

    @Test
    void missingGuestAgentIsConflict() {
        backend.queueSubmitFailure(new BackendException(500, "QEMU guest agent is not running", null));

        OperationOutcome outcome = run(new CommandRequest("pve:100", "id"));

        assertEquals(ErrorKind.CONFLICT, outcome.getError().getKind());
        assertEquals(1, backend.getSubmissions().size());
    }

    @Test
    void agentAnswerWithoutPidIsBackendError() {
        backend.queueSubmitResult(FakeProxmoxBackend.json("{}"));

        OperationOutcome outcome = run(new CommandRequest("pve:100", "id"));

        assertEquals(ErrorKind.BACKEND_ERROR, outcome.getError().getKind());
    }

    // ---- backups ----

    @Test
    void backupCreateAppliesDefaults() {
        OperationOutcome outcome = run(BackupRequest.create("pve", 100, "nfs-share", null, null, "{{guestname}}"));

        assertTrue(outcome.isSuccess());
        Submission submission = backend.lastSubmission();
        assertEquals("/nodes/pve/vzdump", submission.getPath());
        assertEquals("zstd", submission.getParams().get("compress"));
        assertEquals("snapshot", submission.getParams().get("mode"));
        assertEquals("{{guestname}}", submission.getParams().get("notes-template"));
    }

    @Test
    void backupsAreListedNewestFirstAcrossStorages() {
        backend.stubRead("/nodes/pve/storage/local/content",
                "[{volid: 'local:backup/vzdump-qemu-100-2024_05_01-00_00_00.vma.zst', ctime: 1714521600, vmid: 100}]")
                .stubRead("/nodes/pve/storage/nfs-share/content",
                        "[{volid: 'nfs-share:backup/vzdump-lxc-101-2024_05_10-00_00_00.tar.zst', ctime: 1715299200, vmid: 101}]");

        OperationOutcome outcome = run(BackupRequest.list(null, null, null));

        ArrayNode backups = (ArrayNode) outcome.getPayload().get("backups");
        assertEquals(2, outcome.getPayload().get("count"));
        assertEquals("nfs-share", backups.get(0).path("storage").asText());
        assertEquals("pve", backups.get(0).path("node").asText());
        assertEquals(1714521600L, backups.get(1).path("ctime").asLong());
        // local-lvm holds no backups and is never read
        assertFalse(backend.getReadPaths().contains("/nodes/pve/storage/local-lvm/content"));
    }

    @Test
    void unreadableStorageIsSkippedWhileListing() {
        backend.stubRead("/nodes/pve/storage/local/content", "[{volid: 'local:backup/a.vma.zst', ctime: 1}]");

        OperationOutcome outcome = run(BackupRequest.list("pve", null, 100));

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getPayload().get("count"));
        assertEquals(List.of("pve/nfs-share"), outcome.getPayload().get("skippedStorages"));
        assertEquals(100, backend.getReadQueries().get(0).get("vmid"));
    }

    @Test
    void listingThatCouldNotBeReadFailsInsteadOfSkipping() {
        backend.queueReadFailure("/nodes/pve/storage/local/content", new BackendException(200,
                "Proxmox response could not be read: Exceeded limit on max bytes to buffer : 262144", null));

        OperationOutcome outcome = run(BackupRequest.list("pve", null, null));

        assertEquals(OutcomeStatus.FAILED, outcome.getStatus());
        assertEquals(ErrorKind.BACKEND_ERROR, outcome.getError().getKind());
        assertTrue(outcome.getError().getDetail().contains("could not be read"));
    }

    @Test
    void listingOnUnknownNodeIsNotFound() {
        OperationOutcome outcome = run(BackupRequest.list("pve9", null, null));

        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().getKind());
    }

    @Test
    void containerArchiveIsRestoredThroughLxc() {
        String archive = "nfs-share:backup/vzdump-lxc-101-2024_05_10-00_00_00.tar.zst";

        OperationOutcome outcome = run(BackupRequest.restore("pve", archive, 301, "local-lvm", true));

        assertTrue(outcome.isSuccess());
        Submission submission = backend.lastSubmission();
        assertEquals("/nodes/pve/lxc", submission.getPath());
        assertEquals(archive, submission.getParams().get("ostemplate"));
        assertEquals(true, submission.getParams().get("restore"));
        assertEquals(true, submission.getParams().get("unique"));
        assertEquals(ResourceKind.CONTAINER, outcome.getPayload().get("kind"));
        assertEquals("raw", outcome.getPayload().get("diskFormat"));
    }

    @Test
    void vmArchiveIsRestoredThroughQemu() {
        String archive = "local:backup/vzdump-qemu-100-2024_05_01-00_00_00.vma.zst";

        run(BackupRequest.restore("pve", archive, 201, null, false));

        Submission submission = backend.lastSubmission();
        assertEquals("/nodes/pve/qemu", submission.getPath());
        assertEquals(archive, submission.getParams().get("archive"));
        assertFalse(submission.getParams().containsKey("unique"));
    }

    @Test
    void protectedBackupIsNotDeleted() {
        backend.stubRead("/nodes/pve/storage/local/content",
                "[{volid: 'local:backup/vzdump-qemu-100.vma.zst', protected: 1}]");

        OperationOutcome outcome = run(BackupRequest.delete("pve", "local", "local:backup/vzdump-qemu-100.vma.zst"));

        assertEquals(ErrorKind.UNSUPPORTED_OPTION, outcome.getError().getKind());
        assertTrue(backend.getSubmissions().isEmpty());
    }

    @Test
    void missingBackupIsNotFound() {
        backend.stubRead("/nodes/pve/storage/local/content", "[]");

        OperationOutcome outcome = run(BackupRequest.delete("pve", "local", "local:backup/nothing.vma.zst"));

        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().getKind());
    }

    // ---- ISO images ----

    @Test
    void downloadSendsChecksumWithDefaultAlgorithm() {
        OperationOutcome outcome = run(IsoRequest.download("pve", "local",
                "https://cdimage.debian.org/debian-12.5.0-amd64-netinst.iso", "debian.iso", "abc123", null));

        assertTrue(outcome.isSuccess());
        Submission submission = backend.lastSubmission();
        assertEquals("/nodes/pve/storage/local/download-url", submission.getPath());
        assertEquals("iso", submission.getParams().get("content"));
        assertEquals("sha256", submission.getParams().get("checksum-algorithm"));
        assertEquals("local:iso/debian.iso", outcome.getPayload().get("volid"));
    }

    @Test
    void isoDeleteLooksUpVolumeIdByFileName() {
        backend.stubRead("/nodes/pve/storage/local/content",
                "[{volid: 'local:iso/ubuntu.iso'}, {volid: 'local:iso/debian.iso'}]")
                .queueSubmitResult(TextNode.valueOf(""));

        OperationOutcome outcome = run(IsoRequest.delete("pve", "local", "debian.iso"));

        assertTrue(outcome.isSuccess());
        assertEquals("local:iso/debian.iso", outcome.getPayload().get("volid"));
        assertEquals(HttpMethod.DELETE, backend.lastSubmission().getMethod());
        assertTrue(backend.lastSubmission().getPath().startsWith("/nodes/pve/storage/local/content/local:iso"));
    }

    @Test
    void unknownIsoIsNotFound() {
        backend.stubRead("/nodes/pve/storage/local/content", "[{volid: 'local:iso/ubuntu.iso'}]");

        OperationOutcome outcome = run(IsoRequest.delete("pve", "local", "debian.iso"));

        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().getKind());
    }

    @Test
    void templatesListOnlyReadsTemplateStorages() {
        backend.stubRead("/nodes/pve/storage/local/content",
                "[{volid: 'local:vztmpl/debian-12-standard_12.2-1_amd64.tar.zst', ctime: 5}]");

        OperationOutcome outcome = run(IsoRequest.listTemplates(null, null));

        assertEquals(1, outcome.getPayload().get("count"));
        JsonNode first = ((ArrayNode) outcome.getPayload().get("templates")).get(0);
        assertEquals("local", first.path("storage").asText());
        assertEquals(List.of("/nodes/pve/storage/local/content"), backend.getReadPaths());
    }

    @Test
    void archiveKindFollowsVolumeName() {
        assertEquals(ResourceKind.CONTAINER, OperationDispatcher.kindOfArchive("pbs:backup/ct/101/2024-05-10T00:00:00Z"));
        assertEquals(ResourceKind.VM, OperationDispatcher.kindOfArchive("pbs:backup/vm/100/2024-05-10T00:00:00Z"));
        assertEquals(ResourceKind.CONTAINER, OperationDispatcher.kindOfArchive("local:backup/vzdump-lxc-101.tar.zst"));
    }
}
