package org.tanzu.proxmoxmcp.orchestration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.tanzu.proxmoxmcp.model.ErrorKind;
import org.tanzu.proxmoxmcp.model.OperationError;
import org.tanzu.proxmoxmcp.model.OperationException;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.Violation;
import org.tanzu.proxmoxmcp.model.request.BackupRequest;
import org.tanzu.proxmoxmcp.model.request.CommandRequest;
import org.tanzu.proxmoxmcp.model.request.CreateRequest;
import org.tanzu.proxmoxmcp.model.request.DeleteRequest;
import org.tanzu.proxmoxmcp.model.request.IsoRequest;
import org.tanzu.proxmoxmcp.model.request.PowerAction;
import org.tanzu.proxmoxmcp.model.request.PowerRequest;
import org.tanzu.proxmoxmcp.model.request.SnapshotAction;
import org.tanzu.proxmoxmcp.model.request.SnapshotRequest;
import org.tanzu.proxmoxmcp.proxmox.FakeProxmoxBackend;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {

    private final FakeProxmoxBackend backend = new FakeProxmoxBackend()
            .node("pve")
            .vm("pve", 100, "existing", "running")
            .container("pve", 101, "ct", "stopped");

    private final RequestValidator validator = new RequestValidator(new ResourceResolver(backend));

    private CreateRequest.Builder validVm() {
        return CreateRequest.vm().node("pve").vmid(200).name("web").cores(2).memoryMb(2048).diskGb(20);
    }

    private CreateRequest.Builder validContainer() {
        return CreateRequest.container().node("pve").vmid(300).name("proxy").cores(1).memoryMb(512).diskGb(8)
                .ostemplate("local:vztmpl/debian-12-standard_12.2-1_amd64.tar.zst");
    }

    private OperationError rejected(Executable call) {
        return assertThrows(OperationException.class, call).getError();
    }

    private static Set<String> fields(OperationError error) {
        return error.getViolations().stream().map(Violation::getField).collect(Collectors.toSet());
    }

    @Test
    void validVmPasses() {
        CreateRequest request = validVm().build();

        assertSame(request, validator.validate(request).getRequest());
    }

    @Test
    void boundaryValuesPass() {
        assertDoesNotThrow(() -> validator.validate(validVm().cores(1).memoryMb(512).diskGb(5).build()));
        assertDoesNotThrow(() -> validator.validate(validVm().cores(32).memoryMb(131072).diskGb(1000).build()));
    }

    @Test
    void reportsEveryViolationAtOnce() {
        OperationError error = rejected(() -> validator.validate(validVm().memoryMb(200).cores(64).build()));

        assertEquals(ErrorKind.VALIDATION, error.getKind());
        assertEquals(2, error.getViolations().size());
        assertEquals(Set.of("memory", "cpus"), fields(error));
    }

    @Test
    void everyMissingFieldIsReported() {
        OperationError error = rejected(() -> validator.validate(CreateRequest.vm().build()));

        assertEquals(Set.of("node", "vmid", "name", "cpus", "memory", "disk_size"), fields(error));
    }

    @Test
    void vmidInUseIsRejected() {
        OperationError error = rejected(() -> validator.validate(validVm().vmid(101).build()));

        assertEquals(1, error.getViolations().size());
        assertEquals("vmid", error.getViolations().get(0).getField());
        assertTrue(error.getViolations().get(0).getMessage().contains("already in use"));
    }

    @Test
    void outOfRangeVmidIsNotLookedUp() {
        OperationError error = rejected(() -> validator.validate(validVm().vmid(0).build()));

        assertEquals(1, error.getViolations().size());
        assertTrue(error.getViolations().get(0).getMessage().startsWith("must be between"));
    }

    @Test
    void unknownDiskFormatIsRejected() {
        OperationError error = rejected(() -> validator.validate(validVm().diskFormat("vmdk").build()));

        assertEquals(Set.of("disk_format"), fields(error));
    }

    @Test
    void containerNeedsTemplateAndTakesNoDiskFormat() {
        OperationError error = rejected(() -> validator.validate(validContainer().ostemplate(null).diskFormat("raw").build()));

        assertEquals(ErrorKind.VALIDATION, error.getKind());
        assertEquals(Set.of("ostemplate", "disk_format"), fields(error));
        assertEquals(ErrorKind.UNSUPPORTED_OPTION, error.getViolations().stream()
                .filter(v -> v.getField().equals("disk_format")).findFirst().get().getKind());
    }

    @Test
    void containerFieldNamesFollowContainerTools() {
        OperationError error = rejected(() -> validator.validate(validContainer().name(" ").cores(0).build()));

        assertEquals(Set.of("hostname", "cores"), fields(error));
    }

    @Test
    void containerResetIsUnsupported() {
        OperationError error = rejected(() -> validator.validate(
                new PowerRequest("pve:101", ResourceKind.CONTAINER, PowerAction.RESET, null)));

        assertEquals(ErrorKind.UNSUPPORTED_OPTION, error.getKind());
    }

    @Test
    void containerShutdownTimeoutMustBeInRange() {
        OperationError error = rejected(() -> validator.validate(
                new PowerRequest("pve:101", ResourceKind.CONTAINER, PowerAction.SHUTDOWN, 601)));

        assertEquals(Set.of("timeout_seconds"), fields(error));
        assertDoesNotThrow(() -> validator.validate(
                new PowerRequest("pve:101", ResourceKind.CONTAINER, PowerAction.SHUTDOWN, 600)));
    }

    @Test
    void missingTargetIsReportedOnVmid() {
        OperationError delete = rejected(() -> validator.validate(new DeleteRequest(null, ResourceKind.VM, false)));
        OperationError power = rejected(() -> validator.validate(
                new PowerRequest(null, ResourceKind.VM, PowerAction.START, null)));
        OperationError snapshot = rejected(() -> validator.validate(
                new SnapshotRequest(SnapshotAction.CREATE, null, ResourceKind.VM, "before", null, false)));

        assertEquals(Set.of("vmid"), fields(delete));
        assertEquals(Set.of("vmid"), fields(power));
        assertEquals(Set.of("vmid"), fields(snapshot));
    }

    @Test
    void guestCommandNeedsTargetAndCommand() {
        OperationError error = rejected(() -> validator.validate(new CommandRequest(null, "")));

        assertEquals(Set.of("vmid", "command"), fields(error));
        assertDoesNotThrow(() -> validator.validate(new CommandRequest("pve:100", "df -h")));
    }

    @Test
    void snapshotNamesAreChecked() {
        for (String bad : new String[] {"1st", "with space", "a".repeat(41), "dot.name"}) {
            OperationError error = rejected(() -> validator.validate(
                    new SnapshotRequest(SnapshotAction.CREATE, "pve:100", ResourceKind.VM, bad, null, false)));
            assertEquals(Set.of("snapname"), fields(error), bad);
        }
        assertDoesNotThrow(() -> validator.validate(
                new SnapshotRequest(SnapshotAction.CREATE, "pve:100", ResourceKind.VM, "pre-upgrade_1", null, true)));
        assertDoesNotThrow(() -> validator.validate(SnapshotRequest.list("pve:100", ResourceKind.VM)));
    }

    @Test
    void memoryStateSnapshotOfContainerIsUnsupported() {
        OperationError error = rejected(() -> validator.validate(
                new SnapshotRequest(SnapshotAction.CREATE, "pve:101", ResourceKind.CONTAINER, "snap", null, true)));

        assertEquals(ErrorKind.UNSUPPORTED_OPTION, error.getKind());
        assertEquals(Set.of("vmstate"), fields(error));
    }

    @Test
    void backupOptionsAreChecked() {
        OperationError error = rejected(() -> validator.validate(
                BackupRequest.create("pve", 100, "backups", "bzip2", "fast", null)));

        assertEquals(Set.of("compress", "mode"), fields(error));
        assertDoesNotThrow(() -> validator.validate(BackupRequest.create("pve", 100, "backups", "zstd", "stop", "nightly")));
    }

    @Test
    void restoreNeedsFreeVmid() {
        OperationError error = rejected(() -> validator.validate(
                BackupRequest.restore("pve", "backups:backup/vzdump-qemu-100.vma.zst", 100, null, true)));

        assertEquals(Set.of("vmid"), fields(error));
    }

    @Test
    void backupDeleteNeedsVolumeId() {
        OperationError error = rejected(() -> validator.validate(BackupRequest.delete("pve", "backups", "")));

        assertEquals(Set.of("volid"), fields(error));
    }

    @Test
    void isoDownloadChecksUrlAndAlgorithm() {
        OperationError error = rejected(() -> validator.validate(
                IsoRequest.download("pve", "local", "ftp://mirror/debian.iso", "debian.iso", "abc", "crc32")));

        assertEquals(Set.of("url", "checksum_algorithm"), fields(error));
        assertDoesNotThrow(() -> validator.validate(
                IsoRequest.download("pve", "local", "https://mirror.example.com/debian.iso", "debian.iso", null, null)));
    }

    @Test
    void listsNeedNoParameters() {
        assertDoesNotThrow(() -> validator.validate(IsoRequest.listIsos(null, null)));
        assertDoesNotThrow(() -> validator.validate(IsoRequest.listTemplates(null, null)));
        assertDoesNotThrow(() -> validator.validate(BackupRequest.list(null, null, null)));
    }

    @Test
    void detailCountsViolations() {
        OperationError error = rejected(() -> validator.validate(validVm().memoryMb(1).cores(0).diskGb(0).build()));

        assertEquals("3 invalid parameter(s)", error.getDetail());
        List<Violation> violations = error.getViolations();
        assertTrue(violations.stream().allMatch(v -> v.getKind() == ErrorKind.VALIDATION));
    }
}
