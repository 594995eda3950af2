package org.tanzu.proxmoxmcp.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.tanzu.proxmoxmcp.config.TaskSettings;
import org.tanzu.proxmoxmcp.model.ErrorKind;
import org.tanzu.proxmoxmcp.model.OperationError;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.TaskHandle;
import org.tanzu.proxmoxmcp.proxmox.ApiPath;
import org.tanzu.proxmoxmcp.proxmox.BackendException;
import org.tanzu.proxmoxmcp.proxmox.ProxmoxBackend;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Polls an asynchronous Proxmox task until it stops or a deadline passes.
 * 
 * Proxmox reports {@code status=running} until the worker exits, then
 * {@code status=stopped} with an {@code exitstatus}: "OK", "WARNINGS: n", or
 * an error message. Polling runs at a fixed interval on the calling thread.
 * 
 * Neither a timeout nor an interrupted caller cancels the task on the node;
 * the returned TIMED_OUT outcome carries the UPID so the caller can check later.
 */
@Component
public class TaskTracker {

    private static final Logger logger = LoggerFactory.getLogger(TaskTracker.class);

    /** Waits between polls. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ProxmoxBackend backend;
    private final ResultNormalizer normalizer;
    private final Duration pollInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public TaskTracker(ProxmoxBackend backend, TaskSettings settings, ResultNormalizer normalizer) {
        this(backend, settings, normalizer, Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()));
    }

    TaskTracker(ProxmoxBackend backend, TaskSettings settings, ResultNormalizer normalizer, Clock clock, Sleeper sleeper) {
        this.backend = backend;
        this.normalizer = normalizer;
        this.pollInterval = settings.getPollInterval();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Tracks a task, labelling the outcome with the task type taken from the UPID.
     */
    public OperationOutcome track(TaskHandle handle, Duration timeout) {
        return track(taskType(handle.getUpid()), handle, timeout);
    }

    /**
     * Tracks a task to a terminal outcome.
     * 
     * @param operation label for the outcome
     * @param handle the task; claimed for the duration of this call
     * @param timeout how long to poll before giving up
     * @return SUCCESS when the task stopped with OK or warnings, FAILED when it
     *         stopped with an error or vanished, TIMED_OUT on deadline or interrupt
     * @throws IllegalStateException if the handle is already being tracked
     */
    public OperationOutcome track(String operation, TaskHandle handle, Duration timeout) {
        handle.claim();
        Instant deadline = clock.instant().plus(timeout);
        logger.info("Tracking task {} on node {} (timeout {}s)", handle.getUpid(), handle.getNode(), timeout.toSeconds());

        int polls = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(operation, handle);
            }

            polls++;
            JsonNode status = null;
            try {
                status = backend.pollTask(handle.getNode(), handle.getUpid());
            } catch (BackendException e) {
                ErrorKind kind = normalizer.classify(e.getStatusCode(), e.getMessage());
                if (kind == ErrorKind.NOT_FOUND) {
                    logger.warn("Task {} vanished: {}", handle.getUpid(), e.getMessage());
                    return OperationOutcome.failed(operation,
                            OperationError.backend(ErrorKind.NOT_FOUND, "task vanished: " + handle.getUpid(), e.getResponseBody()));
                }
                if (!e.isTransient()) {
                    return normalizer.failure(operation, e);
                }
                logger.warn("Status poll {} for task {} got no response, polling again", polls, handle.getUpid());
            }

            if (status != null && "stopped".equals(status.path("status").asText())) {
                return stopped(operation, handle, status.path("exitstatus").asText(""), polls);
            }

            if (!clock.instant().isBefore(deadline)) {
                logger.warn("Task {} still running after {}s, giving up tracking", handle.getUpid(), timeout.toSeconds());
                return OperationOutcome.timedOut(operation,
                        "Task " + handle.getUpid() + " did not finish within " + timeout.toSeconds() + "s; it may still complete",
                        taskPayload(handle, null));
            }

            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(operation, handle);
            }
        }
    }

    /**
     * Polls a guest agent command started with {@code agent/exec} until the agent
     * reports it exited. The agent answers with a pid rather than a UPID, and its
     * status lives under the VM, not under the node's task list.
     *
     * @param operation label for the outcome
     * @param node node hosting the VM
     * @param vmid the VM running the command
     * @param pid process id returned by the agent
     * @param timeout how long to poll before giving up
     * @return SUCCESS with exit code, stdout and stderr once the process exited (whatever
     *         its exit code), FAILED when the status cannot be read, TIMED_OUT on deadline or interrupt
     */
    public OperationOutcome trackCommand(String operation, String node, int vmid, long pid, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        String statusPath = ApiPath.of("nodes", node, "qemu", vmid, "agent", "exec-status");
        logger.info("Tracking guest command pid {} in VM {} on node {} (timeout {}s)", pid, vmid, node, timeout.toSeconds());

        int polls = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                return OperationOutcome.timedOut(operation, "polling cancelled; command pid " + pid + " keeps running",
                        commandPayload(node, vmid, pid, null));
            }

            polls++;
            JsonNode status = null;
            try {
                status = backend.read(statusPath, Map.of("pid", pid));
            } catch (BackendException e) {
                if (!e.isTransient()) {
                    return normalizer.failure(operation, e);
                }
                logger.warn("Status poll {} for command pid {} got no response, polling again", polls, pid);
            }

            if (status != null && status.path("exited").asBoolean(false)) {
                logger.info("Command pid {} in VM {} exited with {} after {} poll(s)", pid, vmid,
                        status.path("exitcode").asText("?"), polls);
                return normalizer.success(operation, commandPayload(node, vmid, pid, status));
            }

            if (!clock.instant().isBefore(deadline)) {
                logger.warn("Command pid {} in VM {} still running after {}s, giving up tracking", pid, vmid, timeout.toSeconds());
                return OperationOutcome.timedOut(operation,
                        "Command pid " + pid + " did not exit within " + timeout.toSeconds() + "s; it may still complete",
                        commandPayload(node, vmid, pid, null));
            }

            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OperationOutcome.timedOut(operation, "polling cancelled; command pid " + pid + " keeps running",
                        commandPayload(node, vmid, pid, null));
            }
        }
    }

    private OperationOutcome stopped(String operation, TaskHandle handle, String exitStatus, int polls) {
        logger.info("Task {} stopped with '{}' after {} poll(s)", handle.getUpid(), exitStatus, polls);
        if ("OK".equals(exitStatus) || exitStatus.startsWith("WARNINGS")) {
            return normalizer.success(operation, taskPayload(handle, exitStatus));
        }
        OperationError error = normalizer.fromTaskExitStatus(exitStatus, handle.getUpid());
        logger.warn("{} failed: {} ({})", operation, error.getDetail(), error.getKind());
        return OperationOutcome.failed(operation, error);
    }

    private OperationOutcome cancelled(String operation, TaskHandle handle) {
        logger.info("Polling of task {} cancelled by caller", handle.getUpid());
        return OperationOutcome.timedOut(operation, "polling cancelled; task " + handle.getUpid() + " keeps running",
                taskPayload(handle, null));
    }

    private static Map<String, Object> taskPayload(TaskHandle handle, String exitStatus) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("upid", handle.getUpid());
        payload.put("node", handle.getNode());
        if (exitStatus != null) {
            payload.put("exitstatus", exitStatus);
        }
        return payload;
    }

    private static Map<String, Object> commandPayload(String node, int vmid, long pid, JsonNode status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("vmid", vmid);
        payload.put("node", node);
        payload.put("pid", pid);
        if (status != null) {
            payload.put("exitcode", status.path("exitcode").asInt(-1));
            payload.put("stdout", status.path("out-data").asText(""));
            payload.put("stderr", status.path("err-data").asText(""));
            if (status.has("signal")) {
                payload.put("signal", status.path("signal").asInt());
            }
            if (status.path("out-truncated").asBoolean(false) || status.path("err-truncated").asBoolean(false)) {
                payload.put("truncated", true);
            }
        }
        return payload;
    }

    static String taskType(String upid) {
        String[] parts = upid.split(":");
        return parts.length > 5 ? parts[5] : "task";
    }
}
