package org.tanzu.proxmoxmcp.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An asynchronous Proxmox task, identified by its UPID.
 *
 * A UPID has the form {@code UPID:<node>:<pid>:<pstart>:<starttime>:<type>:<id>:<user>:}.
 * The node is taken from the UPID because task status must be read from the
 * node that runs the task. A handle is tracked by one polling session only;
 * {@link #claim()} enforces that.
 */
public final class TaskHandle {

    private final String upid;
    private final String node;
    private final Instant submittedAt;
    private final AtomicBoolean claimed = new AtomicBoolean();

    public TaskHandle(String upid, String node, Instant submittedAt) {
        this.upid = upid;
        this.node = node;
        this.submittedAt = submittedAt;
    }

    /**
     * Builds a handle from the UPID returned by a submission.
     *
     * @param upid the task id string
     * @param submittedAt submission time
     * @throws IllegalArgumentException if the string is not a UPID
     */
    public static TaskHandle fromUpid(String upid, Instant submittedAt) {
        if (!isUpid(upid)) {
            throw new IllegalArgumentException("Not a Proxmox task id: " + upid);
        }
        return new TaskHandle(upid, upid.split(":")[1], submittedAt);
    }

    public static boolean isUpid(String value) {
        return value != null && value.startsWith("UPID:") && value.split(":").length > 2;
    }

    public String getUpid() { return upid; }
    public String getNode() { return node; }
    public Instant getSubmittedAt() { return submittedAt; }

    /**
     * Marks the handle as being tracked.
     *
     * @throws IllegalStateException if another session already tracks this handle
     */
    public void claim() {
        if (!claimed.compareAndSet(false, true)) {
            throw new IllegalStateException("Task " + upid + " is already being tracked");
        }
    }

    @Override
    public String toString() {
        return "TaskHandle{upid='" + upid + "', node='" + node + "', submittedAt=" + submittedAt + "}";
    }
}
