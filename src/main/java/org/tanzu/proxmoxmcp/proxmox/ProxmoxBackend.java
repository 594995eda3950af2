package org.tanzu.proxmoxmcp.proxmox;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.tanzu.proxmoxmcp.model.ResourceKind;

import java.util.Map;

/**
 * The capabilities orchestration needs from Proxmox.
 *
 * Every method returns the unwrapped {@code data} member of the Proxmox
 * response and throws {@link BackendException} on failure. Paths are relative
 * to {@code /api2/json} and built with {@link ApiPath}.
 */
public interface ProxmoxBackend {

    /** GET /nodes */
    JsonNode listNodes();

    /** GET /nodes/{node}/storage */
    JsonNode listStorage(String node);

    /** GET /nodes/{node}/qemu or /nodes/{node}/lxc */
    JsonNode listResources(String node, ResourceKind kind);

    /**
     * Synchronous read of any API path.
     *
     * @param query query parameters; null values are skipped
     */
    JsonNode read(String path, Map<String, ?> query);

    /**
     * Submits a state-changing call. Most calls answer with a UPID string that
     * identifies the asynchronous task; some answer synchronously.
     *
     * @param params form parameters (POST/PUT) or query parameters (DELETE); null values are skipped
     */
    JsonNode submitTask(HttpMethod method, String path, Map<String, ?> params);

    /** GET /nodes/{node}/tasks/{upid}/status */
    JsonNode pollTask(String node, String upid);
}
