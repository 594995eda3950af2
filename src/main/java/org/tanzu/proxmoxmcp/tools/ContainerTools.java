package org.tanzu.proxmoxmcp.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.proxmoxmcp.model.OperationException;
import org.tanzu.proxmoxmcp.model.OperationOutcome;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.ResourceRef;
import org.tanzu.proxmoxmcp.model.request.CreateRequest;
import org.tanzu.proxmoxmcp.model.request.DeleteRequest;
import org.tanzu.proxmoxmcp.model.request.PowerAction;
import org.tanzu.proxmoxmcp.model.request.PowerRequest;
import org.tanzu.proxmoxmcp.orchestration.OperationService;
import org.tanzu.proxmoxmcp.orchestration.ResourceResolver;
import org.tanzu.proxmoxmcp.orchestration.ResultNormalizer;
import org.tanzu.proxmoxmcp.proxmox.ApiPath;
import org.tanzu.proxmoxmcp.proxmox.BackendException;
import org.tanzu.proxmoxmcp.proxmox.ProxmoxBackend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP tools for LXC containers.
 * 
 * The power tools take a selector ("123", "pve1:123", "pve1/name", "name") or a
 * comma-separated list of selectors and return one outcome per container. If any
 * selector cannot be resolved, nothing is started or stopped and a single
 * FAILED outcome explains why.
 */
@Service
public class ContainerTools {

    private static final Logger logger = LoggerFactory.getLogger(ContainerTools.class);

    static final int DEFAULT_TIMEOUT_SECONDS = 10;

    private static final long MIB = 1024L * 1024L;

    private final OperationService operations;
    private final ResourceResolver resolver;
    private final ResultNormalizer normalizer;
    private final ProxmoxBackend backend;

    public ContainerTools(OperationService operations, ResourceResolver resolver, ResultNormalizer normalizer,
                          ProxmoxBackend backend) {
        this.operations = operations;
        this.resolver = resolver;
        this.normalizer = normalizer;
        this.backend = backend;
        logger.info("ContainerTools initialized");
    }

    /**
     * MCP tool: Lists containers. With stats, each entry also carries live CPU and
     * memory from status/current, cores and memory size from the config, and the
     * last RRD sample where the live values read zero (stopped or just started
     * containers). Raw status and config blobs are attached on request.
     */
    @Tool(name = "get_containers", description = "List LXC containers across the cluster, or on one node. Returns vmid, name, node, status and, with include_stats, cores, memory and CPU/memory usage.")
    public List<ContainerInfo> getContainers(
            @ToolParam(description = "Optional node name (e.g. 'pve1')", required = false) String node,
            @ToolParam(description = "Include live CPU and memory stats (default true)", required = false) Boolean include_stats,
            @ToolParam(description = "Attach the raw status and config returned by Proxmox (default false)", required = false) Boolean include_raw) {
        logger.info("=== MCP TOOL CALLED: get_containers({}, stats={}, raw={}) ===", node, include_stats, include_raw);
        boolean stats = ToolInputs.orDefault(include_stats, true);
        boolean raw = ToolInputs.orDefault(include_raw, false);
        try {
            String onlyNode = ToolInputs.blankToNull(node);
            List<ContainerInfo> result = new ArrayList<>();
            boolean nodeSeen = false;
            for (JsonNode nodeEntry : backend.listNodes()) {
                String nodeName = nodeEntry.path("node").asText(null);
                if (nodeName == null || (onlyNode != null && !onlyNode.equals(nodeName))) {
                    continue;
                }
                nodeSeen = true;
                if ("offline".equals(nodeEntry.path("status").asText())) {
                    logger.warn("Skipping offline node {}", nodeName);
                    continue;
                }
                for (JsonNode ct : backend.listResources(nodeName, ResourceKind.CONTAINER)) {
                    result.add(describe(nodeName, ct, stats, raw));
                }
            }
            if (onlyNode != null && !nodeSeen) {
                throw new RuntimeException("Node not found: " + onlyNode);
            }
            logger.info("Retrieved {} containers", result.size());
            return result;
        } catch (BackendException e) {
            logger.error("Failed to retrieve containers: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to retrieve containers: " + e.getMessage(), e);
        }
    }

    private ContainerInfo describe(String nodeName, JsonNode ct, boolean stats, boolean raw) {
        int vmid = ct.path("vmid").asInt();
        String name = ct.path("name").asText(ct.path("hostname").asText("ct-" + vmid));
        ContainerInfo info = new ContainerInfo(vmid, name, nodeName, ct.path("status").asText("unknown"));
        if (!stats && !raw) {
            return info;
        }

        JsonNode status = readOrEmpty(ApiPath.of("nodes", nodeName, "lxc", vmid, "status", "current"), null);
        JsonNode config = readOrEmpty(ApiPath.of("nodes", nodeName, "lxc", vmid, "config"), null);
        if (raw) {
            info.rawStatus = status;
            info.rawConfig = config;
        }
        if (!stats) {
            return info;
        }

        double cpuPct = round2(status.path("cpu").asDouble(0) * 100);
        long mem = status.path("mem").asLong(0);
        long maxmem = status.path("maxmem").asLong(0);
        int memoryMib = firstPresent(config, "memory", "ram", "maxmem", "memoryMiB").asInt(0);

        if (config.hasNonNull("cores")) {
            info.cores = config.path("cores").asInt();
        } else if (config.path("cpulimit").asDouble(0) > 0) {
            info.cores = config.path("cpulimit").asDouble();
        }
        info.unlimitedMemory = config.path("swap").asLong(0) == 0 && memoryMib == 0;

        if (mem == 0 || maxmem == 0 || cpuPct == 0) {
            JsonNode sample = lastRrdSample(nodeName, vmid);
            if (cpuPct == 0 && sample.hasNonNull("cpu")) {
                cpuPct = round2(sample.path("cpu").asDouble() * 100);
            }
            if (mem == 0 && sample.hasNonNull("mem")) {
                mem = sample.path("mem").asLong();
            }
            if (maxmem == 0 && sample.path("maxmem").asLong(0) > 0) {
                maxmem = sample.path("maxmem").asLong();
                if (memoryMib == 0) {
                    memoryMib = (int) Math.round(maxmem / (double) MIB);
                }
            }
        }

        info.memory = memoryMib;
        info.cpuPct = cpuPct;
        info.memBytes = mem;
        info.maxmemBytes = maxmem;
        info.memPct = maxmem > 0 ? round2(mem * 100.0 / maxmem) : null;
        return info;
    }

    /** Latest RRD sample carrying any of cpu, mem or maxmem; an empty node when there is none. */
    private JsonNode lastRrdSample(String nodeName, int vmid) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("timeframe", "hour");
        query.put("ds", "cpu,mem,maxmem");
        JsonNode samples = readOrEmpty(ApiPath.of("nodes", nodeName, "lxc", vmid, "rrddata"), query);
        if (!samples.isArray()) {
            return MissingNode.getInstance();
        }
        for (int i = samples.size() - 1; i >= 0; i--) {
            JsonNode sample = samples.get(i);
            if (sample.hasNonNull("cpu") || sample.hasNonNull("mem") || sample.hasNonNull("maxmem")) {
                return sample;
            }
        }
        return MissingNode.getInstance();
    }

    /** Stats are best effort: a read that fails leaves the affected values at zero. */
    private JsonNode readOrEmpty(String path, Map<String, Object> query) {
        try {
            JsonNode data = backend.read(path, query);
            return data == null ? MissingNode.getInstance() : data;
        } catch (BackendException e) {
            logger.debug("Could not read {}: {}", path, e.getMessage());
            return MissingNode.getInstance();
        }
    }

    private static JsonNode firstPresent(JsonNode config, String... fields) {
        for (String field : fields) {
            if (config.hasNonNull(field)) {
                return config.get(field);
            }
        }
        return MissingNode.getInstance();
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    @Tool(name = "create_container", description = "Create a new LXC container from an OS template")
    public OperationOutcome createContainer(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "New container ID number (e.g. 300)") Integer vmid,
            @ToolParam(description = "Template volume (e.g. 'local:vztmpl/debian-12-standard_12.2-1_amd64.tar.zst')") String ostemplate,
            @ToolParam(description = "Container hostname") String hostname,
            @ToolParam(description = "Number of CPU cores, 1-32") Integer cores,
            @ToolParam(description = "Memory size in MB, 512-131072") Integer memory,
            @ToolParam(description = "Root filesystem size in GB, 5-1000") Integer disk_size,
            @ToolParam(description = "Storage for the root filesystem (optional, will auto-detect)", required = false) String storage,
            @ToolParam(description = "Root password (optional)", required = false) String password,
            @ToolParam(description = "Run as unprivileged container (default true)", required = false) Boolean unprivileged) {
        logger.info("=== MCP TOOL CALLED: create_container({}, {}, {}) ===", node, vmid, hostname);
        CreateRequest request = CreateRequest.container()
                .node(node)
                .vmid(vmid)
                .ostemplate(ToolInputs.blankToNull(ostemplate))
                .name(hostname)
                .cores(cores)
                .memoryMb(memory)
                .diskGb(disk_size)
                .storage(ToolInputs.blankToNull(storage))
                .password(ToolInputs.blankToNull(password))
                .unprivileged(ToolInputs.orDefault(unprivileged, true))
                .build();
        return operations.execute(request);
    }

    @Tool(name = "start_container", description = "Start one or more LXC containers. Selector: '123' | 'pve1:123' | 'pve1/name' | 'name' | comma list")
    public List<OperationOutcome> startContainer(
            @ToolParam(description = "CT selector: '123' | 'pve1:123' | 'pve1/name' | 'name' | comma list") String selector) {
        logger.info("=== MCP TOOL CALLED: start_container({}) ===", selector);
        return powerEach("start_container", selector, PowerAction.START, null);
    }

    @Tool(name = "stop_container", description = "Stop one or more LXC containers, gracefully (shutdown) or forcefully (stop)")
    public List<OperationOutcome> stopContainer(
            @ToolParam(description = "CT selector (see start_container)") String selector,
            @ToolParam(description = "Graceful shutdown (true) or forced stop (false, default)", required = false) Boolean graceful,
            @ToolParam(description = "Timeout for a graceful shutdown, 1-600 seconds (default 10)", required = false) Integer timeout_seconds) {
        logger.info("=== MCP TOOL CALLED: stop_container({}, graceful={}) ===", selector, graceful);
        if (ToolInputs.orDefault(graceful, false)) {
            int timeout = timeout_seconds != null ? timeout_seconds : DEFAULT_TIMEOUT_SECONDS;
            return powerEach("shutdown_container", selector, PowerAction.SHUTDOWN, timeout);
        }
        return powerEach("stop_container", selector, PowerAction.STOP, null);
    }

    @Tool(name = "restart_container", description = "Reboot one or more LXC containers")
    public List<OperationOutcome> restartContainer(
            @ToolParam(description = "CT selector (see start_container)") String selector,
            @ToolParam(description = "Timeout for the reboot, 1-600 seconds (default 10)", required = false) Integer timeout_seconds) {
        logger.info("=== MCP TOOL CALLED: restart_container({}) ===", selector);
        int timeout = timeout_seconds != null ? timeout_seconds : DEFAULT_TIMEOUT_SECONDS;
        return powerEach("restart_container", selector, PowerAction.REBOOT, timeout);
    }

    @Tool(name = "delete_container", description = "Delete an LXC container and its volumes. A running container requires force=true and is stopped first.")
    public OperationOutcome deleteContainer(
            @ToolParam(description = "Host node name (e.g. 'pve')") String node,
            @ToolParam(description = "Container ID number") Integer vmid,
            @ToolParam(description = "Force deletion even if the container is running", required = false) Boolean force) {
        logger.info("=== MCP TOOL CALLED: delete_container({}, {}, force={}) ===", node, vmid, force);
        return operations.execute(new DeleteRequest(ToolInputs.selector(node, vmid), ResourceKind.CONTAINER,
                ToolInputs.orDefault(force, false)));
    }

    private List<OperationOutcome> powerEach(String operation, String selector, PowerAction action, Integer timeout) {
        List<ResourceRef> targets;
        try {
            targets = resolver.resolveAll(selector, ResourceKind.CONTAINER);
        } catch (OperationException e) {
            return List.of(normalizer.failure(operation, e));
        } catch (BackendException e) {
            return List.of(normalizer.failure(operation, e));
        }

        List<OperationOutcome> outcomes = new ArrayList<>();
        for (ResourceRef target : targets) {
            String exact = target.getNode() + ":" + target.getVmid();
            outcomes.add(operations.execute(new PowerRequest(exact, ResourceKind.CONTAINER, action, timeout)));
        }
        return outcomes;
    }

    /**
     * Data class representing an LXC container. Stats fields stay null unless
     * requested and are left out of the JSON then.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ContainerInfo {
        private final int vmid;
        private final String name;
        private final String node;
        private final String status;
        private Number cores;
        private Integer memory;
        private Double cpuPct;
        private Long memBytes;
        private Long maxmemBytes;
        private Double memPct;
        private Boolean unlimitedMemory;
        private JsonNode rawStatus;
        private JsonNode rawConfig;

        public ContainerInfo(int vmid, String name, String node, String status) {
            this.vmid = vmid;
            this.name = name;
            this.node = node;
            this.status = status;
        }

        public int getVmid() { return vmid; }
        public String getName() { return name; }
        public String getNode() { return node; }
        public String getStatus() { return status; }
        /** Configured cores, or the CPU limit when no core count is set. */
        public Number getCores() { return cores; }
        /** Configured memory in MiB. */
        public Integer getMemory() { return memory; }
        public Double getCpuPct() { return cpuPct; }
        public Long getMemBytes() { return memBytes; }
        public Long getMaxmemBytes() { return maxmemBytes; }
        public Double getMemPct() { return memPct; }
        /** True when neither memory nor swap is limited in the config. */
        public Boolean getUnlimitedMemory() { return unlimitedMemory; }
        public JsonNode getRawStatus() { return rawStatus; }
        public JsonNode getRawConfig() { return rawConfig; }

        @Override
        public String toString() {
            return "ContainerInfo{vmid=" + vmid + ", name='" + name + "', node='" + node + "', status='" + status + "'}";
        }
    }
}
