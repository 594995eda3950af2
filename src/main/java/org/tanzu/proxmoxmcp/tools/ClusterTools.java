package org.tanzu.proxmoxmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.proxmox.ApiPath;
import org.tanzu.proxmoxmcp.proxmox.BackendException;
import org.tanzu.proxmoxmcp.proxmox.ProxmoxBackend;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only MCP tools for cluster inventory.
 * 
 * These tools pass Proxmox data through with light reshaping and no
 * orchestration. Offline nodes are listed by get_nodes but skipped when
 * collecting VMs and storage, since they cannot answer.
 */
@Service
public class ClusterTools {

    private static final Logger logger = LoggerFactory.getLogger(ClusterTools.class);

    /** The Proxmox client */
    private final ProxmoxBackend backend;

    public ClusterTools(ProxmoxBackend backend) {
        this.backend = backend;
        logger.info("ClusterTools initialized");
    }

    /**
     * MCP tool: Lists all nodes in the cluster with their status and resource usage.
     * 
     * @return List of NodeInfo objects, one per cluster member
     * @throws RuntimeException if the Proxmox call fails
     */
    @Tool(name = "get_nodes", description = "List all nodes in the Proxmox cluster with their status, CPU and memory usage")
    public List<NodeInfo> getNodes() {
        logger.info("=== MCP TOOL CALLED: get_nodes() ===");
        try {
            List<NodeInfo> result = new ArrayList<>();
            for (JsonNode node : backend.listNodes()) {
                if (!node.has("node")) {
                    logger.error("Node entry missing 'node' field: {}", node);
                    continue;
                }
                result.add(new NodeInfo(
                    node.get("node").asText(),
                    node.path("status").asText("unknown"),
                    node.path("cpu").asDouble(0),
                    node.path("maxcpu").asInt(-1),
                    node.path("mem").asLong(-1),
                    node.path("maxmem").asLong(-1),
                    node.path("uptime").asLong(0)
                ));
            }
            logger.info("Retrieved {} nodes from Proxmox", result.size());
            return result;
        } catch (BackendException e) {
            logger.error("Failed to retrieve nodes: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to retrieve nodes: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: Gets detailed status of one node.
     * 
     * @param node the node name
     * @return NodeStatusInfo with CPU model, memory, uptime and versions
     * @throws RuntimeException if the node does not exist or the call fails
     */
    @Tool(name = "get_node_status", description = "Get detailed status of a specific node: CPU, memory, uptime and Proxmox/kernel versions")
    public NodeStatusInfo getNodeStatus(
            @ToolParam(description = "Name/ID of node to query (e.g. 'pve1')") String node) {
        logger.info("=== MCP TOOL CALLED: get_node_status({}) ===", node);
        try {
            JsonNode status = backend.read(ApiPath.of("nodes", node, "status"), null);
            return new NodeStatusInfo(
                node,
                status.path("uptime").asLong(0),
                status.path("cpuinfo").path("cpus").asInt(-1),
                status.path("cpuinfo").path("model").asText(""),
                status.path("cpu").asDouble(0),
                status.path("memory").path("used").asLong(-1),
                status.path("memory").path("total").asLong(-1),
                status.path("pveversion").asText(""),
                status.path("kversion").asText("")
            );
        } catch (BackendException e) {
            logger.error("Failed to retrieve status of node '{}': {}", node, e.getMessage(), e);
            throw new RuntimeException("Failed to retrieve status of node '" + node + "': " + e.getMessage(), e);
        }
    }

    @Tool(name = "get_vms", description = "List all virtual machines across the cluster with their node, status and resource usage")
    public List<VmInfo> getVms() {
        logger.info("=== MCP TOOL CALLED: get_vms() ===");
        try {
            List<VmInfo> result = new ArrayList<>();
            for (String node : onlineNodes()) {
                for (JsonNode vm : backend.listResources(node, ResourceKind.VM)) {
                    result.add(new VmInfo(
                        vm.path("vmid").asInt(),
                        vm.path("name").asText(null),
                        node,
                        vm.path("status").asText("unknown"),
                        vm.path("cpus").asInt(-1),
                        vm.path("mem").asLong(-1),
                        vm.path("maxmem").asLong(-1)
                    ));
                }
            }
            logger.info("Retrieved {} VMs from Proxmox", result.size());
            return result;
        } catch (BackendException e) {
            logger.error("Failed to retrieve VMs: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to retrieve VMs: " + e.getMessage(), e);
        }
    }

    @Tool(name = "get_storage", description = "List storage pools on every online node with type, content types and capacity in bytes")
    public List<StorageInfo> getStorage() {
        logger.info("=== MCP TOOL CALLED: get_storage() ===");
        try {
            List<StorageInfo> result = new ArrayList<>();
            for (String node : onlineNodes()) {
                for (JsonNode storage : backend.listStorage(node)) {
                    result.add(new StorageInfo(
                        storage.path("storage").asText(),
                        node,
                        storage.path("type").asText("unknown"),
                        storage.path("content").asText(""),
                        storage.path("active").asInt(1) == 1,
                        storage.path("used").asLong(-1),
                        storage.path("total").asLong(-1),
                        storage.path("avail").asLong(-1)
                    ));
                }
            }
            logger.info("Retrieved {} storage entries from Proxmox", result.size());
            return result;
        } catch (BackendException e) {
            logger.error("Failed to retrieve storage: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to retrieve storage: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: Gets cluster name, quorum state and member nodes.
     * A standalone node reports no cluster entry; the name is then empty.
     */
    @Tool(name = "get_cluster_status", description = "Get overall cluster status: cluster name, quorum and member node states")
    public ClusterStatusInfo getClusterStatus() {
        logger.info("=== MCP TOOL CALLED: get_cluster_status() ===");
        try {
            String name = "";
            boolean quorate = true;
            List<ClusterMemberInfo> members = new ArrayList<>();
            for (JsonNode entry : backend.read("/cluster/status", null)) {
                String type = entry.path("type").asText();
                if ("cluster".equals(type)) {
                    name = entry.path("name").asText("");
                    quorate = entry.path("quorate").asInt(1) == 1;
                } else if ("node".equals(type)) {
                    members.add(new ClusterMemberInfo(
                        entry.path("name").asText(),
                        entry.path("online").asInt(0) == 1,
                        entry.path("ip").asText(null),
                        entry.path("local").asInt(0) == 1
                    ));
                }
            }
            logger.info("Cluster '{}' has {} members, quorate={}", name, members.size(), quorate);
            return new ClusterStatusInfo(name, quorate, members);
        } catch (BackendException e) {
            logger.error("Failed to retrieve cluster status: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to retrieve cluster status: " + e.getMessage(), e);
        }
    }

    private List<String> onlineNodes() {
        List<String> nodes = new ArrayList<>();
        for (JsonNode node : backend.listNodes()) {
            if ("offline".equals(node.path("status").asText())) {
                logger.warn("Skipping offline node {}", node.path("node").asText());
                continue;
            }
            if (node.has("node")) {
                nodes.add(node.get("node").asText());
            }
        }
        return nodes;
    }

    /**
     * Data class representing a cluster node.
     */
    public static class NodeInfo {
        private final String node;
        private final String status;
        private final double cpuUsage;
        private final int maxCpu;
        private final long memoryBytes;
        private final long maxMemoryBytes;
        private final long uptimeSeconds;

        public NodeInfo(String node, String status, double cpuUsage, int maxCpu, long memoryBytes, long maxMemoryBytes, long uptimeSeconds) {
            this.node = node;
            this.status = status;
            this.cpuUsage = cpuUsage;
            this.maxCpu = maxCpu;
            this.memoryBytes = memoryBytes;
            this.maxMemoryBytes = maxMemoryBytes;
            this.uptimeSeconds = uptimeSeconds;
        }

        public String getNode() { return node; }
        public String getStatus() { return status; }
        public double getCpuUsage() { return cpuUsage; }
        public int getMaxCpu() { return maxCpu; }
        public long getMemoryBytes() { return memoryBytes; }
        public long getMaxMemoryBytes() { return maxMemoryBytes; }
        public long getUptimeSeconds() { return uptimeSeconds; }

        @Override
        public String toString() {
            return "NodeInfo{node='" + node + "', status='" + status + "'}";
        }
    }

    /**
     * Data class representing the detailed status of one node.
     */
    public static class NodeStatusInfo {
        private final String node;
        private final long uptimeSeconds;
        private final int cpuCount;
        private final String cpuModel;
        private final double cpuUsage;
        private final long memoryUsedBytes;
        private final long memoryTotalBytes;
        private final String pveVersion;
        private final String kernelVersion;

        public NodeStatusInfo(String node, long uptimeSeconds, int cpuCount, String cpuModel, double cpuUsage,
                              long memoryUsedBytes, long memoryTotalBytes, String pveVersion, String kernelVersion) {
            this.node = node;
            this.uptimeSeconds = uptimeSeconds;
            this.cpuCount = cpuCount;
            this.cpuModel = cpuModel;
            this.cpuUsage = cpuUsage;
            this.memoryUsedBytes = memoryUsedBytes;
            this.memoryTotalBytes = memoryTotalBytes;
            this.pveVersion = pveVersion;
            this.kernelVersion = kernelVersion;
        }

        public String getNode() { return node; }
        public long getUptimeSeconds() { return uptimeSeconds; }
        public int getCpuCount() { return cpuCount; }
        public String getCpuModel() { return cpuModel; }
        public double getCpuUsage() { return cpuUsage; }
        public long getMemoryUsedBytes() { return memoryUsedBytes; }
        public long getMemoryTotalBytes() { return memoryTotalBytes; }
        public String getPveVersion() { return pveVersion; }
        public String getKernelVersion() { return kernelVersion; }
    }

    /**
     * Data class representing a virtual machine.
     */
    public static class VmInfo {
        private final int vmid;
        private final String name;
        private final String node;
        private final String status;
        private final int cpus;
        private final long memoryBytes;
        private final long maxMemoryBytes;

        public VmInfo(int vmid, String name, String node, String status, int cpus, long memoryBytes, long maxMemoryBytes) {
            this.vmid = vmid;
            this.name = name;
            this.node = node;
            this.status = status;
            this.cpus = cpus;
            this.memoryBytes = memoryBytes;
            this.maxMemoryBytes = maxMemoryBytes;
        }

        public int getVmid() { return vmid; }
        public String getName() { return name; }
        public String getNode() { return node; }
        public String getStatus() { return status; }
        public int getCpus() { return cpus; }
        public long getMemoryBytes() { return memoryBytes; }
        public long getMaxMemoryBytes() { return maxMemoryBytes; }

        @Override
        public String toString() {
            return "VmInfo{vmid=" + vmid + ", name='" + name + "', node='" + node + "', status='" + status + "'}";
        }
    }

    /**
     * Data class representing a storage pool as seen from one node.
     */
    public static class StorageInfo {
        private final String storage;
        private final String node;
        private final String type;
        private final String content;
        private final boolean active;
        private final long usedBytes;
        private final long totalBytes;
        private final long availableBytes;

        public StorageInfo(String storage, String node, String type, String content, boolean active,
                           long usedBytes, long totalBytes, long availableBytes) {
            this.storage = storage;
            this.node = node;
            this.type = type;
            this.content = content;
            this.active = active;
            this.usedBytes = usedBytes;
            this.totalBytes = totalBytes;
            this.availableBytes = availableBytes;
        }

        public String getStorage() { return storage; }
        public String getNode() { return node; }
        public String getType() { return type; }
        public String getContent() { return content; }
        public boolean isActive() { return active; }
        public long getUsedBytes() { return usedBytes; }
        public long getTotalBytes() { return totalBytes; }
        public long getAvailableBytes() { return availableBytes; }

        @Override
        public String toString() {
            return "StorageInfo{storage='" + storage + "', node='" + node + "', type='" + type + "'}";
        }
    }

    /**
     * Data class representing cluster-wide status.
     */
    public static class ClusterStatusInfo {
        private final String name;
        private final boolean quorate;
        private final List<ClusterMemberInfo> nodes;

        public ClusterStatusInfo(String name, boolean quorate, List<ClusterMemberInfo> nodes) {
            this.name = name;
            this.quorate = quorate;
            this.nodes = nodes;
        }

        public String getName() { return name; }
        public boolean isQuorate() { return quorate; }
        public List<ClusterMemberInfo> getNodes() { return nodes; }
    }

    public static class ClusterMemberInfo {
        private final String name;
        private final boolean online;
        private final String ip;
        private final boolean local;

        public ClusterMemberInfo(String name, boolean online, String ip, boolean local) {
            this.name = name;
            this.online = online;
            this.ip = ip;
            this.local = local;
        }

        public String getName() { return name; }
        public boolean isOnline() { return online; }
        public String getIp() { return ip; }
        public boolean isLocal() { return local; }
    }
}
