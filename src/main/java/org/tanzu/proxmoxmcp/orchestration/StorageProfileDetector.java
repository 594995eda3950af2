package org.tanzu.proxmoxmcp.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.proxmoxmcp.model.BackendClass;
import org.tanzu.proxmoxmcp.model.ErrorKind;
import org.tanzu.proxmoxmcp.model.OperationException;
import org.tanzu.proxmoxmcp.model.StorageProfile;
import org.tanzu.proxmoxmcp.proxmox.ProxmoxBackend;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Derives the disk format and capabilities of a storage pool from its backend type.
 * 
 * Block backends (lvm, lvmthin, zfs, rbd, iscsi) hold raw volumes only; file
 * backends (dir, nfs, cifs, btrfs, glusterfs, cephfs) hold qcow2 images and a
 * cloud-init drive. Unknown types are treated as file storage with a warning,
 * because new storage plugins should not block VM creation.
 */
@Component
public class StorageProfileDetector {

    private static final Logger logger = LoggerFactory.getLogger(StorageProfileDetector.class);

    private static final Set<String> BLOCK_TYPES = Set.of(
            "lvm", "lvmthin", "zfs-block", "zfspool", "rbd", "iscsi", "iscsidirect");

    private static final Set<String> FILE_TYPES = Set.of(
            "dir", "nfs", "cifs", "btrfs", "glusterfs", "cephfs");

    private final ProxmoxBackend backend;

    public StorageProfileDetector(ProxmoxBackend backend) {
        this.backend = backend;
    }

    /**
     * Reads the pool definition from the node and classifies it.
     * 
     * @param node node the pool must be available on
     * @param poolName storage id, e.g. "local-lvm"
     * @return the pool's profile
     * @throws OperationException NOT_FOUND if the node does not list the pool
     */
    public StorageProfile detect(String node, String poolName) {
        for (JsonNode storage : backend.listStorage(node)) {
            if (poolName.equals(storage.path("storage").asText())) {
                StorageProfile profile = classify(poolName, storage.path("type").asText(""));
                logger.info("Storage '{}' on {}: {}", poolName, node, profile);
                return profile;
            }
        }
        throw new OperationException(ErrorKind.NOT_FOUND, "Storage '" + poolName + "' not found on node '" + node + "'");
    }

    /**
     * Picks a pool for new guest disks when the caller did not name one.
     * 
     * @param node node to create the guest on
     * @param contentType "images" for VM disks, "rootdir" for container root filesystems
     * @return the first active, enabled pool whose content list includes the type
     * @throws OperationException NOT_FOUND if no pool on the node qualifies
     */
    public StorageProfile autoSelect(String node, String contentType) {
        for (JsonNode storage : backend.listStorage(node)) {
            boolean active = storage.path("active").asInt(1) == 1 && storage.path("enabled").asInt(1) == 1;
            if (active && hasContent(storage.path("content").asText(""), contentType)) {
                String poolName = storage.path("storage").asText();
                StorageProfile profile = classify(poolName, storage.path("type").asText(""));
                logger.info("Auto-selected storage '{}' on {} for {}: {}", poolName, node, contentType, profile);
                return profile;
            }
        }
        throw new OperationException(ErrorKind.NOT_FOUND,
                "No active storage on node '" + node + "' accepts content '" + contentType + "'");
    }

    /**
     * Maps a backend type token to a profile. Package-private for tests.
     */
    StorageProfile classify(String poolName, String backendType) {
        String token = backendType.toLowerCase(Locale.ROOT).trim();
        if (BLOCK_TYPES.contains(token)) {
            return new StorageProfile(poolName, token, BackendClass.BLOCK_BASED, false, true);
        }
        if (!FILE_TYPES.contains(token)) {
            logger.warn("Unknown storage type '{}' for pool '{}', assuming file-based storage with qcow2", backendType, poolName);
        }
        return new StorageProfile(poolName, token, BackendClass.FILE_BASED, true, true);
    }

    static boolean hasContent(String contentList, String contentType) {
        return Arrays.stream(contentList.split(","))
                .map(String::trim)
                .anyMatch(contentType::equals);
    }
}
