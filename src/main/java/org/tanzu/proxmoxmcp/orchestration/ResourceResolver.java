package org.tanzu.proxmoxmcp.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.proxmoxmcp.model.ErrorKind;
import org.tanzu.proxmoxmcp.model.OperationError;
import org.tanzu.proxmoxmcp.model.OperationException;
import org.tanzu.proxmoxmcp.model.ResourceKind;
import org.tanzu.proxmoxmcp.model.ResourceRef;
import org.tanzu.proxmoxmcp.proxmox.ProxmoxBackend;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves caller selectors to concrete guests by querying live cluster inventory.
 * 
 * Accepted selector forms:
 * - "200"        bare vmid, anywhere in the cluster
 * - "pve1:200"   vmid on a given node
 * - "pve1/web"   name (or container hostname) on a given node
 * - "web"        name (or container hostname) anywhere in the cluster
 * 
 * Names are matched exactly and case-sensitively. When more than one guest
 * matches, resolution fails with AMBIGUOUS and lists every candidate; the
 * resolver never picks one. Inventory is re-read on every call.
 */
@Component
public class ResourceResolver {

    private static final Logger logger = LoggerFactory.getLogger(ResourceResolver.class);

    private final ProxmoxBackend backend;

    public ResourceResolver(ProxmoxBackend backend) {
        this.backend = backend;
    }

    /**
     * Resolves one selector.
     * 
     * @param selector selector in one of the accepted forms
     * @param expectedKind kind the caller requires, or null for either
     * @return the single matching guest
     * @throws OperationException VALIDATION for a malformed selector, NOT_FOUND, AMBIGUOUS or KIND_MISMATCH
     */
    public ResourceRef resolve(String selector, ResourceKind expectedKind) {
        Selector parsed = Selector.parse(selector);
        List<Entry> inventory = inventory(parsed.node);

        List<ResourceRef> matches = new ArrayList<>();
        for (Entry entry : inventory) {
            if (parsed.matches(entry)) {
                matches.add(entry.ref);
            }
        }

        if (matches.isEmpty()) {
            String where = parsed.node != null ? " on node '" + parsed.node + "'" : "";
            throw new OperationException(ErrorKind.NOT_FOUND, "No VM or container matches '" + selector.trim() + "'" + where);
        }
        if (matches.size() > 1) {
            logger.warn("Selector '{}' is ambiguous: {}", selector, matches);
            throw new OperationException(OperationError.ambiguous(selector.trim(), matches));
        }

        ResourceRef ref = matches.get(0);
        if (expectedKind != null && ref.getKind() != expectedKind) {
            throw new OperationException(ErrorKind.KIND_MISMATCH,
                    "'" + selector.trim() + "' is " + ref.describe() + ", not a " + expectedKind.getLabel());
        }
        logger.debug("Resolved '{}' to {}", selector, ref);
        return ref;
    }

    /**
     * Resolves a comma-separated list of selectors, each with {@link #resolve}.
     * Duplicates (the same guest named twice) are returned once.
     */
    public List<ResourceRef> resolveAll(String selectors, ResourceKind expectedKind) {
        if (selectors == null || selectors.isBlank()) {
            throw new OperationException(ErrorKind.VALIDATION, "selector is required");
        }
        Set<ResourceRef> resolved = new LinkedHashSet<>();
        for (String token : selectors.split(",")) {
            if (!token.isBlank()) {
                resolved.add(resolve(token, expectedKind));
            }
        }
        return new ArrayList<>(resolved);
    }

    /**
     * Whether any guest in the cluster already uses the vmid.
     */
    public boolean isInUse(int vmid) {
        try {
            resolve(String.valueOf(vmid), null);
            return true;
        } catch (OperationException e) {
            if (e.getKind() == ErrorKind.NOT_FOUND) {
                return false;
            }
            // duplicate ids are impossible in a healthy cluster, but they are certainly in use
            if (e.getKind() == ErrorKind.AMBIGUOUS) {
                return true;
            }
            throw e;
        }
    }

    /**
     * Lists every guest on online nodes, optionally restricted to one node.
     */
    public List<ResourceRef> listAll(String node) {
        List<ResourceRef> refs = new ArrayList<>();
        for (Entry entry : inventory(node)) {
            refs.add(entry.ref);
        }
        return refs;
    }

    private List<Entry> inventory(String onlyNode) {
        List<Entry> entries = new ArrayList<>();
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
            for (ResourceKind kind : ResourceKind.values()) {
                for (JsonNode guest : backend.listResources(nodeName, kind)) {
                    int vmid = guest.path("vmid").asInt(-1);
                    if (vmid < 0) {
                        continue;
                    }
                    String name = guest.path("name").asText(null);
                    String hostname = guest.path("hostname").asText(null);
                    entries.add(new Entry(new ResourceRef(nodeName, kind, vmid, name != null ? name : hostname), hostname));
                }
            }
        }
        if (onlyNode != null && !nodeSeen) {
            throw new OperationException(ErrorKind.NOT_FOUND, "Node '" + onlyNode + "' not found");
        }
        return entries;
    }

    private static final class Entry {
        private final ResourceRef ref;
        private final String hostname;

        private Entry(ResourceRef ref, String hostname) {
            this.ref = ref;
            this.hostname = hostname;
        }
    }

    /**
     * A parsed selector. Exactly one of {@code vmid} and {@code name} is set.
     */
    private static final class Selector {
        private final String node;
        private final Integer vmid;
        private final String name;

        private Selector(String node, Integer vmid, String name) {
            this.node = node;
            this.vmid = vmid;
            this.name = name;
        }

        static Selector parse(String raw) {
            if (raw == null || raw.isBlank()) {
                throw new OperationException(ErrorKind.VALIDATION, "selector is required");
            }
            String selector = raw.trim();
            boolean hasColon = selector.contains(":");
            boolean hasSlash = selector.contains("/");

            if (hasColon && hasSlash) {
                throw new OperationException(ErrorKind.VALIDATION, "Unrecognized selector '" + selector + "'");
            }
            if (hasColon) {
                String[] parts = selector.split(":", 2);
                return new Selector(requireNode(parts[0], selector), parseVmid(parts[1], selector), null);
            }
            if (hasSlash) {
                String[] parts = selector.split("/", 2);
                String name = parts[1].trim();
                if (name.isEmpty()) {
                    throw new OperationException(ErrorKind.VALIDATION, "Selector '" + selector + "' has no name");
                }
                return new Selector(requireNode(parts[0], selector), null, name);
            }
            if (selector.chars().allMatch(Character::isDigit)) {
                return new Selector(null, parseVmid(selector, selector), null);
            }
            return new Selector(null, null, selector);
        }

        private static String requireNode(String node, String selector) {
            if (node.isBlank()) {
                throw new OperationException(ErrorKind.VALIDATION, "Selector '" + selector + "' has no node");
            }
            return node.trim();
        }

        private static Integer parseVmid(String value, String selector) {
            try {
                return Integer.valueOf(value.trim());
            } catch (NumberFormatException e) {
                throw new OperationException(ErrorKind.VALIDATION, "Selector '" + selector + "' has an invalid vmid");
            }
        }

        boolean matches(Entry entry) {
            if (vmid != null) {
                return entry.ref.getVmid() == vmid;
            }
            return name.equals(entry.ref.getName()) || name.equals(entry.hostname);
        }
    }
}
