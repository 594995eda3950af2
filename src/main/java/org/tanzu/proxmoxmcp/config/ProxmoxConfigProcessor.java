package org.tanzu.proxmoxmcp.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fills incomplete Proxmox connection settings from a JSON configuration file.
 * 
 * After the context binds {@link ProxmoxConfig}, this component checks that host,
 * user and token are present. When any of them is missing (or still an unresolved
 * ${...} placeholder), it reads the file named by the PROXMOX_MCP_CONFIG
 * environment variable, which has the layout:
 * 
 * <pre>
 * {
 *   "proxmox": { "host": "pve.local", "port": 8006, "verify_ssl": false, "service": "PVE" },
 *   "auth":    { "user": "root@pam", "token_name": "mcp", "token_value": "..." }
 * }
 * </pre>
 * 
 * Configuration priority (highest to lowest):
 * 1. Environment variables / application.properties
 * 2. PROXMOX_MCP_CONFIG file, for values still missing
 * 3. Default values
 */
@Component
public class ProxmoxConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ProxmoxConfigProcessor.class);

    static final String CONFIG_PATH_VARIABLE = "PROXMOX_MCP_CONFIG";

    private final ProxmoxConfig proxmoxConfig;

    private final Environment environment;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ProxmoxConfigProcessor(ProxmoxConfig proxmoxConfig, Environment environment) {
        this.proxmoxConfig = proxmoxConfig;
        this.environment = environment;
    }

    /**
     * Completes the configuration from the PROXMOX_MCP_CONFIG file when needed.
     * 
     * A missing or unreadable file is logged rather than thrown: the server still
     * starts, and tool calls report the connection failure.
     */
    @PostConstruct
    public void processConfigFile() {
        logger.info("Processing Proxmox configuration...");
        logger.info("Current config - Host: '{}', User: '{}', Token: '{}'",
                   proxmoxConfig.getHost(),
                   proxmoxConfig.getUser(),
                   proxmoxConfig.getTokenValue() != null ? "***" : "null");

        if (isConfigurationComplete()) {
            logger.info("Proxmox configuration is complete from environment variables");
            return;
        }

        String configPath = environment.getProperty(CONFIG_PATH_VARIABLE);
        if (configPath == null || configPath.isBlank()) {
            logger.warn("{} not set and configuration incomplete", CONFIG_PATH_VARIABLE);
            return;
        }

        Path path = Path.of(configPath);
        if (!Files.isReadable(path)) {
            logger.warn("Configuration file {} does not exist or is not readable", path);
            return;
        }

        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            updateConfigurationFromFile(root);
            logger.info("Proxmox configuration updated from {}", path);
            logger.info("Final config - {}", proxmoxConfig);
        } catch (IOException e) {
            logger.error("Invalid JSON in config file {}: {}", path, e.getMessage(), e);
        }
    }

    /**
     * A configuration is complete when host, user, token name and token value are
     * all set, non-blank and not placeholders.
     */
    boolean isConfigurationComplete() {
        boolean complete = isSet(proxmoxConfig.getHost())
                && isSet(proxmoxConfig.getUser())
                && isSet(proxmoxConfig.getTokenName())
                && isSet(proxmoxConfig.getTokenValue());
        logger.debug("Configuration complete: {}", complete);
        return complete;
    }

    private void updateConfigurationFromFile(JsonNode root) {
        JsonNode proxmox = root.path("proxmox");
        JsonNode auth = root.path("auth");

        if (!isSet(proxmoxConfig.getHost()) && proxmox.hasNonNull("host")) {
            proxmoxConfig.setHost(proxmox.get("host").asText());
            logger.info("Set host from config file: {}", proxmoxConfig.getHost());
        }

        // Only override the port while it is still the default
        if (proxmoxConfig.getPort() == 8006 && proxmox.has("port")) {
            proxmoxConfig.setPort(proxmox.path("port").asInt(8006));
            logger.info("Set port from config file: {}", proxmoxConfig.getPort());
        }

        if (proxmox.has("verify_ssl")) {
            proxmoxConfig.setVerifySsl(proxmox.path("verify_ssl").asBoolean(false));
            logger.info("Set verify_ssl from config file: {}", proxmoxConfig.isVerifySsl());
        }

        if (proxmox.hasNonNull("service")) {
            proxmoxConfig.setService(proxmox.get("service").asText());
        }

        if (!isSet(proxmoxConfig.getUser()) && auth.hasNonNull("user")) {
            proxmoxConfig.setUser(auth.get("user").asText());
            logger.info("Set user from config file: {}", proxmoxConfig.getUser());
        }

        if (!isSet(proxmoxConfig.getTokenName()) && auth.hasNonNull("token_name")) {
            proxmoxConfig.setTokenName(auth.get("token_name").asText());
            logger.info("Set token name from config file: {}", proxmoxConfig.getTokenName());
        }

        if (!isSet(proxmoxConfig.getTokenValue()) && auth.hasNonNull("token_value")) {
            proxmoxConfig.setTokenValue(auth.get("token_value").asText());
            logger.info("Set token value from config file: ***");
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }
}
