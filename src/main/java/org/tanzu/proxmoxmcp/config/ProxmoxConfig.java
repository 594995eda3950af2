package org.tanzu.proxmoxmcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class for Proxmox VE connection settings.
 * 
 * Properties are bound with the "proxmox" prefix from application.properties or
 * environment variables (PROXMOX_HOST, PROXMOX_USER, PROXMOX_TOKEN_NAME, ...).
 * Values still missing after binding are filled by {@link ProxmoxConfigProcessor}
 * from the JSON file named by PROXMOX_MCP_CONFIG.
 * 
 * Authentication uses a Proxmox API token, sent as
 * {@code Authorization: PVEAPIToken=<user>!<token-name>=<token-value>}.
 */
@Component
@ConfigurationProperties(prefix = "proxmox")
public class ProxmoxConfig {

    public static final int DEFAULT_MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    /** Proxmox VE host name or IP address */
    private String host;
    
    /** API port (default: 8006) */
    private int port = 8006;
    
    /** User owning the API token, e.g. "root@pam" */
    private String user;
    
    /** API token id */
    private String tokenName;
    
    /** API token secret */
    private String tokenValue;
    
    /** Whether to validate the server certificate (default: false, Proxmox ships self-signed certificates) */
    private boolean verifySsl = false;
    
    /** Proxmox service type (default: PVE) */
    private String service = "PVE";

    /** Largest response body read into memory (default: 16 MiB, storage content listings grow large) */
    private int maxResponseBytes = DEFAULT_MAX_RESPONSE_BYTES;

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getTokenName() { return tokenName; }
    public void setTokenName(String tokenName) { this.tokenName = tokenName; }

    public String getTokenValue() { return tokenValue; }
    public void setTokenValue(String tokenValue) { this.tokenValue = tokenValue; }

    public boolean isVerifySsl() { return verifySsl; }
    public void setVerifySsl(boolean verifySsl) { this.verifySsl = verifySsl; }

    public String getService() { return service; }
    public void setService(String service) { this.service = service; }

    public int getMaxResponseBytes() { return maxResponseBytes; }
    public void setMaxResponseBytes(int maxResponseBytes) { this.maxResponseBytes = maxResponseBytes; }

    /**
     * Base URL of the JSON API, e.g. https://pve.example.com:8006/api2/json
     */
    public String getApiUrl() {
        return "https://" + host + ":" + port + "/api2/json";
    }

    /**
     * Value of the Authorization header for token authentication.
     */
    public String getTokenHeader() {
        return "PVEAPIToken=" + user + "!" + tokenName + "=" + tokenValue;
    }

    /**
     * Returns a string representation of the configuration with the token secret hidden.
     */
    @Override
    public String toString() {
        return "ProxmoxConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", user='" + user + '\'' +
                ", tokenName='" + tokenName + '\'' +
                ", tokenValue='[HIDDEN]'" +
                ", verifySsl=" + verifySsl +
                ", service='" + service + '\'' +
                ", maxResponseBytes=" + maxResponseBytes +
                '}';
    }
}
