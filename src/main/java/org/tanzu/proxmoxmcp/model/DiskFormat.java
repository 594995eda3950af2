package org.tanzu.proxmoxmcp.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Disk image formats this server creates.
 */
public enum DiskFormat {
    RAW,
    QCOW2;

    /** Value used in Proxmox disk strings ("format=qcow2") and in outcome payloads. */
    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the format for a token such as "raw" or "qcow2", or null when the token is unknown
     */
    public static DiskFormat fromToken(String token) {
        if (token == null) {
            return null;
        }
        for (DiskFormat format : values()) {
            if (format.token().equalsIgnoreCase(token.trim())) {
                return format;
            }
        }
        return null;
    }
}
