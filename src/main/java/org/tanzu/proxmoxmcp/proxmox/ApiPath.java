package org.tanzu.proxmoxmcp.proxmox;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Builds Proxmox API paths from segments, percent-encoding each one.
 *
 * Volume ids ("local:iso/debian.iso") and UPIDs contain characters that must
 * not be read as path separators, so segments are always encoded individually.
 */
public final class ApiPath {

    private ApiPath() {
    }

    /**
     * @param segments path segments; non-string values are converted with {@code String.valueOf}
     * @return an encoded path such as "/nodes/pve/qemu/200/status/start"
     */
    public static String of(Object... segments) {
        StringBuilder path = new StringBuilder();
        for (Object segment : segments) {
            path.append('/').append(UriUtils.encodePathSegment(String.valueOf(segment), StandardCharsets.UTF_8));
        }
        return path.toString();
    }
}
