package com.deviceotp.domain;

import jakarta.annotation.Nullable;

/**
 * Where a request came from. Both parts are optional.
 */
public record Provenance(@Nullable String ipAddress, @Nullable String userAgent) {

    public static Provenance unknown() {
        return new Provenance(null, null);
    }

    public static Provenance fromHeaders(@Nullable String forwardedFor,
                                         @Nullable String realIp,
                                         @Nullable String userAgent) {
        String ip = null;
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            ip = forwardedFor.split(",", 2)[0].trim();
        } else if (realIp != null && !realIp.isBlank()) {
            ip = realIp.trim();
        }
        String agent = userAgent == null || userAgent.isBlank() ? null : userAgent.trim();
        return new Provenance(ip == null || ip.isEmpty() ? null : ip, agent);
    }
}
