package me.internalizable.authgate.controller;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the caller's address from proxy headers, falling back to the socket.
 */
public final class ClientAddresses {

    private ClientAddresses() {
    }

    public static String of(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        return request.getRemoteAddr();
    }
}
