package com.wpanther.documentsigning.util;

import org.springframework.http.HttpHeaders;

import com.wpanther.documentsigning.model.HttpProvenance;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Extracts the client provenance recorded in proof records.
 */
public final class HttpProvenanceResolver {

    private HttpProvenanceResolver() {
    }

    public static HttpProvenance resolve(HttpServletRequest request) {
        return HttpProvenance.builder()
                .ipAddress(clientIp(request))
                .userAgent(request.getHeader(HttpHeaders.USER_AGENT))
                .referer(request.getHeader(HttpHeaders.REFERER))
                .build();
    }

    /**
     * First hop of X-Forwarded-For, then X-Real-IP, then the socket address.
     */
    public static String clientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            String first = xForwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null ? remoteAddr : HttpProvenance.UNKNOWN_ADDRESS;
    }
}
