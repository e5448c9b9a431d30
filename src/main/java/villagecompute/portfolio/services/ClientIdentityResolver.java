/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.portfolio.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the client identity used to key rate limiting and audit records.
 *
 * <p>
 * <b>Resolution Order:</b>
 * <ol>
 * <li>First address of {@code X-Forwarded-For} (leftmost hop is the original client)</li>
 * <li>{@code X-Real-IP}</li>
 * <li>Transport-level peer address</li>
 * <li>{@link #LOOPBACK} when nothing is available</li>
 * </ol>
 *
 * <p>
 * Header authenticity is not checked. The deployment is expected to terminate proxying and strip or overwrite these
 * headers before they reach the application.
 */
@ApplicationScoped
public class ClientIdentityResolver {

    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    public static final String REAL_IP_HEADER = "X-Real-IP";

    public static final String LOOPBACK = "127.0.0.1";

    /**
     * Resolves the client identity from request headers and the peer address.
     *
     * @param headers
     *            request headers
     * @param peerAddress
     *            transport-level remote address (nullable)
     * @return client identity, never null
     */
    public String resolve(HttpHeaders headers, String peerAddress) {
        return resolve(headers.getHeaderString(FORWARDED_FOR_HEADER), headers.getHeaderString(REAL_IP_HEADER),
                peerAddress);
    }

    /**
     * Resolves the client identity from raw header values.
     *
     * @param forwardedFor
     *            comma-separated proxy chain (nullable)
     * @param realIp
     *            single real-IP header value (nullable)
     * @param peerAddress
     *            transport-level remote address (nullable)
     * @return client identity, never null
     */
    public String resolve(String forwardedFor, String realIp, String peerAddress) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            int commaIndex = forwardedFor.indexOf(',');
            String first = commaIndex >= 0 ? forwardedFor.substring(0, commaIndex).trim() : forwardedFor.trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        if (peerAddress != null && !peerAddress.isBlank()) {
            return peerAddress.trim();
        }

        return LOOPBACK;
    }

    /**
     * Short fingerprint of identity and user agent for log correlation.
     *
     * @param identity
     *            resolved client identity
     * @param userAgent
     *            declared user agent (nullable)
     * @return first 16 hex characters of SHA-256("identity:userAgent")
     */
    public String fingerprint(String identity, String userAgent) {
        String data = identity + ":" + (userAgent != null ? userAgent : "");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
