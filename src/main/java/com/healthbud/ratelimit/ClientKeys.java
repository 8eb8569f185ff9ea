package com.healthbud.ratelimit;

/**
 * Derives the per-client rate limit key.
 */
public final class ClientKeys {

    public static final String UNKNOWN = "unknown";

    private ClientKeys() {
    }

    /**
     * First hop of the forwarded-for chain, else the direct peer, else {@value #UNKNOWN}.
     */
    public static String resolve(String forwardedFor, String peerAddress) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (peerAddress != null && !peerAddress.isBlank()) {
            return peerAddress.trim();
        }
        return UNKNOWN;
    }
}
