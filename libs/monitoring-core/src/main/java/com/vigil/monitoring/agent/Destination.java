package com.vigil.monitoring.agent;

/**
 * A tenant of the platform.
 *
 * @param id     numeric or opaque identifier used in API queries
 * @param code   short code sent as the destination header
 * @param name   display name
 * @param domain public front-end URL
 */
public record Destination(String id, String code, String name, String domain) {

    public Destination {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be null or blank");
        }
        name = name != null ? name : code;
    }
}
