package com.vigil.monitoring.smoke;

import java.util.List;
import java.util.Map;

/**
 * Passive check of the environment variables a paid alert channel needs. Nothing is sent.
 *
 * @param channel         channel name
 * @param status          CONFIGURED when every variable is present
 * @param maskedPrefixes  short prefixes of non-secret identifiers, only when configured
 * @param missing         names of absent variables
 */
public record ChannelConfigCheck(String channel, Status status, Map<String, String> maskedPrefixes,
                                 List<String> missing) {

    public enum Status {
        CONFIGURED,
        NOT_CONFIGURED
    }

    public ChannelConfigCheck {
        maskedPrefixes = maskedPrefixes != null ? Map.copyOf(maskedPrefixes) : Map.of();
        missing = missing != null ? List.copyOf(missing) : List.of();
    }
}
