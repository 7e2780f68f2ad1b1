package com.vigil.monitoring.agent;

import java.util.List;
import java.util.Optional;

/**
 * Source of tenant configuration.
 */
public interface DestinationDirectory {

    List<Destination> getActiveDestinations();

    /**
     * Looks a destination up by id or code.
     */
    Optional<Destination> getDestinationById(String id);
}
