package com.vigil.monitoring.testing;

import com.vigil.monitoring.agent.Destination;
import com.vigil.monitoring.agent.DestinationDirectory;

import java.util.List;
import java.util.Optional;

/**
 * {@link DestinationDirectory} over a fixed list.
 */
public final class StaticDestinationDirectory implements DestinationDirectory {

    private final List<Destination> destinations;

    public StaticDestinationDirectory(List<Destination> destinations) {
        this.destinations = List.copyOf(destinations);
    }

    public static StaticDestinationDirectory of(Destination... destinations) {
        return new StaticDestinationDirectory(List.of(destinations));
    }

    @Override
    public List<Destination> getActiveDestinations() {
        return destinations;
    }

    @Override
    public Optional<Destination> getDestinationById(String id) {
        return destinations.stream()
                .filter(destination -> destination.id().equals(id) || destination.code().equalsIgnoreCase(id))
                .findFirst();
    }
}
