package com.vigil.healthmonitor.infrastructure.destination;

import com.vigil.healthmonitor.config.VigilProperties.DestinationEntry;
import com.vigil.monitoring.agent.Destination;
import com.vigil.monitoring.agent.DestinationDirectory;
import java.util.List;
import java.util.Optional;

/**
 * Destinations declared under {@code vigil.destinations}. Lookups match the id exactly or the
 * code case-insensitively, and also find inactive destinations.
 */
public class ConfiguredDestinationDirectory implements DestinationDirectory {

    private final List<DestinationEntry> entries;

    public ConfiguredDestinationDirectory(List<DestinationEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    @Override
    public List<Destination> getActiveDestinations() {
        return entries.stream().filter(DestinationEntry::active).map(ConfiguredDestinationDirectory::toDestination)
                .toList();
    }

    @Override
    public Optional<Destination> getDestinationById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return entries.stream()
                .filter(entry -> entry.id().equals(id) || entry.code().equalsIgnoreCase(id))
                .findFirst()
                .map(ConfiguredDestinationDirectory::toDestination);
    }

    private static Destination toDestination(DestinationEntry entry) {
        return new Destination(entry.id(), entry.code(), entry.name(), entry.domain());
    }
}
