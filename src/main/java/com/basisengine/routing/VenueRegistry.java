package com.basisengine.routing;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.domain.enums.VenueType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Venue definitions as configured under {@code basisengine.venues.*}.
 * Read-only after startup.
 */
@Component
public class VenueRegistry {

    private final Map<String, ExecutionProperties.Venue> venues;

    public VenueRegistry(ExecutionProperties executionProperties) {
        this.venues = Collections.unmodifiableMap(new LinkedHashMap<>(executionProperties.getVenues()));
    }

    public Optional<ExecutionProperties.Venue> find(String venueName) {
        return Optional.ofNullable(venueName).map(venues::get);
    }

    public boolean isKnown(String venueName) {
        return find(venueName).isPresent();
    }

    public boolean isEnabled(String venueName) {
        return find(venueName).map(ExecutionProperties.Venue::isEnabled).orElse(false);
    }

    public Optional<VenueType> typeOf(String venueName) {
        return find(venueName).map(ExecutionProperties.Venue::getType);
    }

    public Optional<String> depositAddress(String venueName) {
        return find(venueName).map(ExecutionProperties.Venue::getDepositAddress);
    }

    public List<String> enabledVenues() {
        return venues.entrySet().stream()
                .filter(e -> e.getValue().isEnabled())
                .map(Map.Entry::getKey)
                .toList();
    }

    public Map<String, ExecutionProperties.Venue> all() {
        return venues;
    }
}
