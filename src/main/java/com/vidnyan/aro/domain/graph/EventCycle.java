package com.vidnyan.aro.domain.graph;

import com.vidnyan.aro.domain.model.SourceLocation;

import java.util.List;

/**
 * A closed chain of events where each handler emits the next event.
 *
 * @param events      event types, first equals last
 * @param featureSets handlers on the chain, in chain order
 * @param location    where the first handler is declared
 */
public record EventCycle(
    List<String> events,
    List<String> featureSets,
    SourceLocation location
) {

    public EventCycle {
        events = List.copyOf(events);
        featureSets = List.copyOf(featureSets);
    }

    public boolean isSelfLoop() {
        return events.size() == 2;
    }

    /**
     * Format chain for display.
     */
    public String describe() {
        return String.join(" → ", events);
    }
}
