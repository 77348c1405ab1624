package com.vidnyan.aro.domain.graph;

import com.vidnyan.aro.domain.ast.AstWalker;
import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.ast.Program;
import com.vidnyan.aro.domain.model.SourceLocation;

import java.util.*;
import java.util.function.Predicate;

/**
 * Event-level trigger graph.
 * There is an edge {@code A → B} when a handler of event {@code A} emits {@code B} anywhere in its body.
 * Used for circular event chain detection.
 */
public final class EventGraph {

    private final Map<String, Set<String>> edges;          // event → events its handlers emit
    private final Map<String, List<FeatureSet>> handlers;  // event → handlers acting as sources
    private final Set<String> events;

    private EventGraph(
            Map<String, Set<String>> edges,
            Map<String, List<FeatureSet>> handlers,
            Set<String> events
    ) {
        this.edges = Collections.unmodifiableMap(edges);
        this.handlers = Collections.unmodifiableMap(handlers);
        this.events = Collections.unmodifiableSet(events);
    }

    public static EventGraph empty() {
        return new EventGraph(new TreeMap<>(), new TreeMap<>(), new TreeSet<>());
    }

    /**
     * Build the graph from a program.
     *
     * @param externallyTriggered handlers started by the runtime rather than by an Emit; they are not edge sources
     */
    public static EventGraph build(Program program, Predicate<FeatureSet> externallyTriggered) {
        Map<String, Set<String>> edges = new TreeMap<>();
        Map<String, List<FeatureSet>> handlers = new TreeMap<>();
        Set<String> events = new TreeSet<>();

        for (FeatureSet featureSet : program.featureSets()) {
            String handled = featureSet.handledEventType();
            if (handled == null || externallyTriggered.test(featureSet)) {
                continue;
            }
            events.add(handled);
            handlers.computeIfAbsent(handled, k -> new ArrayList<>()).add(featureSet);
            for (String emitted : AstWalker.emittedEvents(featureSet.statements())) {
                events.add(emitted);
                edges.computeIfAbsent(handled, k -> new TreeSet<>()).add(emitted);
            }
        }
        // Emits outside handlers still create sink nodes
        for (FeatureSet featureSet : program.featureSets()) {
            events.addAll(AstWalker.emittedEvents(featureSet.statements()));
        }
        return new EventGraph(edges, handlers, events);
    }

    public Set<String> events() {
        return events;
    }

    public Set<String> successors(String event) {
        return edges.getOrDefault(event, Set.of());
    }

    public List<FeatureSet> handlersOf(String event) {
        return handlers.getOrDefault(event, List.of());
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    /**
     * Every distinct simple cycle, self-loops included.
     * Each cycle is rooted at its smallest event name and listed with the root repeated at the end.
     * Output order is deterministic: by root, then by successor name.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        for (String start : events) {
            List<String> path = new ArrayList<>();
            path.add(start);
            Set<String> onPath = new HashSet<>();
            onPath.add(start);
            findCyclesFrom(start, start, path, onPath, cycles);
        }
        return cycles;
    }

    private void findCyclesFrom(
            String start,
            String current,
            List<String> path,
            Set<String> onPath,
            List<List<String>> cycles
    ) {
        for (String next : successors(current)) {
            if (next.equals(start)) {
                List<String> cycle = new ArrayList<>(path);
                cycle.add(start); // Complete the cycle
                cycles.add(cycle);
            } else if (next.compareTo(start) > 0 && !onPath.contains(next)) {
                path.add(next);
                onPath.add(next);
                findCyclesFrom(start, next, path, onPath, cycles);
                onPath.remove(next);
                path.remove(path.size() - 1);
            }
        }
    }

    /**
     * Cycles with the handlers that form them.
     */
    public List<EventCycle> cycles() {
        List<EventCycle> result = new ArrayList<>();
        for (List<String> cycle : findCycles()) {
            Set<String> featureSets = new LinkedHashSet<>();
            for (String event : cycle.subList(0, cycle.size() - 1)) {
                handlersOf(event).forEach(fs -> featureSets.add(fs.name()));
            }
            List<FeatureSet> firstHandlers = handlersOf(cycle.get(0));
            SourceLocation location = firstHandlers.isEmpty() ? null : firstHandlers.get(0).span().start();
            result.add(new EventCycle(cycle, new ArrayList<>(featureSets), location));
        }
        return result;
    }

    /**
     * True when {@code to} can be reached from {@code from} along one or more edges.
     */
    public boolean reaches(String from, String to) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(successors(from));
        while (!queue.isEmpty()) {
            String event = queue.poll();
            if (event.equals(to)) {
                return true;
            }
            if (visited.add(event)) {
                queue.addAll(successors(event));
            }
        }
        return false;
    }
}
