package com.vidnyan.aro.domain.check;

import com.vidnyan.aro.domain.ast.Program;
import com.vidnyan.aro.domain.graph.EventGraph;

/**
 * Context provided to program checks.
 */
public record CheckContext(
    Program program,
    EventGraph eventGraph
) {

    /**
     * Create context.
     */
    public static CheckContext of(Program program, EventGraph eventGraph) {
        return new CheckContext(program, eventGraph);
    }
}
