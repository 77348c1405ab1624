package com.vidnyan.aro.adapter.out.check;

import com.vidnyan.aro.domain.ast.*;

import java.util.List;

/**
 * Decides whether a statement always ends its feature set.
 */
final class Terminality {

    private Terminality() {
    }

    /**
     * An unguarded Return or Throw, a pipeline ending in one, or a match with an otherwise clause
     * whose every branch ends. Loops never count: the body may run zero times.
     */
    static boolean isTerminal(Statement statement) {
        if (statement instanceof AroStatement aro) {
            return aro.isTerminal();
        }
        if (statement instanceof PipelineStatement pipeline) {
            List<AroStatement> stages = pipeline.stages();
            return !stages.isEmpty() && stages.get(stages.size() - 1).isTerminal();
        }
        if (statement instanceof MatchStatement match) {
            if (!match.hasOtherwise() || !endsBlock(match.otherwise())) {
                return false;
            }
            return match.cases().stream().allMatch(c -> endsBlock(c.body()));
        }
        return false;
    }

    /**
     * The last statement of the list must be terminal.
     */
    static boolean endsBlock(List<Statement> statements) {
        return !statements.isEmpty() && isTerminal(statements.get(statements.size() - 1));
    }

    /**
     * Verb shown in messages about the statement.
     */
    static String verbOf(Statement statement) {
        if (statement instanceof AroStatement aro) {
            return aro.action().verb();
        }
        if (statement instanceof PipelineStatement pipeline && !pipeline.stages().isEmpty()) {
            return pipeline.stages().get(pipeline.stages().size() - 1).action().verb();
        }
        return "match";
    }
}
