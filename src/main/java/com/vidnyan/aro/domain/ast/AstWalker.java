package com.vidnyan.aro.domain.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Traversal helpers over statements and expressions.
 * Statements are visited pre-order, left to right: a block statement is reported before its
 * nested bodies, match cases in source order and then the otherwise clause.
 */
public final class AstWalker {

    private AstWalker() {
    }

    public static void walk(List<Statement> statements, Consumer<Statement> action) {
        for (Statement statement : statements) {
            walk(statement, action);
        }
    }

    public static void walk(Statement statement, Consumer<Statement> action) {
        action.accept(statement);
        if (statement instanceof MatchStatement match) {
            for (CaseClause clause : match.cases()) {
                walk(clause.body(), action);
            }
            if (match.hasOtherwise()) {
                walk(match.otherwise(), action);
            }
        } else if (statement instanceof ForEachLoop loop) {
            walk(loop.body(), action);
        } else if (statement instanceof PipelineStatement pipeline) {
            for (AroStatement stage : pipeline.stages()) {
                action.accept(stage);
            }
        }
    }

    /**
     * Every ARO statement reachable from the list, in traversal order.
     */
    public static List<AroStatement> aroStatements(List<Statement> statements) {
        List<AroStatement> found = new ArrayList<>();
        walk(statements, s -> {
            if (s instanceof AroStatement aro) {
                found.add(aro);
            }
        });
        return found;
    }

    /**
     * Event types emitted anywhere in the list, in traversal order, with duplicates.
     */
    public static List<String> emittedEvents(List<Statement> statements) {
        List<String> events = new ArrayList<>();
        for (AroStatement aro : aroStatements(statements)) {
            String type = aro.emittedEventType();
            if (type != null) {
                events.add(type);
            }
        }
        return events;
    }

    /**
     * Variable references inside an expression, left to right. Null-safe.
     */
    public static List<Expression.VariableRef> variableRefs(Expression expression) {
        List<Expression.VariableRef> refs = new ArrayList<>();
        if (expression != null) {
            collect(expression, refs);
        }
        return refs;
    }

    private static void collect(Expression expression, List<Expression.VariableRef> refs) {
        if (expression instanceof Expression.VariableRef ref) {
            refs.add(ref);
        } else if (expression instanceof Expression.Binary binary) {
            collect(binary.left(), refs);
            collect(binary.right(), refs);
        } else if (expression instanceof Expression.Unary unary) {
            collect(unary.operand(), refs);
        } else if (expression instanceof Expression.MemberAccess access) {
            collect(access.base(), refs);
        } else if (expression instanceof Expression.Subscript subscript) {
            collect(subscript.base(), refs);
            collect(subscript.index(), refs);
        } else if (expression instanceof Expression.Grouped grouped) {
            collect(grouped.inner(), refs);
        } else if (expression instanceof Expression.Existence existence) {
            collect(existence.operand(), refs);
        } else if (expression instanceof Expression.TypeCheck check) {
            collect(check.operand(), refs);
        } else if (expression instanceof Expression.ArrayLiteral array) {
            array.elements().forEach(e -> collect(e, refs));
        } else if (expression instanceof Expression.MapLiteral map) {
            map.entries().forEach(e -> collect(e.value(), refs));
        } else if (expression instanceof Expression.InterpolatedString string) {
            string.parts().forEach(e -> collect(e, refs));
        }
    }
}
