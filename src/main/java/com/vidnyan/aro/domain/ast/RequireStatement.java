package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

/**
 * {@code Require the <name> from the <framework|environment|Feature Set Name>.}
 */
public record RequireStatement(
    String variableName,
    Source source,
    SourceSpan span
) implements Statement {

    /**
     * Where a required value comes from.
     */
    public record Source(Kind kind, String featureSetName) {

        public enum Kind {
            FRAMEWORK,
            ENVIRONMENT,
            FEATURE_SET
        }

        public static Source resolve(String name) {
            if ("framework".equalsIgnoreCase(name)) {
                return new Source(Kind.FRAMEWORK, null);
            }
            if ("environment".equalsIgnoreCase(name)) {
                return new Source(Kind.ENVIRONMENT, null);
            }
            return new Source(Kind.FEATURE_SET, name);
        }

        public String describe() {
            return kind == Kind.FEATURE_SET ? featureSetName : kind.name().toLowerCase();
        }
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRequire(this);
    }
}
