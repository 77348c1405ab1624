package com.vidnyan.aro.domain.ast;

/**
 * Pattern of a match case.
 */
public interface Pattern {

    String describe();

    record Literal(LiteralValue value) implements Pattern {
        @Override
        public String describe() {
            return value.render();
        }
    }

    record Regex(String pattern, String flags) implements Pattern {
        @Override
        public String describe() {
            return "/" + pattern + "/" + flags;
        }
    }

    record Variable(QualifiedNoun noun) implements Pattern {
        @Override
        public String describe() {
            return "<" + noun.fullName() + ">";
        }
    }
}
