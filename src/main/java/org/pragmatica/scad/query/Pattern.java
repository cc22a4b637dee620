package org.pragmatica.scad.query;

import java.util.List;
import java.util.Optional;

/**
 * Compiled structural query pattern.
 */
public sealed interface Pattern {
    String WILDCARD = "_";

    Optional<String> capture();

    /**
     * {@code (type child...)}. Type {@code _} matches any named node.
     */
    record NodePattern(String type, List<ChildPattern> children, Optional<String> capture) implements Pattern {
        public NodePattern {
            children = List.copyOf(children);
        }
    }

    /**
     * Child constraint, optionally restricted to a field.
     */
    record ChildPattern(Optional<String> field, Pattern pattern) {}

    /**
     * {@code [a b c]}: any one of the alternatives.
     */
    record Alternation(List<Pattern> alternatives, Optional<String> capture) implements Pattern {
        public Alternation {
            alternatives = List.copyOf(alternatives);
        }
    }

    /**
     * A pattern filtered by predicates over its captures.
     */
    record Guarded(Pattern pattern, List<Predicate> predicates) implements Pattern {
        public Guarded {
            predicates = List.copyOf(predicates);
        }

        @Override
        public Optional<String> capture() {
            return pattern.capture();
        }
    }

    /**
     * {@code (#eq? @capture "text")}, {@code (#eq? @a @b)} or {@code (#match? @capture "regex")}.
     *
     * @param regex compiled form of {@code argument}, present only for {@code MATCH}
     */
    record Predicate(Kind kind, String capture, String argument, boolean argumentIsCapture,
                     Optional<java.util.regex.Pattern> regex) {
        public enum Kind {
            EQ,
            NOT_EQ,
            MATCH
        }
    }
}
