package org.pragmatica.scad.error;

/**
 * Stable machine-readable codes carried by error nodes.
 */
public enum ErrorCode {
    MISSING_RANGE_START,
    MISSING_RANGE_END,
    INVALID_RANGE_STEP,
    E209_INVALID_SYNTAX_IN_RANGE_START,
    E210_INVALID_SYNTAX_IN_RANGE_STEP,
    E211_INVALID_SYNTAX_IN_RANGE_END,
    RANGE_START_PARSE_FAILURE,
    RANGE_STEP_PARSE_FAILURE,
    RANGE_END_PARSE_FAILURE,
    UNPARSABLE_RANGE_START_EXPRESSION,
    UNPARSABLE_RANGE_STEP_EXPRESSION,
    UNPARSABLE_RANGE_END_EXPRESSION,
    UNEXPECTED_NODE_TYPE,
    RESERVED_KEYWORD_AS_IDENTIFIER,
    MISSING_OPERAND,
    UNPARSABLE_EXPRESSION,
    INVALID_NUMBER,
    SYNTAX_ERROR,
    MISSING_CHILD_NODE;

    /**
     * Which bound of a range expression a failure refers to.
     */
    public enum RangeBound {
        START(MISSING_RANGE_START, E209_INVALID_SYNTAX_IN_RANGE_START,
              RANGE_START_PARSE_FAILURE, UNPARSABLE_RANGE_START_EXPRESSION),
        STEP(INVALID_RANGE_STEP, E210_INVALID_SYNTAX_IN_RANGE_STEP,
             RANGE_STEP_PARSE_FAILURE, UNPARSABLE_RANGE_STEP_EXPRESSION),
        END(MISSING_RANGE_END, E211_INVALID_SYNTAX_IN_RANGE_END,
            RANGE_END_PARSE_FAILURE, UNPARSABLE_RANGE_END_EXPRESSION);

        private final ErrorCode missing;
        private final ErrorCode invalidSyntax;
        private final ErrorCode noResult;
        private final ErrorCode unparsable;

        RangeBound(ErrorCode missing, ErrorCode invalidSyntax, ErrorCode noResult, ErrorCode unparsable) {
            this.missing = missing;
            this.invalidSyntax = invalidSyntax;
            this.noResult = noResult;
            this.unparsable = unparsable;
        }

        public ErrorCode missing() {
            return missing;
        }

        public ErrorCode invalidSyntax() {
            return invalidSyntax;
        }

        public ErrorCode noResult() {
            return noResult;
        }

        public ErrorCode unparsable() {
            return unparsable;
        }

        public String fieldName() {
            return name().toLowerCase();
        }
    }
}
