package com.ldgv.script.parser;

/**
 * Fatal evaluation fault. Aborts the process that raised it; never caught by the evaluator.
 */
public class EvaluationException extends RuntimeException {

    public enum Kind {
        UNBOUND_VARIABLE,
        TYPE_MISMATCH,
        NO_MATCHING_CASE,
        NO_MAIN_DECLARATION,
        DIVISION_BY_ZERO,
        NEGATIVE_RECURSION_INDEX
    }

    private final Kind kind;

    public EvaluationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
