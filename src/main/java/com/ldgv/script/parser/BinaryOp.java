package com.ldgv.script.parser;

public enum BinaryOp {
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIV("/");

    public final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    /** 64-bit two's-complement arithmetic; division truncates toward zero. */
    public long apply(long a, long b) {
        switch (this) {
            case PLUS:  return a + b;
            case MINUS: return a - b;
            case TIMES: return a * b;
            case DIV:
                if (b == 0) {
                    throw new EvaluationException(EvaluationException.Kind.DIVISION_BY_ZERO,
                            "Division by zero: " + a + " / " + b);
                }
                return a / b;
            default:
                throw new IllegalStateException("Unknown operator: " + this);
        }
    }
}
