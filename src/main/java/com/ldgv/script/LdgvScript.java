package com.ldgv.script;

import com.ldgv.debug.Debug;
import com.ldgv.script.parser.Decl.DeclInterface;
import com.ldgv.script.parser.EvaluationException;
import com.ldgv.script.parser.ExecutionState;
import com.ldgv.script.parser.Expr;
import com.ldgv.script.parser.Interpreter;
import com.ldgv.script.parser.Lexer;
import com.ldgv.script.parser.Parser;
import com.ldgv.script.parser.Token;
import com.ldgv.script.parser.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Core LDGV engine.
 *
 * - Functional calculus with labels, dependent pairs, natrec and session channels
 * - Types: unit, label, integer, pair, function, channel endpoint
 * - Program = list of declarations; the value of {@code main} is the result
 * - Top-level references are re-evaluated on every use (no memoization)
 * - {@code fork} runs a process on its own daemon thread; {@code recv} blocks
 * - Type annotations are parsed and ignored: programs are assumed well-typed
 */
public class LdgvScript {

    public static final String MAIN = "main";

    private static final String TAG = "ldgv.engine";

    /** Error reporter hook used to surface parse and evaluation failures to the host. */
    public interface ErrorReporter {
        void report(RuntimeException e, String phase, String message);
    }

    // ===================== ENGINE PUBLIC API =====================

    private ErrorReporter errorReporter = null;

    /*
     * ERROR HANDLING CONTRACT:
     *
     * - Every failure (lex, parse, evaluation) is passed to the reporter, if any,
     *   and then rethrown to the host. Reporting never suppresses.
     * - Faults inside forked processes never reach the host; they are logged
     *   through Debug at ERROR level.
     */
    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    /** Process-wide: affects every engine in this JVM. */
    public void setTracing(boolean enabled) { Debug.get().setTracing(enabled); }

    public boolean isTracing() { return Debug.get().isTracing(); }

    public List<DeclInterface> parse(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            return new Parser(tokens).parse();
        } catch (RuntimeException e) {
            throw reported(e, "parse");
        }
    }

    public Expr.ExprInterface parseExpression(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            return new Parser(tokens).parseExpression();
        } catch (RuntimeException e) {
            throw reported(e, "parse");
        }
    }

    /** Parses {@code source} and returns the value of its {@code main} declaration. */
    public Value run(String source) {
        return run(source, Collections.emptyMap());
    }

    /**
     * Same as {@link #run(String)} with extra top-level bindings supplied by the host.
     * Declarations with the same name shadow host bindings.
     */
    public Value run(String source, Map<String, Value> hostBindings) {
        return evaluateMain(parse(source), hostBindings);
    }

    public Value evaluateMain(List<? extends DeclInterface> declarations, Map<String, Value> hostBindings) {
        ExecutionState state = new ExecutionState(declarations, hostBindings);
        try {
            if (state.findDeclaration(MAIN) == null) {
                throw new EvaluationException(EvaluationException.Kind.NO_MAIN_DECLARATION,
                        "No 'main' value declaration found, exiting");
            }
            Debug.get().t(TAG, "evaluating main");
            return new Interpreter(state).resolveGlobal(MAIN);
        } catch (RuntimeException e) {
            throw reported(e, "evaluate");
        }
    }

    /** Evaluates a single expression against the top-level environment of {@code declarations}. */
    public Value evaluate(Expr.ExprInterface expr, List<? extends DeclInterface> declarations, Map<String, Value> hostBindings) {
        ExecutionState state = new ExecutionState(declarations, hostBindings);
        try {
            return new Interpreter(state).evaluate(expr);
        } catch (RuntimeException e) {
            throw reported(e, "evaluate");
        }
    }

    public Value evaluate(Expr.ExprInterface expr) {
        return evaluate(expr, Collections.emptyList(), Collections.emptyMap());
    }

    private RuntimeException reported(RuntimeException e, String phase) {
        String message = (e.getMessage() == null) ? e.toString() : e.getMessage();
        if (errorReporter != null) {
            try {
                errorReporter.report(e, phase, message);
            } catch (RuntimeException re) {
                Debug.get().e(TAG, "error reporter failed: " + re + " payload=" + message, re);
            }
        }
        return e;
    }
}
