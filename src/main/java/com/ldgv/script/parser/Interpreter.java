package com.ldgv.script.parser;

import com.ldgv.debug.Debug;
import com.ldgv.script.parser.EvaluationException.Kind;
import com.ldgv.script.parser.Expr.Application;
import com.ldgv.script.parser.Expr.Arith;
import com.ldgv.script.parser.Expr.Case;
import com.ldgv.script.parser.Expr.ExprInterface;
import com.ldgv.script.parser.Expr.ExprVisitor;
import com.ldgv.script.parser.Expr.Fork;
import com.ldgv.script.parser.Expr.Fst;
import com.ldgv.script.parser.Expr.IntLit;
import com.ldgv.script.parser.Expr.Label;
import com.ldgv.script.parser.Expr.Lambda;
import com.ldgv.script.parser.Expr.Let;
import com.ldgv.script.parser.Expr.LetPair;
import com.ldgv.script.parser.Expr.NatRec;
import com.ldgv.script.parser.Expr.Negate;
import com.ldgv.script.parser.Expr.NewChannel;
import com.ldgv.script.parser.Expr.Pair;
import com.ldgv.script.parser.Expr.Recv;
import com.ldgv.script.parser.Expr.Send;
import com.ldgv.script.parser.Expr.Snd;
import com.ldgv.script.parser.Expr.Succ;
import com.ldgv.script.parser.Expr.Unit;
import com.ldgv.script.parser.Expr.Variable;

/**
 * Big-step evaluator. One instance per running process; the current environment
 * is swapped in and out around binding forms, closures and forks get fresh instances.
 */
public class Interpreter implements ExprVisitor<Value> {

    private static final String TAG = "ldgv.eval";
    private static final String CHAN_TAG = "ldgv.chan";

    Environment env;
    private final ExecutionState state;
    private final GlobalResolver globals;

    public Interpreter(ExecutionState state, Environment env) {
        this.state = state;
        this.env = env;
        this.globals = new GlobalResolver(state);
    }

    public Interpreter(ExecutionState state) {
        this(state, state.globals);
    }

    public Value evaluate(ExprInterface expr) {
        Debug dbg = Debug.get();
        if (!dbg.isTracing()) return expr.accept(this);

        dbg.t(TAG, "Invoking interpretation on " + expr);
        Value v = expr.accept(this);
        dbg.t(TAG, "Leaving interpretation of " + expr + " with value " + v);
        return v;
    }

    public Value evaluate(ExprInterface expr, Environment scope) {
        Environment previous = this.env;
        this.env = scope;
        try {
            return evaluate(expr);
        } finally {
            this.env = previous;
        }
    }

    /** Resolves the top-level declaration {@code name}, as a variable reference to it would. */
    public Value resolveGlobal(String name) {
        Decl.Fun decl = state.findDeclaration(name);
        if (decl == null) {
            throw new EvaluationException(Kind.UNBOUND_VARIABLE, "No declaration named " + name);
        }
        return globals.resolve(decl);
    }

    // -------------------------
    // Literals and names
    // -------------------------

    @Override
    public Value visitUnitExpr(Unit expr) {
        return Value.unit();
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        Value v = env.lookup(expr.name);
        if (v.getType() == Value.Type.DECL) {
            // every reference re-runs the declaration, in the referencing scope
            return globals.resolve(v.asDecl(), env);
        }
        return v;
    }

    @Override
    public Value visitLabelExpr(Label expr) {
        return Value.label(expr.name);
    }

    @Override
    public Value visitIntExpr(IntLit expr) {
        return Value.integer(expr.value);
    }

    // -------------------------
    // Arithmetic
    // -------------------------

    @Override
    public Value visitArithExpr(Arith expr) {
        return applyBinaryOp(expr.operator, expr.left, expr.right);
    }

    @Override
    public Value visitNegateExpr(Negate expr) {
        return applyBinaryOp(BinaryOp.MINUS, new IntLit(0), expr.operand);
    }

    @Override
    public Value visitSuccExpr(Succ expr) {
        return applyBinaryOp(BinaryOp.PLUS, new IntLit(1), expr.operand);
    }

    Value applyBinaryOp(BinaryOp op, ExprInterface left, ExprInterface right) {
        long a = evaluate(left).asInt();
        long b = evaluate(right).asInt();
        return Value.integer(op.apply(a, b));
    }

    // -------------------------
    // Binding forms
    // -------------------------

    @Override
    public Value visitLetExpr(Let expr) {
        Value v = evaluate(expr.value);
        return evaluate(expr.body, env.extend(expr.name, v));
    }

    @Override
    public Value visitLetPairExpr(LetPair expr) {
        Value.Pair p = evaluate(expr.value).asPair();
        return evaluate(expr.body, env.extend(expr.first, p.first).extend(expr.second, p.second));
    }

    @Override
    public Value visitPairExpr(Pair expr) {
        Value first = evaluate(expr.first);
        Value second = evaluate(expr.second, env.extend(expr.name, first));
        return Value.pair(first, second);
    }

    @Override
    public Value visitFstExpr(Fst expr) {
        return evaluate(expr.pair).asPair().first;
    }

    @Override
    public Value visitSndExpr(Snd expr) {
        return evaluate(expr.pair).asPair().second;
    }

    // -------------------------
    // Functions
    // -------------------------

    @Override
    public Value visitLambdaExpr(Lambda expr) {
        Environment captured = env;
        return Value.func(arg -> new Interpreter(state, captured.extend(expr.param, arg)).evaluate(expr.body));
    }

    @Override
    public Value visitApplicationExpr(Application expr) {
        Value arg = evaluate(expr.argument);
        Value f = evaluate(expr.function);
        return f.asFunc().apply(arg);
    }

    // -------------------------
    // Sessions
    // -------------------------

    @Override
    public Value visitForkExpr(Fork expr) {
        state.fork(expr.body, env);
        return Value.unit();
    }

    @Override
    public Value visitNewChannelExpr(NewChannel expr) {
        return Value.Channel.newPair();
    }

    @Override
    public Value visitSendExpr(Send expr) {
        Value endpoint = evaluate(expr.channel);
        Value.Channel c = endpoint.asChannel();
        return Value.func(payload -> {
            Debug.get().t(CHAN_TAG, "Sending value " + payload + " on channel " + c);
            // unbounded queue: add never blocks
            c.writeQueue.add(payload);
            return endpoint;
        });
    }

    @Override
    public Value visitRecvExpr(Recv expr) {
        Value endpoint = evaluate(expr.channel);
        Value.Channel c = endpoint.asChannel();
        Value received;
        try {
            received = c.readQueue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Process interrupted while receiving on " + c, e);
        }
        Debug.get().t(CHAN_TAG, "Read " + received + " from channel " + c);
        return Value.pair(received, endpoint);
    }

    // -------------------------
    // Control
    // -------------------------

    @Override
    public Value visitCaseExpr(Case expr) {
        String label = evaluate(expr.scrutinee).asLabel();
        ExprInterface branch = expr.branches.get(label);
        if (branch == null) {
            throw new EvaluationException(Kind.NO_MATCHING_CASE,
                    "No case found for label '" + label + " in branches " + expr.branches.keySet());
        }
        return evaluate(branch);
    }

    @Override
    public Value visitNatRecExpr(NatRec expr) {
        long n = evaluate(expr.index).asInt();
        if (n < 0) {
            throw new EvaluationException(Kind.NEGATIVE_RECURSION_INDEX,
                    "natrec index must be non-negative, got " + n);
        }

        // result(0) = zeroCase; result(k) = stepCase[indexName := k, resultName := result(k-1)]
        // the zero case sees indexName = 0 once the recursion has unfolded
        Value acc = (n == 0)
                ? evaluate(expr.zeroCase)
                : evaluate(expr.zeroCase, env.extend(expr.indexName, Value.integer(0)));
        for (long k = 1; k <= n; k++) {
            acc = evaluate(expr.stepCase, env.extend(expr.indexName, Value.integer(k)).extend(expr.resultName, acc));
        }
        return acc;
    }
}
