package com.ldgv.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitUnitExpr(Unit expr);
        R visitVariableExpr(Variable expr);
        R visitLabelExpr(Label expr);
        R visitIntExpr(IntLit expr);
        R visitArithExpr(Arith expr);
        R visitNegateExpr(Negate expr);
        R visitSuccExpr(Succ expr);
        R visitLetExpr(Let expr);
        R visitLetPairExpr(LetPair expr);
        R visitPairExpr(Pair expr);
        R visitFstExpr(Fst expr);
        R visitSndExpr(Snd expr);
        R visitLambdaExpr(Lambda expr);
        R visitApplicationExpr(Application expr);

        // sessions and processes
        R visitForkExpr(Fork expr);
        R visitNewChannelExpr(NewChannel expr);
        R visitSendExpr(Send expr);
        R visitRecvExpr(Recv expr);

        R visitCaseExpr(Case expr);
        R visitNatRecExpr(NatRec expr);
    }

    // -------------------------
    // Literals and names
    // -------------------------

    public static final class Unit implements ExprInterface {
        public static final Unit INSTANCE = new Unit();

        private Unit() {}

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnitExpr(this);
        }

        @Override
        public String toString() { return "()"; }
    }

    public static final class Variable implements ExprInterface {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }

        @Override
        public String toString() { return name; }
    }

    public static final class Label implements ExprInterface {
        public final String name;

        public Label(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLabelExpr(this);
        }

        @Override
        public String toString() { return "'" + name; }
    }

    /** Integer literal; {@code natural} marks a Nat literal, evaluated the same way. */
    public static final class IntLit implements ExprInterface {
        public final long value;
        public final boolean natural;

        public IntLit(long value) {
            this(value, false);
        }

        public IntLit(long value, boolean natural) {
            this.value = value;
            this.natural = natural;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIntExpr(this);
        }

        @Override
        public String toString() { return Long.toString(value); }
    }

    // -------------------------
    // Arithmetic
    // -------------------------

    public static final class Arith implements ExprInterface {
        public final BinaryOp operator;
        public final ExprInterface left;
        public final ExprInterface right;

        public Arith(BinaryOp operator, ExprInterface left, ExprInterface right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArithExpr(this);
        }

        @Override
        public String toString() { return "(" + left + " " + operator.symbol + " " + right + ")"; }
    }

    public static final class Negate implements ExprInterface {
        public final ExprInterface operand;

        public Negate(ExprInterface operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNegateExpr(this);
        }

        @Override
        public String toString() { return "-" + operand; }
    }

    public static final class Succ implements ExprInterface {
        public final ExprInterface operand;

        public Succ(ExprInterface operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSuccExpr(this);
        }

        @Override
        public String toString() { return "succ " + operand; }
    }

    // -------------------------
    // Binding forms
    // -------------------------

    public static final class Let implements ExprInterface {
        public final String name;
        public final ExprInterface value;
        public final ExprInterface body;

        public Let(String name, ExprInterface value, ExprInterface body) {
            this.name = name;
            this.value = value;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLetExpr(this);
        }

        @Override
        public String toString() { return "let " + name + " = " + value + " in " + body; }
    }

    public static final class LetPair implements ExprInterface {
        public final String first;
        public final String second;
        public final ExprInterface value;
        public final ExprInterface body;

        public LetPair(String first, String second, ExprInterface value, ExprInterface body) {
            this.first = first;
            this.second = second;
            this.value = value;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLetPairExpr(this);
        }

        @Override
        public String toString() {
            return "let <" + first + ", " + second + "> = " + value + " in " + body;
        }
    }

    /** Dependent pair: {@code name} is bound to the first component while evaluating the second. */
    public static final class Pair implements ExprInterface {
        public final Multiplicity multiplicity;
        public final String name;
        public final ExprInterface first;
        public final ExprInterface second;

        public Pair(Multiplicity multiplicity, String name, ExprInterface first, ExprInterface second) {
            this.multiplicity = multiplicity;
            this.name = name;
            this.first = first;
            this.second = second;
        }

        public Pair(String name, ExprInterface first, ExprInterface second) {
            this(Multiplicity.MANY, name, first, second);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPairExpr(this);
        }

        @Override
        public String toString() {
            String lin = (multiplicity == Multiplicity.ONE) ? "lin " : "";
            return "<" + lin + name + " = " + first + ", " + second + ">";
        }
    }

    public static final class Fst implements ExprInterface {
        public final ExprInterface pair;

        public Fst(ExprInterface pair) {
            this.pair = pair;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFstExpr(this);
        }

        @Override
        public String toString() { return "fst " + pair; }
    }

    public static final class Snd implements ExprInterface {
        public final ExprInterface pair;

        public Snd(ExprInterface pair) {
            this.pair = pair;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSndExpr(this);
        }

        @Override
        public String toString() { return "snd " + pair; }
    }

    // -------------------------
    // Functions
    // -------------------------

    public static final class Lambda implements ExprInterface {
        public final Multiplicity multiplicity;
        public final String param;
        public final TypeExpr paramType;
        public final ExprInterface body;

        public Lambda(Multiplicity multiplicity, String param, TypeExpr paramType, ExprInterface body) {
            this.multiplicity = multiplicity;
            this.param = param;
            this.paramType = paramType;
            this.body = body;
        }

        public Lambda(String param, ExprInterface body) {
            this(Multiplicity.MANY, param, null, body);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLambdaExpr(this);
        }

        @Override
        public String toString() {
            String lin = (multiplicity == Multiplicity.ONE) ? "lin " : "";
            String type = (paramType == null) ? "" : " : " + paramType;
            return "fn (" + lin + param + type + ") " + body;
        }
    }

    public static final class Application implements ExprInterface {
        public final ExprInterface function;
        public final ExprInterface argument;

        public Application(ExprInterface function, ExprInterface argument) {
            this.function = function;
            this.argument = argument;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitApplicationExpr(this);
        }

        @Override
        public String toString() { return "(" + function + " " + argument + ")"; }
    }

    // -------------------------
    // Sessions
    // -------------------------

    public static final class Fork implements ExprInterface {
        public final ExprInterface body;

        public Fork(ExprInterface body) {
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitForkExpr(this);
        }

        @Override
        public String toString() { return "fork " + body; }
    }

    public static final class NewChannel implements ExprInterface {
        public final TypeExpr sessionType;

        public NewChannel(TypeExpr sessionType) {
            this.sessionType = sessionType;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNewChannelExpr(this);
        }

        @Override
        public String toString() { return "new " + (sessionType == null ? "?" : sessionType.toString()); }
    }

    public static final class Send implements ExprInterface {
        public final ExprInterface channel;

        public Send(ExprInterface channel) {
            this.channel = channel;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSendExpr(this);
        }

        @Override
        public String toString() { return "send " + channel; }
    }

    public static final class Recv implements ExprInterface {
        public final ExprInterface channel;

        public Recv(ExprInterface channel) {
            this.channel = channel;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRecvExpr(this);
        }

        @Override
        public String toString() { return "recv " + channel; }
    }

    // -------------------------
    // Control
    // -------------------------

    public static final class Case implements ExprInterface {
        public final ExprInterface scrutinee;
        public final Map<String, ExprInterface> branches; // label name -> branch, source order

        public Case(ExprInterface scrutinee, Map<String, ExprInterface> branches) {
            this.scrutinee = scrutinee;
            this.branches = Collections.unmodifiableMap(new LinkedHashMap<>(branches));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCaseExpr(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("case ").append(scrutinee).append(" of {");
            boolean first = true;
            for (Map.Entry<String, ExprInterface> e : branches.entrySet()) {
                if (!first) sb.append(",");
                sb.append(" '").append(e.getKey()).append(" : ").append(e.getValue());
                first = false;
            }
            return sb.append(" }").toString();
        }
    }

    /**
     * Bounded recursion over a natural index:
     *   natrec index { zero => zeroCase, succ indexName . resultName => stepCase }
     */
    public static final class NatRec implements ExprInterface {
        public final ExprInterface index;
        public final ExprInterface zeroCase;
        public final String indexName;
        public final String resultName;
        public final TypeExpr resultType;
        public final ExprInterface stepCase;

        public NatRec(ExprInterface index, ExprInterface zeroCase, String indexName, String resultName,
                      TypeExpr resultType, ExprInterface stepCase) {
            this.index = index;
            this.zeroCase = zeroCase;
            this.indexName = indexName;
            this.resultName = resultName;
            this.resultType = resultType;
            this.stepCase = stepCase;
        }

        public NatRec(ExprInterface index, ExprInterface zeroCase, String indexName, String resultName,
                      ExprInterface stepCase) {
            this(index, zeroCase, indexName, resultName, null, stepCase);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNatRecExpr(this);
        }

        @Override
        public String toString() {
            return "natrec " + index + " { zero => " + zeroCase + ", succ " + indexName + " . "
                    + resultName + " => " + stepCase + " }";
        }
    }
}
