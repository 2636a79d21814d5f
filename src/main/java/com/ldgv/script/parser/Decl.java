package com.ldgv.script.parser;

import java.util.List;

public class Decl {

    public interface DeclInterface {
        String name();
    }

    public static final class Param {
        public final Multiplicity multiplicity;
        public final String name;
        public final TypeExpr type;

        public Param(Multiplicity multiplicity, String name, TypeExpr type) {
            this.multiplicity = multiplicity;
            this.name = name;
            this.type = type;
        }

        public Param(String name) {
            this(Multiplicity.MANY, name, null);
        }

        @Override
        public String toString() {
            String lin = (multiplicity == Multiplicity.ONE) ? "lin " : "";
            return "(" + lin + name + (type == null ? "" : " : " + type) + ")";
        }
    }

    /** {@code val name (p1 : T1) ... (pn : Tn) [: R] = body}. */
    public static final class Fun implements DeclInterface {
        public final String name;
        public final List<Param> params;
        public final Expr.ExprInterface body;
        public final TypeExpr resultType; // optional

        public Fun(String name, List<Param> params, Expr.ExprInterface body, TypeExpr resultType) {
            this.name = name;
            this.params = List.copyOf(params);
            this.body = body;
            this.resultType = resultType;
        }

        public Fun(String name, List<Param> params, Expr.ExprInterface body) {
            this(name, params, body, null);
        }

        @Override
        public String name() { return name; }

        /** Same declaration with the first parameter consumed. */
        Fun withoutFirstParam() {
            return new Fun(name, params.subList(1, params.size()), body, resultType);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("val ").append(name);
            for (Param p : params) sb.append(' ').append(p);
            if (resultType != null) sb.append(" : ").append(resultType);
            return sb.append(" = ").append(body).toString();
        }
    }

    /** {@code val name : type}. */
    public static final class Signature implements DeclInterface {
        public final String name;
        public final TypeExpr type;

        public Signature(String name, TypeExpr type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public String name() { return name; }

        @Override
        public String toString() { return "val " + name + " : " + type; }
    }

    /** {@code type name = type}. */
    public static final class TypeAlias implements DeclInterface {
        public final String name;
        public final TypeExpr type;

        public TypeAlias(String name, TypeExpr type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public String name() { return name; }

        @Override
        public String toString() { return "type " + name + " = " + type; }
    }
}
