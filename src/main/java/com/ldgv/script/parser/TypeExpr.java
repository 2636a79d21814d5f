package com.ldgv.script.parser;

import java.util.List;

/**
 * Type annotations as written in the source.
 *
 * The evaluator never inspects these; they are kept so that declarations and
 * trace output reflect the program text.
 */
public abstract class TypeExpr {

    private TypeExpr() {}

    /** Builtin or user-declared type name: Unit, Int, Nat, End, Top, aliases. */
    public static final class Named extends TypeExpr {
        public final String name;
        public Named(String name) { this.name = name; }
        @Override public String toString() { return name; }
    }

    public static final class LabelSet extends TypeExpr {
        public final List<String> labels;
        public LabelSet(List<String> labels) { this.labels = List.copyOf(labels); }
        @Override public String toString() {
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < labels.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append('\'').append(labels.get(i));
            }
            return sb.append('}').toString();
        }
    }

    /** {@code !T.S} when sending, {@code ?T.S} when receiving. */
    public static final class Session extends TypeExpr {
        public final boolean sending;
        public final TypeExpr payload;
        public final TypeExpr continuation;
        public Session(boolean sending, TypeExpr payload, TypeExpr continuation) {
            this.sending = sending;
            this.payload = payload;
            this.continuation = continuation;
        }
        @Override public String toString() {
            return (sending ? "!" : "?") + payload + ". " + continuation;
        }
    }

    public static final class Dual extends TypeExpr {
        public final TypeExpr session;
        public Dual(TypeExpr session) { this.session = session; }
        @Override public String toString() { return "~" + session; }
    }

    /** Function type; {@code binder} is null for the non-dependent arrow. */
    public static final class Function extends TypeExpr {
        public final String binder;
        public final TypeExpr domain;
        public final TypeExpr range;
        public Function(String binder, TypeExpr domain, TypeExpr range) {
            this.binder = binder;
            this.domain = domain;
            this.range = range;
        }
        @Override public String toString() {
            String left = (binder == null) ? domain.toString() : "(" + binder + " : " + domain + ")";
            return left + " -> " + range;
        }
    }

    public static final class Pair extends TypeExpr {
        public final String binder;
        public final TypeExpr first;
        public final TypeExpr second;
        public Pair(String binder, TypeExpr first, TypeExpr second) {
            this.binder = binder;
            this.first = first;
            this.second = second;
        }
        @Override public String toString() {
            return "[" + binder + " : " + first + ", " + second + "]";
        }
    }
}
