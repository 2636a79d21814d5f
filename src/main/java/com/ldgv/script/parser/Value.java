package com.ldgv.script.parser;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

public class Value {
    public enum Type { UNIT, LABEL, INT, PAIR, FUNC, CHANNEL, DECL }

    public final Type type;
    public final Object value;

    private static final Value UNIT = new Value(Type.UNIT, null);

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value unit() { return UNIT; }
    public static Value label(String s) { return new Value(Type.LABEL, s.intern()); }
    public static Value integer(long i) { return new Value(Type.INT, i); }
    public static Value pair(Value first, Value second) { return new Value(Type.PAIR, new Pair(first, second)); }
    public static Value func(Closure f) { return new Value(Type.FUNC, f); }
    public static Value channel(Channel c) { return new Value(Type.CHANNEL, c); }
    public static Value decl(Decl.Fun d) { return new Value(Type.DECL, d); }

    /** A function from one already-evaluated argument to the value of the body. */
    @FunctionalInterface
    public interface Closure {
        Value apply(Value argument);
    }

    public static final class Pair {
        public final Value first;
        public final Value second;

        public Pair(Value first, Value second) {
            this.first = first;
            this.second = second;
        }
    }

    /**
     * One end of a session channel. Both queues are shared with the peer endpoint:
     * this end's write queue is the peer's read queue and vice versa.
     */
    public static final class Channel {
        public final BlockingQueue<Value> readQueue;
        public final BlockingQueue<Value> writeQueue;

        public Channel(BlockingQueue<Value> readQueue, BlockingQueue<Value> writeQueue) {
            this.readQueue = readQueue;
            this.writeQueue = writeQueue;
        }

        /** Allocates two fresh unbounded queues and returns the cross-wired endpoints as a pair. */
        public static Value newPair() {
            BlockingQueue<Value> r = new LinkedBlockingQueue<>();
            BlockingQueue<Value> w = new LinkedBlockingQueue<>();
            return Value.pair(Value.channel(new Channel(r, w)), Value.channel(new Channel(w, r)));
        }

        @Override
        public String toString() {
            return "chan@" + Integer.toHexString(System.identityHashCode(readQueue))
                    + "/" + Integer.toHexString(System.identityHashCode(writeQueue));
        }
    }

    public Type getType() { return type; }

    public String asLabel() {
        if (type != Type.LABEL) throw mismatch("label");
        return (String) value;
    }

    public long asInt() {
        if (type != Type.INT) throw mismatch("integer");
        return (long) value;
    }

    public Pair asPair() {
        if (type != Type.PAIR) throw mismatch("pair");
        return (Pair) value;
    }

    public Closure asFunc() {
        if (type != Type.FUNC) throw mismatch("function");
        return (Closure) value;
    }

    public Channel asChannel() {
        if (type != Type.CHANNEL) throw mismatch("channel");
        return (Channel) value;
    }

    public Decl.Fun asDecl() {
        if (type != Type.DECL) throw mismatch("declaration");
        return (Decl.Fun) value;
    }

    private EvaluationException mismatch(String expected) {
        return new EvaluationException(EvaluationException.Kind.TYPE_MISMATCH,
                "Expected " + expected + ", got " + type + " (" + this + ")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case UNIT:
                return true;
            case LABEL:
            case INT:
                return value.equals(other.value);
            case PAIR: {
                Pair a = asPair();
                Pair b = other.asPair();
                return a.first.equals(b.first) && a.second.equals(b.second);
            }
            case CHANNEL: {
                Channel a = asChannel();
                Channel b = other.asChannel();
                return a.readQueue == b.readQueue && a.writeQueue == b.writeQueue;
            }
            default:
                // closures and unevaluated declarations compare by identity
                return value == other.value;
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case UNIT:
                return 0;
            case PAIR: {
                Pair p = asPair();
                return 31 * p.first.hashCode() + p.second.hashCode();
            }
            case CHANNEL: {
                Channel c = asChannel();
                return 31 * System.identityHashCode(c.readQueue) + System.identityHashCode(c.writeQueue);
            }
            case LABEL:
            case INT:
                return value.hashCode();
            default:
                return System.identityHashCode(value);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case UNIT:
                return "()";
            case LABEL:
                return "'" + value;
            case INT:
                return Long.toString(asInt());
            case PAIR: {
                Pair p = asPair();
                return "<" + p.first + ", " + p.second + ">";
            }
            case FUNC:
                return "<function>";
            case CHANNEL:
                return "<" + value + ">";
            case DECL:
                return "<decl " + asDecl().name + ">";
            default:
                return "?";
        }
    }
}
