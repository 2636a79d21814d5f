package com.ldgv.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable chain of bindings. Each frame holds one name; extending returns a new
 * frame whose parent is this one, so a parent is never changed and can be shared
 * freely between closures and forked processes.
 */
public final class Environment {

    private static final Environment EMPTY = new Environment(null, null, null);

    public final String name;
    public final Value value;
    public final Environment parent;

    private Environment(String name, Value value, Environment parent) {
        this.name = name;
        this.value = value;
        this.parent = parent;
    }

    public static Environment empty() {
        return EMPTY;
    }

    public Environment extend(String name, Value value) {
        if (name == null) throw new IllegalArgumentException("binding name must not be null");
        return new Environment(name, value, this);
    }

    /** Adds the bindings in iteration order; later entries shadow earlier ones. */
    public Environment extendMany(Map<String, Value> bindings) {
        Environment env = this;
        if (bindings == null) return env;
        for (Map.Entry<String, Value> e : bindings.entrySet()) {
            env = env.extend(e.getKey(), e.getValue());
        }
        return env;
    }

    public Value lookup(String name) {
        for (Environment cur = this; cur.parent != null; cur = cur.parent) {
            if (cur.name.equals(name)) return cur.value;
        }
        throw new EvaluationException(EvaluationException.Kind.UNBOUND_VARIABLE, "Undefined variable: " + name);
    }

    public boolean exists(String name) {
        for (Environment cur = this; cur.parent != null; cur = cur.parent) {
            if (cur.name.equals(name)) return true;
        }
        return false;
    }

    /** DEBUG: visible bindings, outermost first, shadowed names resolved to the innermost value. */
    public Map<String, Value> snapshot() {
        List<Environment> innerToOuter = new ArrayList<>();
        for (Environment cur = this; cur.parent != null; cur = cur.parent) innerToOuter.add(cur);
        Collections.reverse(innerToOuter);

        Map<String, Value> out = new LinkedHashMap<>();
        for (Environment frame : innerToOuter) {
            out.remove(frame.name); // re-insert so the entry moves to its innermost position
            out.put(frame.name, frame.value);
        }
        return out;
    }
}
