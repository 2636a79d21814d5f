package com.ldgv.script.parser;

/**
 * Turns a top-level declaration into a value. Called afresh for every reference,
 * so neither partial applications nor results are shared between references.
 */
final class GlobalResolver {

    private final ExecutionState state;

    GlobalResolver(ExecutionState state) {
        this.state = state;
    }

    Value resolve(Decl.Fun decl) {
        return resolve(decl, state.globals);
    }

    /**
     * Zero parameters: evaluates the body in {@code env}.
     * Otherwise: a closure binding the first parameter, resolving the rest on application.
     */
    Value resolve(Decl.Fun decl, Environment env) {
        if (decl.params.isEmpty()) {
            return new Interpreter(state, env).evaluate(decl.body);
        }
        String param = decl.params.get(0).name;
        Decl.Fun inner = decl.withoutFirstParam();
        return Value.func(arg -> resolve(inner, env.extend(param, arg)));
    }
}
