package com.ldgv.script.parser;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import com.ldgv.debug.Debug;
import com.ldgv.script.parser.Decl.DeclInterface;

/**
 * Read-only context shared by every process of one program run.
 *
 * Contains:
 *  - globals:   top-level environment, built once (host bindings, then one
 *               unevaluated entry per function declaration)
 *  - processes: pool running forked evaluations, one daemon thread per live process.
 *               Never shut down: a forked process may fork again after main has returned.
 */
public class ExecutionState {

    private static final String TAG = "ldgv.process";

    public final Environment globals;
    private final ExecutorService processes;
    private final AtomicLong nextProcessId = new AtomicLong(1);
    private final AtomicLong nextThreadId = new AtomicLong(1);

    public ExecutionState(List<? extends DeclInterface> declarations, Map<String, Value> hostBindings) {
        Environment env = Environment.empty().extendMany(hostBindings);
        if (declarations != null) {
            for (DeclInterface d : declarations) {
                // signatures and type aliases carry no run-time meaning
                if (d instanceof Decl.Fun) {
                    env = env.extend(d.name(), Value.decl((Decl.Fun) d));
                }
            }
        }
        this.globals = env;
        this.processes = Executors.newCachedThreadPool(daemonThreads());
    }

    public Decl.Fun findDeclaration(String name) {
        if (!globals.exists(name)) return null;
        Value v = globals.lookup(name);
        return v.getType() == Value.Type.DECL ? v.asDecl() : null;
    }

    /**
     * Starts {@code body} in {@code env} as an independent process. Its result is
     * traced and its fault logged; neither reaches the caller.
     */
    public void fork(Expr.ExprInterface body, Environment env) {
        long id = nextProcessId.getAndIncrement();
        processes.execute(() -> {
            try {
                Value res = new Interpreter(this, env).evaluate(body);
                Debug.get().t(TAG, "Ran forked process #" + id + " with result " + res);
            } catch (Throwable e) {
                // top of the process: nothing above it to propagate to
                Debug.get().e(TAG, "Forked process #" + id + " failed: " + e.getMessage(), e);
            }
        });
    }

    private ThreadFactory daemonThreads() {
        return r -> {
            Thread t = new Thread(r, "ldgv-process-" + nextThreadId.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
