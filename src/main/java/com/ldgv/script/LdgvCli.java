package com.ldgv.script;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.ldgv.debug.Debug;
import com.ldgv.protocol.ValueJson;
import com.ldgv.script.parser.EvaluationException;
import com.ldgv.script.parser.Value;

/**
 * Usage: LdgvCli [--trace] [--json] [--bind name=json]... [program-file]
 *
 * Reads the program from the file, or from stdin when no file is given, and
 * prints the value of {@code main}.
 */
public final class LdgvCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.in));
    }

    public static int run(String[] args, InputStream stdin) {
        boolean trace = false;
        boolean json = false;
        Map<String, Value> bindings = new LinkedHashMap<>();
        String file = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if ("--trace".equals(a)) {
                trace = true;
            } else if ("--json".equals(a)) {
                json = true;
            } else if ("--bind".equals(a) && i + 1 < args.length) {
                String binding = args[++i];
                int eq = binding.indexOf('=');
                if (eq <= 0) return usage("--bind expects name=json, got: " + binding);
                try {
                    bindings.put(binding.substring(0, eq), ValueJson.fromJsonString(binding.substring(eq + 1)));
                } catch (IllegalArgumentException e) {
                    return usage("Bad --bind value for " + binding.substring(0, eq) + ": " + e.getMessage());
                }
            } else if (a.startsWith("--") || file != null) {
                return usage("Unexpected argument: " + a);
            } else {
                file = a;
            }
        }

        final String source;
        try {
            source = (file == null)
                    ? new String(stdin.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read program: " + (file == null ? "<stdin>" : file));
            e.printStackTrace(System.err);
            return EXIT_IO;
        }

        Debug.useSysOut();
        LdgvScript engine = new LdgvScript();
        engine.setTracing(trace);

        try {
            Value result = engine.run(source, bindings);
            System.out.println(json ? ValueJson.toJsonString(result) : result.toString());
            return EXIT_OK;
        } catch (EvaluationException e) {
            System.err.println("Evaluation error (" + e.kind() + "): " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            System.err.println("Error: " + e.getMessage());
            if (trace) e.printStackTrace(System.err);
            return EXIT_FAILURE;
        }
    }

    private static int usage(String problem) {
        System.err.println(problem);
        System.err.println("Usage: LdgvCli [--trace] [--json] [--bind name=json]... [program-file]");
        return EXIT_USAGE;
    }

    private LdgvCli() {}
}
