import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ldgv.debug.Debug;
import com.ldgv.script.LdgvCli;

public class LdgvCliTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream savedOut;
    private PrintStream savedErr;

    @BeforeEach
    void captureStreams() {
        savedOut = System.out;
        savedErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(savedOut);
        System.setErr(savedErr);
        Debug.get().setSink(null);
        Debug.get().setTracing(false);
    }

    private static InputStream stdin(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    void runsProgramFromFile() throws IOException {
        Path file = tmp.resolve("fact.ldgv");
        Files.writeString(file, String.join("\n",
                "val fact (n : Nat) : Nat = natrec n { zero => 1, succ k . acc => k * acc }",
                "val main : Nat",
                "val main = fact 5"));

        int code = LdgvCli.run(new String[] { file.toString() }, stdin(""));

        assertEquals(0, code);
        assertEquals("120", stdout());
    }

    @Test
    void readsProgramFromStdin() {
        int code = LdgvCli.run(new String[0], stdin("val main = <'Ok, 1>"));

        assertEquals(0, code);
        assertEquals("<'Ok, 1>", stdout());
    }

    @Test
    void successfulRun_writesNothingToStderr() {
        int code = LdgvCli.run(new String[0], stdin("val main = let p = new End in 1 + 2"));

        assertEquals(0, code);
        assertEquals("3", stdout());
        assertEquals("", err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void traceFlag_writesTraceLinesToStderr() {
        int code = LdgvCli.run(new String[] { "--trace" }, stdin("val main = 1 + 2"));

        assertEquals(0, code);
        String log = err.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("[TRACE][ldgv.engine]"), log);
        assertTrue(log.contains("Invoking interpretation on (1 + 2)"), log);
    }

    @Test
    void jsonOutput() {
        int code = LdgvCli.run(new String[] { "--json" }, stdin("val main = 'Ok"));

        assertEquals(0, code);
        assertEquals("{\"type\":\"label\",\"value\":\"Ok\"}", stdout());
    }

    @Test
    void hostBindings() {
        int code = LdgvCli.run(new String[] { "--bind", "n={\"type\":\"int\",\"value\":4}" },
                stdin("val main = n * 2"));

        assertEquals(0, code);
        assertEquals("8", stdout());
    }

    @Test
    void missingMain_exitsWithFailure() {
        int code = LdgvCli.run(new String[0], stdin("val other = 1"));

        assertEquals(1, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("NO_MAIN_DECLARATION"));
    }

    @Test
    void parseError_exitsWithFailure() {
        assertEquals(1, LdgvCli.run(new String[0], stdin("val main = let")));
    }

    @Test
    void badArguments_exitWithUsage() {
        assertEquals(2, LdgvCli.run(new String[] { "--bogus" }, stdin("")));
        assertEquals(2, LdgvCli.run(new String[] { "a.ldgv", "b.ldgv" }, stdin("")));
        assertEquals(2, LdgvCli.run(new String[] { "--bind", "noequals" }, stdin("")));
    }

    @Test
    void unreadableFile_exitsWithIoCode() {
        String missing = tmp.resolve("missing.ldgv").toString();
        assertEquals(3, LdgvCli.run(new String[] { missing }, stdin("")));
    }
}
