import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ldgv.script.parser.Environment;
import com.ldgv.script.parser.EvaluationException;
import com.ldgv.script.parser.Value;

public class EnvironmentTest {

    @Test
    void lookup_returnsInnermostBinding() {
        Environment env = Environment.empty()
                .extend("x", Value.integer(1))
                .extend("y", Value.integer(2))
                .extend("x", Value.integer(3));

        assertEquals(3L, env.lookup("x").asInt());
        assertEquals(2L, env.lookup("y").asInt());
    }

    @Test
    void extend_leavesParentUntouched() {
        Environment parent = Environment.empty().extend("x", Value.integer(1));
        Environment child = parent.extend("x", Value.label("Shadow")).extend("z", Value.unit());

        assertEquals(1L, parent.lookup("x").asInt());
        assertFalse(parent.exists("z"));
        assertEquals("Shadow", child.lookup("x").asLabel());
        assertSame(parent, child.parent.parent);
    }

    @Test
    void extendMany_laterEntriesShadowEarlierOnes() {
        Map<String, Value> bindings = new LinkedHashMap<>();
        bindings.put("a", Value.integer(10));
        bindings.put("b", Value.integer(20));

        Environment env = Environment.empty().extend("a", Value.integer(0)).extendMany(bindings);

        assertEquals(10L, env.lookup("a").asInt());
        assertEquals(20L, env.lookup("b").asInt());
        assertSame(env, env.extendMany(null));
    }

    @Test
    void lookup_missingName_faultsWithUnboundVariable() {
        Environment env = Environment.empty().extend("x", Value.unit());

        EvaluationException ex = assertThrows(EvaluationException.class, () -> env.lookup("nope"));
        assertEquals(EvaluationException.Kind.UNBOUND_VARIABLE, ex.kind());
        assertTrue(ex.getMessage().contains("nope"));
    }

    @Test
    void snapshot_listsVisibleBindingsInnermostLast() {
        Environment env = Environment.empty()
                .extend("x", Value.integer(1))
                .extend("y", Value.integer(2))
                .extend("x", Value.integer(3));

        Map<String, Value> snap = env.snapshot();

        assertEquals(2, snap.size());
        assertEquals(Value.integer(3), snap.get("x"));
        assertArrayEquals(new Object[] { "y", "x" }, snap.keySet().toArray());
        assertTrue(Environment.empty().snapshot().isEmpty());
    }
}
