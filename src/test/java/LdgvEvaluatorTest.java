import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ldgv.script.LdgvScript;
import com.ldgv.script.parser.BinaryOp;
import com.ldgv.script.parser.EvaluationException;
import com.ldgv.script.parser.Expr;
import com.ldgv.script.parser.Value;

public class LdgvEvaluatorTest {

    private static Value run(String... lines) {
        return new LdgvScript().run(String.join("\n", lines));
    }

    private static Value eval(Expr.ExprInterface expr) {
        return new LdgvScript().evaluate(expr);
    }

    private static EvaluationException.Kind faultOf(Expr.ExprInterface expr) {
        return assertThrows(EvaluationException.class, () -> eval(expr)).kind();
    }

    // -------------------------
    // Arithmetic
    // -------------------------

    @Test
    void arithmetic_onIntegers() {
        long[][] cases = { { 7, 3 }, { -4, 9 }, { 0, 0 }, { 123456789, -987 } };
        for (long[] c : cases) {
            Expr.IntLit a = new Expr.IntLit(c[0]);
            Expr.IntLit b = new Expr.IntLit(c[1]);
            assertEquals(c[0] + c[1], eval(new Expr.Arith(BinaryOp.PLUS, a, b)).asInt());
            assertEquals(c[0] - c[1], eval(new Expr.Arith(BinaryOp.MINUS, a, b)).asInt());
            assertEquals(c[0] * c[1], eval(new Expr.Arith(BinaryOp.TIMES, a, b)).asInt());
        }
    }

    @Test
    void division_truncatesTowardZero() {
        assertEquals(3L, run("val main = 7 / 2").asInt());
        assertEquals(-3L, run("val main = -7 / 2").asInt());
    }

    @Test
    void division_byZero_faults() {
        Expr.ExprInterface div = new Expr.Arith(BinaryOp.DIV, new Expr.IntLit(5), new Expr.IntLit(0));
        assertEquals(EvaluationException.Kind.DIVISION_BY_ZERO, faultOf(div));
    }

    @Test
    void negateAndSucc() {
        assertEquals(-5L, run("val main = -5").asInt());
        assertEquals(5L, run("val main = succ 4").asInt());
        assertEquals(3L, run("val main = - (0 - 3)").asInt());
    }

    @Test
    void arithmetic_wrapsOnOverflow() {
        Expr.ExprInterface e = new Expr.Arith(BinaryOp.PLUS, new Expr.IntLit(Long.MAX_VALUE), new Expr.IntLit(1));
        assertEquals(Long.MIN_VALUE, eval(e).asInt());
    }

    @Test
    void arithmetic_onNonInteger_faults() {
        Expr.ExprInterface e = new Expr.Arith(BinaryOp.PLUS, new Expr.Label("A"), new Expr.IntLit(1));
        assertEquals(EvaluationException.Kind.TYPE_MISMATCH, faultOf(e));
    }

    @Test
    void arithmetic_evaluatesLeftOperandFirst() {
        Value chans = Value.Channel.newPair();
        Map<String, Value> host = new LinkedHashMap<>();
        host.put("out", chans.asPair().first);

        Value v = new LdgvScript().run(
                "val main = (let c = send out 'L in 1) + (let c = send out 'R in 2)", host);

        assertEquals(3L, v.asInt());
        Value.Channel in = chans.asPair().second.asChannel();
        assertEquals(Value.label("L"), in.readQueue.poll());
        assertEquals(Value.label("R"), in.readQueue.poll());
    }

    // -------------------------
    // Binding forms and pairs
    // -------------------------

    @Test
    void let_bindsValueInBody() {
        assertEquals(6L, run("val main = let x = 5 in x + 1").asInt());
        assertEquals(2L, run("val main = let x = 1 in let x = x + 1 in x").asInt());
    }

    @Test
    void dependentPair_secondComponentSeesFirst() {
        Expr.ExprInterface pair = new Expr.Pair("x", new Expr.IntLit(5),
                new Expr.Arith(BinaryOp.PLUS, new Expr.Variable("x"), new Expr.IntLit(1)));

        assertEquals(Value.pair(Value.integer(5), Value.integer(6)), eval(pair));
        assertEquals("<5, 6>", run("val main = <x = 5, x + 1>").toString());
    }

    @Test
    void dependentPair_binderDoesNotEscape() {
        EvaluationException ex = assertThrows(EvaluationException.class,
                () -> run("val main = let p = <x = 1, x> in x"));
        assertEquals(EvaluationException.Kind.UNBOUND_VARIABLE, ex.kind());
    }

    @Test
    void letPair_andProjections() {
        assertEquals(7L, run("val main = let <a, b> = <3, 4> in a + b").asInt());
        assertEquals(Value.label("L"), run("val main = fst <'L, 2>"));
        assertEquals(2L, run("val main = snd <'L, 2>").asInt());
    }

    @Test
    void projection_onNonPair_faults() {
        assertEquals(EvaluationException.Kind.TYPE_MISMATCH, faultOf(new Expr.Fst(new Expr.IntLit(5))));
        assertEquals(EvaluationException.Kind.TYPE_MISMATCH, faultOf(new Expr.Snd(Expr.Unit.INSTANCE)));

        Expr.ExprInterface letPair = new Expr.LetPair("a", "b", new Expr.IntLit(1), new Expr.Variable("a"));
        assertEquals(EvaluationException.Kind.TYPE_MISMATCH, faultOf(letPair));
    }

    @Test
    void unboundVariable_faults() {
        assertEquals(EvaluationException.Kind.UNBOUND_VARIABLE, faultOf(new Expr.Variable("undefined_name")));
    }

    @Test
    void literals() {
        assertEquals(Value.unit(), run("val main = ()"));
        assertEquals("Ok", run("val main = 'Ok").asLabel());
        assertEquals(42L, eval(new Expr.IntLit(42, true)).asInt());
    }

    // -------------------------
    // Functions
    // -------------------------

    @Test
    void lambda_capturesDefiningEnvironment() {
        Value v = run(
                "val main =",
                "  let k = 10 in",
                "  let add = fn (x : Int) x + k in",
                "  let k = 1000 in",
                "  add 5");
        assertEquals(15L, v.asInt());
    }

    @Test
    void application_evaluatesArgumentBeforeFunction() {
        Value chans = Value.Channel.newPair();
        Map<String, Value> host = new LinkedHashMap<>();
        host.put("out", chans.asPair().first);

        Value v = new LdgvScript().run(
                "val main = (let c = send out 'F in fn (x : Int) x) (let c = send out 'A in 5)", host);

        assertEquals(5L, v.asInt());
        Value.Channel in = chans.asPair().second.asChannel();
        assertEquals(Value.label("A"), in.readQueue.poll());
        assertEquals(Value.label("F"), in.readQueue.poll());
    }

    @Test
    void application_ofNonFunction_faults() {
        Expr.ExprInterface app = new Expr.Application(new Expr.IntLit(3), new Expr.IntLit(4));
        assertEquals(EvaluationException.Kind.TYPE_MISMATCH, faultOf(app));
    }

    @Test
    void higherOrderFunctions() {
        Value v = run(
                "val twice (f : Int -> Int) (x : Int) : Int = f (f x)",
                "val main = twice (fn (n : Int) n * 3) 2");
        assertEquals(18L, v.asInt());
    }

    // -------------------------
    // Case
    // -------------------------

    @Test
    void case_dispatchesOnLabel() {
        assertEquals(2L, run("val main = case 'B of { 'A : 1, 'B : 2 }").asInt());
        assertEquals(1L, run("val main = let l = 'A in case l of { 'A : 1, 'B : 2 }").asInt());
    }

    @Test
    void case_withoutMatchingBranch_faults() {
        EvaluationException ex = assertThrows(EvaluationException.class,
                () -> run("val main = case 'C of { 'A : 1, 'B : 2 }"));
        assertEquals(EvaluationException.Kind.NO_MATCHING_CASE, ex.kind());
    }

    @Test
    void case_onNonLabel_faults() {
        EvaluationException ex = assertThrows(EvaluationException.class,
                () -> run("val main = case 1 of { 'A : 1 }"));
        assertEquals(EvaluationException.Kind.TYPE_MISMATCH, ex.kind());
    }

    @Test
    void case_onlyEvaluatesTheChosenBranch() {
        assertEquals(1L, run("val main = case 'A of { 'A : 1, 'B : fst 5 }").asInt());
    }

    // -------------------------
    // natrec
    // -------------------------

    @Test
    void natrec_factorialOfThree() {
        Expr.ExprInterface fact = new Expr.NatRec(new Expr.IntLit(3), new Expr.IntLit(1), "n", "lower",
                new Expr.Arith(BinaryOp.TIMES, new Expr.Variable("n"), new Expr.Variable("lower")));
        assertEquals(6L, eval(fact).asInt());
    }

    @Test
    void natrec_zeroIndex_skipsStepCase() {
        // the step case would fault if it were evaluated
        Expr.ExprInterface rec = new Expr.NatRec(new Expr.IntLit(0), new Expr.IntLit(1), "n", "lower",
                new Expr.Fst(new Expr.IntLit(5)));
        assertEquals(1L, eval(rec).asInt());
    }

    @Test
    void natrec_fromSource() {
        Value v = run(
                "val sum (n : Nat) : Nat = natrec n { zero => 0, succ k . acc : Nat => k + acc }",
                "val main = sum 10");
        assertEquals(55L, v.asInt());
    }

    @Test
    void natrec_negativeIndex_faults() {
        Expr.ExprInterface rec = new Expr.NatRec(new Expr.IntLit(-1), new Expr.IntLit(1), "n", "lower",
                new Expr.Variable("lower"));
        assertEquals(EvaluationException.Kind.NEGATIVE_RECURSION_INDEX, faultOf(rec));
    }

    @Test
    void natrec_canBuildFunctions() {
        // natrec producing a closure: add n = natrec n { zero => id, succ k . f => fn x. succ (f x) }
        Value v = run(
                "val add (n : Nat) : Nat -> Nat =",
                "  natrec n { zero => fn (x : Nat) x, succ k . f => fn (x : Nat) succ (f x) }",
                "val main = add 4 3");
        assertEquals(7L, v.asInt());
    }

    @Test
    void natrec_zeroCaseSeesIndexZero_onceUnfolded() {
        assertEquals(0L, run("val main = let n = 3 in natrec n { zero => n, succ n . r => r }").asInt());
        // nothing unfolds for a zero index, so the outer binding is visible
        assertEquals(3L, run("val main = let n = 3 in natrec 0 { zero => n, succ n . r => r }").asInt());
    }
}
