import com.pale.script.PaleScript;
import com.pale.script.parser.PaleException;
import com.pale.script.parser.RunResult;
import com.pale.script.parser.Statement;
import com.pale.script.parser.UserFunction;
import com.pale.script.parser.Value;
import com.pale.script.parser.Var;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PaleScriptTest {

    private static final String NL = System.lineSeparator();

    private ByteArrayOutputStream printed;
    private PaleScript ps;

    @BeforeEach
    void setUp() {
        printed = new ByteArrayOutputStream();
        ps = new PaleScript();
        ps.setOutput(new PrintStream(printed, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return printed.toString(StandardCharsets.UTF_8);
    }

    private String ok(String src) {
        RunResult r = ps.run(src);
        assertTrue(r.ok(), () -> "expected success, got: " + r.output());
        return r.output();
    }

    private String fail(String src) {
        RunResult r = ps.run(src);
        assertFalse(r.ok(), () -> "expected failure, got: " + r.output());
        return r.output();
    }

    @Test
    void arithmetic_basics() {
        assertEquals("69", ok("(+ 34 35)"));
        assertEquals("69", ok("(+ 34 (+ 34 1))"));
        assertEquals("24", ok("(* 2 3 4)"));
        assertEquals("5", ok("(- 10 3 2)"));
        assertEquals("-3", ok("(- 0 3)"));
    }

    @Test
    void outerParenthesesAreOptional() {
        assertEquals("69", ok("+ 34 35"));
        assertEquals("3", ok("((+ 1 2))"));
    }

    @Test
    void print_writesDisplayFormAndReturnsZero() {
        assertEquals("0", ok("(print \"hello there\")"));
        ok("(print 1.5)");
        ok("(print nil)");
        ok("(print $+ 1 2)");

        assertEquals("hello there" + NL + "1.5" + NL + "nil" + NL + "3" + NL, printed());
    }

    @Test
    void print_withoutOuterParens_usesDollarSugar() {
        assertEquals("0", ok("print $+ 1 2"));
        assertEquals("3" + NL, printed());
    }

    @Test
    void nestedPrints_runInArgumentOrder() {
        assertEquals("0", ok("(+ (print 1) (print 2))"));
        assertEquals("1" + NL + "2" + NL, printed());
    }

    @Test
    void print_arity() {
        String out = fail("(print 1 2)");
        assertEquals("<provided>:1:2 - Print intrinsic requires only one argument!"
                + "\n\tNOTE: Try wrapping this in a statement with `$`.", out);

        assertTrue(fail("(print)").contains("Print intrinsic requires only one argument!"));
    }

    @Test
    void arithmetic_typeMismatch() {
        String out = fail("(+ 1 \"a\")");
        assertEquals("<provided>:1:2 - Incompatible types for `+`: expected an Integer but got `a`!"
                + "\n\tNOTE: `a` is a String.", out);

        assertTrue(fail("(- 1 2.5)").contains("got `2.5`"));
        assertTrue(fail("(* nil 2)").contains("`nil` is a Nil."));
    }

    @Test
    void arithmetic_needsTwoArguments() {
        assertTrue(fail("(+ 1)").contains("Addition requires at least two arguments!"));
        assertTrue(fail("(*)").contains("Multiplication requires at least two arguments!"));
    }

    @Test
    void arithmetic_overflowIsReported() {
        assertTrue(fail("(* 9223372036854775807 2)").contains("Multiplication overflowed the Integer range!"));
        assertTrue(fail("(+ 9223372036854775807 1)").contains("Addition overflowed"));
    }

    @Test
    void let_bindsLiteralsForTheBody() {
        assertEquals("3", ok("(let ((x 1)) (+ x 2))"));
        assertEquals("30", ok("(let ((x 5) (y 6)) (* x y))"));
        assertEquals("0", ok("(let ((s \"hi\")) (print s))"));
        assertEquals("hi" + NL, printed());
    }

    @Test
    void let_bareNameBindsNil() {
        assertEquals("0", ok("(let (x) (print x))"));
        assertEquals("nil" + NL, printed());
    }

    @Test
    void let_canAliasAFunction() {
        assertEquals("0", ok("(let ((p print)) (p 7))"));
        assertEquals("7" + NL, printed());
    }

    @Test
    void let_spanningLines() {
        String src = String.join("\n",
                "(let ((width 6)",
                "      (height 7)) // sizes",
                "  {* the area *}",
                "  (* width height))");
        assertEquals("42", ok(src));
    }

    @Test
    void bindingsDoNotOutliveARun_onPlainEngine() {
        ok("(let ((x 2)) x)");
        assertEquals("<provided>:1:4 - Unknown identifier `x`!", fail("(* x 10)"));
    }

    @Test
    void session_keepsBindingsAcrossRuns() {
        PaleScript s = PaleScript.session();
        s.setOutput(new PrintStream(printed, true, StandardCharsets.UTF_8));

        assertEquals("3", s.run("(let ((x 2)) (+ x 1))").output());
        assertEquals("20", s.run("(* x 10)").output());

        RunResult again = s.run("(let ((x 3)) x)");
        assertFalse(again.ok());
        assertTrue(again.output().contains("Shadowing is not currently allowed!"));
    }

    @Test
    void session_failedLetLeavesScopeUntouched() {
        PaleScript s = PaleScript.session();

        assertFalse(s.run("(let ((a 1) (b c)) a)").ok());
        assertFalse(s.scope().contains("a"));
        assertEquals("3", s.run("(let ((a 2)) (+ a 1))").output());
    }

    @Test
    void session_bodyFailingAfterBindings_dropsThem() {
        PaleScript s = PaleScript.session();

        RunResult failed = s.run("(let ((a 1)) (+ a nope))");
        assertFalse(failed.ok());
        assertTrue(failed.output().contains("Unknown identifier `nope`!"));
        assertFalse(s.scope().contains("a"));

        assertEquals("3", s.run("(let ((a 2)) (+ a 1))").output());
        assertEquals("20", s.run("(* a 10)").output());
    }

    @Test
    void unknownIdentifier_pointsAtTheName() {
        assertEquals("<provided>:1:2 - Unknown identifier `foo`!", fail("(foo 1)"));
    }

    @Test
    void sourceNameAppearsInLocations() {
        RunResult r = ps.run("\n  (+ 1 bar)", "demo.pale");
        assertEquals("demo.pale:2:8 - Unknown identifier `bar`!", r.output());
    }

    @Test
    void eval_returnsResolvedHandle() {
        Var v = ps.eval("(+ 2 2)", "x");
        assertEquals(Value.Type.INTEGER, v.get().type);
        assertEquals(4L, v.get().asInteger());
    }

    @Test
    void eval_throwsLanguageErrors() {
        PaleException e = assertThrows(PaleException.class, () -> ps.eval("(+ 1 \"a\")", "x"));
        assertEquals(1, e.diagnostics().entries().size());
    }

    @Test
    void resolve_isMemoized() {
        Statement st = ps.parse("(print 5)", "memo");
        Var first = st.resolve();
        Var second = st.resolve();

        assertSame(first, second);
        assertEquals("5" + NL, printed());
    }

    @Test
    void nestingDepth_isLimited() {
        ps.setMaxNestingDepth(10);
        String src = "1";
        for (int i = 0; i < 20; i++) src = "(+ 1 " + src + ")";

        String out = fail(src);
        assertTrue(out.contains("Statement nesting is too deep!"), out);
        assertTrue(out.contains("The limit is 10 levels."), out);
    }

    @Test
    void nestingDepth_defaultHandlesDeepButSaneInput() {
        String src = "1";
        for (int i = 0; i < 200; i++) src = "(+ 1 " + src + ")";
        assertEquals("201", ok(src));

        StringBuilder hostile = new StringBuilder();
        for (int i = 0; i < 5000; i++) hostile.append('(');
        hostile.append("+ 1 2");
        for (int i = 0; i < 5000; i++) hostile.append(')');
        assertTrue(fail(hostile.toString()).contains("Statement nesting is too deep!"));
    }

    // ===================== HOST DEFINITIONS =====================

    @Test
    void define_value() {
        ps.define("answer", Value.integer(42));
        assertEquals("43", ok("(+ answer 1)"));
    }

    @Test
    void defineFunction_javaCallable() {
        ps.defineFunction("neg", (args, at) -> Var.of(-args.get(0).resolve().get().asInteger()));
        assertEquals("-5", ok("(neg 5)"));
        assertEquals("-7", ok("(neg $+ 3 4)"));
    }

    @Test
    void defineFunction_paleBody_reusedAcrossCalls() {
        UserFunction add3 = ps.defineFunction("add3", List.of("a", "b", "c"), "(+ a b c)");
        assertEquals(3, add3.arity());

        assertEquals("6", ok("(add3 1 2 3)"));
        assertEquals("15", ok("(add3 4 5 6)"));
        assertEquals("9", ok("(+ (add3 1 1 1) (add3 2 2 2))"));
    }

    @Test
    void defineFunction_argumentsStayLazy() {
        ps.defineFunction("twice", List.of("x"), "(* x 2)");
        assertEquals("8", ok("(twice (+ 1 3))"));
    }

    @Test
    void defineFunction_arityErrors() {
        ps.defineFunction("add3", List.of("a", "b", "c"), "(+ a b c)");

        assertEquals("<provided>:1:2 - Insufficient arguments provided!"
                + "\n\tNOTE: add3 expects 3 arguments, got 2.", fail("(add3 1 2)"));
        assertEquals("<provided>:1:2 - Too many arguments provided!"
                + "\n\tNOTE: <provided>:1:2 - Delete them.", fail("(add3 1 2 3 4)"));
    }

    @Test
    void defineFunction_cannotShadow() {
        assertThrows(PaleException.class, () -> ps.define("print", Value.nil()));
        assertThrows(PaleException.class, () -> ps.defineFunction("f", List.of("+"), "(+ 1 2)"));

        ps.define("k", Value.integer(1));
        assertThrows(PaleException.class, () -> ps.define("k", Value.integer(2)));
    }

    @Test
    void defineFunction_badBodyIsReported() {
        PaleException e = assertThrows(PaleException.class,
                () -> ps.defineFunction("bad", List.of("a"), "(+ a b)"));
        assertEquals("<bad>:1:6 - Unknown identifier `b`!", e.getMessage());
    }

    @Test
    void defineFunction_rejectsEmptyName() {
        assertThrows(IllegalArgumentException.class, () -> ps.define(" ", Value.nil()));
        assertThrows(IllegalArgumentException.class, () -> ps.defineFunction("f", List.of(""), "(+ 1 2)"));
    }

    @Test
    void setOutput_afterFirstUse_isRejected() {
        ok("(+ 1 2)");
        assertThrows(IllegalStateException.class, () -> ps.setOutput(System.out));
    }

    @Test
    void dump_listsTokensAndTree_withoutBindingAnything() {
        PaleScript s = PaleScript.session();
        String dump = s.dump("(let ((x 1)) (+ x 2))", "d");

        assertTrue(dump.startsWith("Tokens = ["), dump);
        assertTrue(dump.contains("Ast =\nStatement Intrinsic(+) @ d:1:15"), dump);
        assertEquals("3", s.run("(let ((x 1)) (+ x 2))", "d").output());
    }
}
