package com.pale.script;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.pale.debug.Debug;
import com.pale.script.parser.Callable;
import com.pale.script.parser.Diagnostics;
import com.pale.script.parser.Lexer;
import com.pale.script.parser.Location;
import com.pale.script.parser.PaleException;
import com.pale.script.parser.Parser;
import com.pale.script.parser.RunResult;
import com.pale.script.parser.Scope;
import com.pale.script.parser.Statement;
import com.pale.script.parser.Token;
import com.pale.script.parser.UserFunction;
import com.pale.script.parser.Value;
import com.pale.script.parser.Var;

/**
 * Core Pale engine.
 *
 * - Parenthesized calls: (+ 1 2), (print $+ 1 2)
 * - Types: integer, floating, string, nil
 * - Intrinsics: print, +, -, *
 * - Bindings: (let ((x 1) (y 2)) (+ x y))
 * - Host definitions: values, Java callables and functions whose body is Pale source
 *
 * Scopes:
 *   host scope  : intrinsics + everything registered through define*(...)
 *   run scope   : child of the host scope, receives the let bindings of a run
 *
 * A plain engine creates a new run scope for every call of run/eval. A
 * {@link #session()} engine keeps one run scope, so bindings survive between
 * runs (the REPL relies on this).
 *
 * Instances are independent and not thread-safe.
 */
public class PaleScript {

    public static final String DEFAULT_SOURCE_NAME = "<provided>";

    private static final String TAG = "PaleScript";

    private final boolean persistent;
    private PrintStream out = System.out;
    private int maxNestingDepth = Parser.DEFAULT_MAX_DEPTH;

    private Scope hostScope;
    private Scope sessionScope;

    public PaleScript() {
        this(false);
    }

    private PaleScript(boolean persistent) {
        this.persistent = persistent;
    }

    /** An engine whose let bindings persist across runs. */
    public static PaleScript session() {
        return new PaleScript(true);
    }

    public boolean isSession() { return persistent; }

    /** Where {@code print} writes. Must be set before the first run or definition. */
    public void setOutput(PrintStream out) {
        if (hostScope != null) {
            throw new IllegalStateException("Output must be configured before the engine is first used");
        }
        this.out = (out == null) ? System.out : out;
    }

    public void setMaxNestingDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("depth must be positive");
        this.maxNestingDepth = depth;
    }

    public int getMaxNestingDepth() { return maxNestingDepth; }

    // ===================== HOST DEFINITIONS =====================

    /** Binds a plain value visible to every later run. */
    public void define(String name, Value value) {
        requireName(name);
        hostDefine(name, new Var(value));
    }

    /** Binds a Java callable visible to every later run. */
    public void defineFunction(String name, Callable fn) {
        requireName(name);
        if (fn == null) throw new IllegalArgumentException("fn must not be null");
        hostDefine(name, Var.of(fn));
    }

    /**
     * Binds a user function whose body is Pale source over the given
     * parameter names, e.g. {@code defineFunction("add3", List.of("a","b","c"), "(+ a b c)")}.
     *
     * @throws PaleException when the body does not parse
     */
    public UserFunction defineFunction(String name, List<String> params, String bodySource) {
        requireName(name);
        if (params == null) throw new IllegalArgumentException("params must not be null");

        String sourceName = "<" + name + ">";
        Location at = Location.startOf(sourceName);
        Scope bodyScope = host().child();
        List<Var> handles = new ArrayList<>(params.size());
        for (String p : params) {
            requireName(p);
            Var handle = Var.nil();
            bodyScope.define(p, handle, at);
            handles.add(handle);
        }

        List<Token> tokens = new Lexer(bodySource, sourceName).tokenize();
        Statement body = new Parser(tokens, bodyScope, at, maxNestingDepth).parse();

        UserFunction fn = new UserFunction(name, handles, body);
        hostDefine(name, Var.of(fn));
        return fn;
    }

    private void hostDefine(String name, Var handle) {
        Location at = Location.startOf("<host>");
        if (sessionScope != null && sessionScope.contains(name)) {
            throw new Diagnostics()
                    .error(at, "Shadowing is not currently allowed!")
                    .note(null, "`" + name + "` is already bound in this session.")
                    .toException();
        }
        host().define(name, handle, at);
        Debug.get().d(TAG, "host definition " + name + " = " + handle);
    }

    private static void requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    // ===================== RUNNING =====================

    /** Evaluates {@code source} and reports the outcome instead of throwing language errors. */
    public RunResult run(String source, String sourceName) {
        try {
            return RunResult.success(eval(source, sourceName));
        } catch (PaleException e) {
            Debug.get().d(TAG, "run of " + nameOf(sourceName) + " failed:\n" + e.getMessage());
            return RunResult.failure(e.diagnostics());
        }
    }

    public RunResult run(String source) {
        return run(source, DEFAULT_SOURCE_NAME);
    }

    /**
     * Lexes, parses and resolves {@code source}.
     *
     * @return a handle on the fully resolved value
     * @throws PaleException for any lexing, parsing or evaluation error
     */
    public Var eval(String source, String sourceName) {
        Statement statement = parse(source, sourceName);
        return statement.resolve().resolve();
    }

    /**
     * Lexes and parses without evaluating. Let bindings land in the run scope;
     * a session keeps them only when the whole source parsed.
     */
    public Statement parse(String source, String sourceName) {
        if (!persistent) return parseIn(host().child(), source, sourceName);

        Scope session = scope();
        Scope pending = session.child();
        Statement st = parseIn(pending, source, sourceName);
        session.absorb(pending);
        return st;
    }

    /**
     * Textual listing of the tokens and the statement tree. Parsing happens in
     * a throwaway scope so a later run of the same source is unaffected.
     *
     * @throws PaleException when the source does not lex or parse
     */
    public String dump(String source, String sourceName) {
        String name = nameOf(sourceName);
        List<Token> tokens = new Lexer(source, name).tokenize();

        StringBuilder sb = new StringBuilder("Tokens = [\n");
        for (Token t : tokens) sb.append("  ").append(t).append('\n');
        sb.append("]\nAst =\n");

        Statement st = new Parser(tokens, host().child(), Location.startOf(name), maxNestingDepth).parse();
        sb.append(st.toTree());
        return sb.toString();
    }

    /** The scope the next run parses into. For a session this is the same scope every time. */
    public Scope scope() {
        if (persistent) {
            if (sessionScope == null) sessionScope = host().child();
            return sessionScope;
        }
        return host().child();
    }

    private Statement parseIn(Scope scope, String source, String sourceName) {
        String name = nameOf(sourceName);
        List<Token> tokens = new Lexer(source, name).tokenize();
        return new Parser(tokens, scope, Location.startOf(name), maxNestingDepth).parse();
    }

    private Scope host() {
        if (hostScope == null) hostScope = new Scope(out);
        return hostScope;
    }

    private static String nameOf(String sourceName) {
        return (sourceName == null || sourceName.isEmpty()) ? DEFAULT_SOURCE_NAME : sourceName;
    }
}
