package com.pale.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pale.debug.Debug;

/**
 * A parsed call: an operator handle, its argument handles and a result slot.
 *
 * The slot is filled by the first successful {@link #resolve()} and returned
 * unchanged by every later one, so side effects in the call happen once.
 */
public final class Statement {
    private final List<Var> args;
    private final Var op;
    private final Location location;
    private Var result;

    public Statement(Var op, List<Var> args, Location location) {
        if (!op.get().isFunc()) {
            throw new IllegalStateException("Statement operator must be callable, got " + op.get().typeName() + " at " + location);
        }
        this.op = op;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.location = location;
    }

    public List<Var> args() { return args; }
    public Var op() { return op; }
    public Location location() { return location; }

    /** The memoized result, or null when this statement has not been resolved yet. */
    public Var cachedResult() {
        return result;
    }

    public Var resolve() {
        if (result != null) return result;

        Debug.get().t("Statement", "resolving " + op.get() + " at " + location);
        Var r = op.get().asFunc().call(args, location);
        result = r;
        return r;
    }

    /** Clears the result slot of this statement and of every statement nested in its arguments. */
    public void rearm() {
        result = null;
        for (Var a : args) {
            Value v = a.get();
            if (v.isStatement()) v.asStatement().rearm();
        }
    }

    /** Indented tree listing used by the dump mode. */
    public String toTree() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        indent(sb, depth);
        sb.append("Statement ").append(op.get()).append(" @ ").append(location).append('\n');
        for (Var a : args) {
            Value v = a.get();
            if (v.isStatement()) {
                v.asStatement().appendTree(sb, depth + 1);
            } else {
                indent(sb, depth + 1);
                sb.append(v.typeName()).append(' ').append(v).append('\n');
            }
        }
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append("  ");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(op.get());
        for (Var a : args) sb.append(' ').append(a.get());
        return sb.append(')').toString();
    }
}
