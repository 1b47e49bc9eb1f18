package com.pale.script.parser;

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Identifier name -> shared value handle.
 *
 * A scope only grows. Defining a name that is already visible (here or in a
 * parent) is a shadowing error.
 */
public class Scope {
    public final Scope parent;
    private final Map<String, Var> vars = new LinkedHashMap<>();

    /** A fresh scope seeded with the intrinsics, printing to stdout. */
    public Scope() {
        this(System.out);
    }

    /** A fresh scope seeded with the intrinsics; {@code print} writes to {@code out}. */
    public Scope(PrintStream out) {
        this.parent = null;
        for (Intrinsic.Op op : Intrinsic.Op.values()) {
            vars.put(op.symbol, Var.of(new Intrinsic(op, out)));
        }
    }

    private Scope(Scope parent) {
        this.parent = parent;
    }

    /** An empty scope layered over this one. */
    public Scope child() {
        return new Scope(this);
    }

    /** The handle bound to {@code name}, or null. The handle itself is returned, not an alias. */
    public Var lookup(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            Var v = s.vars.get(name);
            if (v != null) return v;
        }
        return null;
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    /**
     * Binds {@code name} in this scope.
     *
     * @throws PaleException when the name is already visible
     */
    public void define(String name, Var value, Location at) {
        if (contains(name)) {
            throw new Diagnostics()
                    .error(at, "Shadowing is not currently allowed!")
                    .note(null, "Change its name.")
                    .toException();
        }
        vars.put(name, value);
    }

    /**
     * Moves the bindings of {@code child}, a direct child of this scope, into
     * this scope. Their names were checked against this scope when the child
     * defined them.
     */
    public void absorb(Scope child) {
        if (child == null || child.parent != this) {
            throw new IllegalArgumentException("Only a direct child scope can be absorbed");
        }
        vars.putAll(child.vars);
        child.vars.clear();
    }

    /** Names bound directly in this scope, in definition order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(vars.keySet());
    }
}
