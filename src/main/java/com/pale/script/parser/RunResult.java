package com.pale.script.parser;

/** Outcome of one run: either a resolved value or the diagnostics that stopped it. */
public class RunResult {
    private final Var value;
    private final Diagnostics diagnostics;

    private RunResult(Var value, Diagnostics diagnostics) {
        this.value = value;
        this.diagnostics = diagnostics;
    }

    public static RunResult success(Var value) {
        return new RunResult(value, null);
    }

    public static RunResult failure(Diagnostics diagnostics) {
        return new RunResult(null, diagnostics);
    }

    public boolean ok() { return diagnostics == null; }

    /** Null on failure. */
    public Var value() { return value; }

    /** Null on success. */
    public Diagnostics diagnostics() { return diagnostics; }

    /** The display form of the value, or the rendered diagnostics. */
    public String output() {
        return ok() ? value.get().display() : diagnostics.toString();
    }

    @Override
    public String toString() {
        return (ok() ? "ok: " : "error: ") + output();
    }
}
