package com.pale.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared, mutable handle on one runtime value.
 *
 * Several Vars may point at the same cell: {@link #newRef()} aliases (a write
 * through one handle is visible through all of them), {@link #maybeClone()}
 * copies into a fresh cell.
 */
public final class Var {

    private static final class Cell {
        Value value;

        Cell(Value value) {
            this.value = value;
        }
    }

    private final Cell cell;

    public Var(Value value) {
        this(new Cell(value == null ? Value.nil() : value));
    }

    private Var(Cell cell) {
        this.cell = cell;
    }

    public static Var of(long i) { return new Var(Value.integer(i)); }
    public static Var of(double d) { return new Var(Value.floating(d)); }
    public static Var of(String s) { return new Var(Value.string(s)); }
    public static Var of(Callable c) { return new Var(Value.func(c)); }
    public static Var nil() { return new Var(Value.nil()); }

    public Value get() {
        return cell.value;
    }

    /** Overwrites the shared cell; every alias observes the new value. */
    public void set(Value value) {
        cell.value = (value == null) ? Value.nil() : value;
    }

    /** Aliases this handle. No copy is made. */
    public Var newRef() {
        return new Var(cell);
    }

    public boolean sharesCellWith(Var other) {
        return other != null && other.cell == cell;
    }

    /**
     * Copies the contents into a fresh cell.
     *
     * @throws IllegalStateException for statements and callables that cannot be copied
     */
    public Var maybeClone() {
        Value v = cell.value;
        switch (v.type) {
            case INTEGER:
            case FLOATING:
            case STRING:
            case NIL:
                return new Var(v);
            case LIST: {
                List<Var> items = new ArrayList<>();
                for (Var item : v.asList()) items.add(item.maybeClone());
                return new Var(Value.list(items));
            }
            case FUNC: {
                Optional<Callable> copy = v.asFunc().tryClone();
                if (copy.isEmpty()) {
                    throw new IllegalStateException("Tried to clone a function that does not support copying: " + v.asFunc());
                }
                return new Var(Value.func(copy.get()));
            }
            case ALIAS:
                return v.asAlias().maybeClone();
            case STATEMENT:
                throw new IllegalStateException("Tried to clone a statement at " + v.asStatement().location());
            default:
                throw new IllegalStateException("Unknown value type " + v.type);
        }
    }

    /**
     * Forces this handle to a concrete value. Statements are evaluated (and
     * memoized), aliases are followed, anything else resolves to itself.
     */
    public Var resolve() {
        Value v = cell.value;
        switch (v.type) {
            case STATEMENT:
                return v.asStatement().resolve();
            case ALIAS:
                return v.asAlias().resolve();
            default:
                return newRef();
        }
    }

    @Override
    public String toString() {
        return String.valueOf(cell.value);
    }
}
