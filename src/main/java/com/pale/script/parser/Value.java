package com.pale.script.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable runtime value. Mutation happens one level up, by storing a
 * different Value into a {@link Var}.
 */
public class Value {
    public enum Type { INTEGER, FLOATING, STRING, NIL, LIST, FUNC, STATEMENT, ALIAS }

    /** Two floats closer than this are considered equal. */
    public static final double FLOATING_EQ_RANGE = 0.001;

    private static final Value NIL = new Value(Type.NIL, null);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long i) { return new Value(Type.INTEGER, i); }
    public static Value floating(double d) { return new Value(Type.FLOATING, d); }
    public static Value string(String s) { return new Value(Type.STRING, s == null ? "" : s); }
    public static Value nil() { return NIL; }
    public static Value func(Callable c) { return new Value(Type.FUNC, c); }
    public static Value statement(Statement s) { return new Value(Type.STATEMENT, s); }
    public static Value alias(Var target) { return new Value(Type.ALIAS, target); }

    public static Value list(List<Var> items) {
        return new Value(Type.LIST, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public Type getType() { return type; }

    public boolean isFunc() { return type == Type.FUNC; }
    public boolean isStatement() { return type == Type.STATEMENT; }

    public long asInteger() {
        if (type != Type.INTEGER) throw new IllegalStateException("Expected integer, got " + type);
        return (long) value;
    }

    public double asFloating() {
        if (type != Type.FLOATING) throw new IllegalStateException("Expected floating, got " + type);
        return (double) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    public Callable asFunc() {
        if (type != Type.FUNC) throw new IllegalStateException("Expected function, got " + this);
        return (Callable) value;
    }

    public Statement asStatement() {
        if (type != Type.STATEMENT) throw new IllegalStateException("Expected statement, got " + type);
        return (Statement) value;
    }

    public Var asAlias() {
        if (type != Type.ALIAS) throw new IllegalStateException("Expected alias, got " + type);
        return (Var) value;
    }

    @SuppressWarnings("unchecked")
    public List<Var> asList() {
        if (type != Type.LIST) throw new IllegalStateException("Expected list, got " + type);
        return (List<Var>) value;
    }

    /** Human readable type name used in diagnostics. */
    public String typeName() {
        switch (type) {
            case INTEGER: return "Integer";
            case FLOATING: return "Floating";
            case STRING: return "String";
            case NIL: return "Nil";
            case LIST: return "List";
            case FUNC: return "Function";
            case STATEMENT: return "Statement";
            case ALIAS: return asAlias().get().typeName();
            default: return type.name();
        }
    }

    /**
     * Display form: what {@code print} writes and what a run returns.
     * An unresolved statement is not forced here.
     */
    public String display() {
        switch (type) {
            case INTEGER:
                return Long.toString(asInteger());
            case FLOATING:
                return plainDecimal(asFloating());
            case STRING:
                return asString();
            case NIL:
                return "nil";
            case LIST: {
                StringBuilder sb = new StringBuilder("(");
                List<Var> items = asList();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(' ');
                    sb.append(items.get(i).get().display());
                }
                return sb.append(')').toString();
            }
            case FUNC:
                return "<Function>";
            case STATEMENT: {
                Var cached = asStatement().cachedResult();
                return (cached == null) ? "<Statement>" : cached.get().display();
            }
            case ALIAS:
                return asAlias().get().display();
            default:
                throw new IllegalStateException("Unknown value type " + type);
        }
    }

    /** Shortest round-tripping digits, never in exponent form: 1e20 prints as 100000000000000000000. */
    static String plainDecimal(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return (1.0 / d < 0) ? "-0" : "0";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case FLOATING:
                return Math.abs(asFloating() - other.asFloating()) < FLOATING_EQ_RANGE;
            case FUNC:
                // functions have no structural equality
                return false;
            case STATEMENT:
            case ALIAS:
                return value == other.value;
            case NIL:
                return true;
            case LIST: {
                List<Var> a = asList();
                List<Var> b = other.asList();
                if (a.size() != b.size()) return false;
                for (int i = 0; i < a.size(); i++) {
                    if (!a.get(i).get().equals(b.get(i).get())) return false;
                }
                return true;
            }
            default:
                return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case INTEGER:
            case STRING:
                return 31 * type.hashCode() + value.hashCode();
            case STATEMENT:
            case ALIAS:
                return 31 * type.hashCode() + System.identityHashCode(value);
            default:
                // epsilon equality for floats rules out a value based hash
                return type.hashCode();
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING: return '"' + asString() + '"';
            case FUNC: return asFunc().toString();
            case STATEMENT: return asStatement().toString();
            case ALIAS: return "&" + asAlias().get();
            default: return display();
        }
    }
}
