package com.pale.script.parser;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

import com.pale.debug.Debug;

/** Built-in callables seeded into every default {@link Scope}. */
public final class Intrinsic implements Callable {

    public enum Op {
        ADD("+", "Addition"),
        SUBTRACT("-", "Subtraction"),
        MULTIPLY("*", "Multiplication"),
        PRINT("print", "Print");

        public final String symbol;
        final String title;

        Op(String symbol, String title) {
            this.symbol = symbol;
            this.title = title;
        }
    }

    private final Op op;
    private final PrintStream out;

    public Intrinsic(Op op, PrintStream out) {
        this.op = op;
        this.out = (out == null) ? System.out : out;
    }

    public Op op() {
        return op;
    }

    @Override
    public Var call(List<Var> args, Location calledAt) {
        switch (op) {
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
                return arithmetic(args, calledAt);
            case PRINT:
                return print(args, calledAt);
            default:
                throw new IllegalStateException("Unhandled intrinsic " + op);
        }
    }

    private Var arithmetic(List<Var> args, Location calledAt) {
        if (args.size() < 2) {
            throw new Diagnostics()
                    .error(calledAt, op.title + " requires at least two arguments!")
                    .note(null, "Got " + args.size() + ".")
                    .toException();
        }

        long acc = integerOperand(args.get(0), calledAt);
        for (int i = 1; i < args.size(); i++) {
            long next = integerOperand(args.get(i), calledAt);
            try {
                switch (op) {
                    case ADD: acc = Math.addExact(acc, next); break;
                    case SUBTRACT: acc = Math.subtractExact(acc, next); break;
                    case MULTIPLY: acc = Math.multiplyExact(acc, next); break;
                    default: throw new IllegalStateException("Not arithmetic: " + op);
                }
            } catch (ArithmeticException overflow) {
                throw new Diagnostics()
                        .error(calledAt, op.title + " overflowed the Integer range!")
                        .note(null, "Integers are 64-bit signed.")
                        .toException();
            }
        }
        Debug.get().t("Intrinsic", op.symbol + " at " + calledAt + " -> " + acc);
        return Var.of(acc);
    }

    private long integerOperand(Var arg, Location calledAt) {
        Value v = arg.resolve().get();
        if (v.type != Value.Type.INTEGER) {
            throw new Diagnostics()
                    .error(calledAt, "Incompatible types for `" + op.symbol + "`: expected an Integer but got `" + v.display() + "`!")
                    .note(null, "`" + v.display() + "` is a " + v.typeName() + ".")
                    .toException();
        }
        return v.asInteger();
    }

    private Var print(List<Var> args, Location calledAt) {
        if (args.size() != 1) {
            throw new Diagnostics()
                    .error(calledAt, "Print intrinsic requires only one argument!")
                    .note(null, "Try wrapping this in a statement with `$`.")
                    .toException();
        }
        out.println(args.get(0).resolve().get().display());
        return Var.of(0L);
    }

    @Override
    public Optional<Callable> tryClone() {
        return Optional.of(new Intrinsic(op, out));
    }

    @Override
    public String toString() {
        return "Intrinsic(" + op.symbol + ")";
    }
}
