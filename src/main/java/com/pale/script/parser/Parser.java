package com.pale.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.pale.debug.Debug;

/**
 * Builds a {@link Statement} tree from tokens, resolving identifiers against a
 * {@link Scope} as it goes.
 *
 * Each parenthesized span is parsed by its own {@link SpanParser}; nested
 * spans are parsed recursively and become lazy STATEMENT arguments of the
 * enclosing call. {@code let} binding lists extend the scope in place.
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final String TAG = "Parser";

    private final List<Token> tokens;
    private final Scope scope;
    private final Location start;
    private final int maxDepth;

    public Parser(List<Token> tokens, Scope scope, Location start) {
        this(tokens, scope, start, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens, Scope scope, Location start, int maxDepth) {
        if (scope == null) throw new IllegalArgumentException("scope must not be null");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive");
        this.tokens = tokens;
        this.scope = scope;
        this.start = start;
        this.maxDepth = maxDepth;
    }

    public Statement parse() {
        return parseSpan(0, tokens.size(), start, 1);
    }

    private Statement parseSpan(int from, int to, Location startLoc, int depth) {
        if (depth > maxDepth) {
            throw new Diagnostics()
                    .error(startLoc, "Statement nesting is too deep!")
                    .note(null, "The limit is " + maxDepth + " levels.")
                    .toException();
        }
        return new SpanParser(from, to, startLoc, depth).parse();
    }

    /** Index of the END_STATEMENT matching the START_STATEMENT at {@code open}, or -1. */
    private int matching(int open, int to) {
        int depth = 0;
        for (int i = open; i < to; i++) {
            TokenType t = tokens.get(i).type;
            if (t == TokenType.START_STATEMENT) depth++;
            else if (t == TokenType.END_STATEMENT && --depth == 0) return i;
        }
        return -1;
    }

    private static PaleException rawList(Location at) {
        return new Diagnostics()
                .error(at, "Raw lists are not available (Yet...)!")
                .note(null, "This is not a function.")
                .toException();
    }

    private enum Status { ARGUMENTS, BINDINGS }

    private final class SpanParser {
        private int from;
        private int to;
        private Location startLoc;
        private final int depth;

        private final Deque<Integer> openStack = new ArrayDeque<>();
        private final List<Var> args = new ArrayList<>();
        private Location opLocation;

        private Status status = Status.ARGUMENTS;
        private int bindingOpen;
        private int bindingDepth;

        SpanParser(int from, int to, Location startLoc, int depth) {
            this.from = from;
            this.to = to;
            this.startLoc = startLoc;
            this.depth = depth;
        }

        Statement parse() {
            if (from < to
                    && tokens.get(from).type == TokenType.START_STATEMENT
                    && matching(from, to) == to - 1) {
                startLoc = tokens.get(from).location;
                from++;
                to--;
            }
            if (from >= to) {
                throw PaleException.at(startLoc, "Empty statements are not allowed!");
            }

            for (int i = from; i < to; i++) {
                Token tok = tokens.get(i);
                if (status == Status.BINDINGS) {
                    collectBindingToken(tok, i);
                    continue;
                }
                switch (tok.type) {
                    case START_STATEMENT:
                        openStack.push(i);
                        break;
                    case END_STATEMENT:
                        closeNested(tok, i);
                        break;
                    case KEYWORD:
                        if (openStack.isEmpty()) keyword(tok, i);
                        break;
                    case LITERAL:
                        if (openStack.isEmpty()) addArg(new Var(tok.literal), tok.location);
                        break;
                    case IDENTIFIER:
                        if (openStack.isEmpty()) addArg(resolveIdentifier(tok), tok.location);
                        break;
                    default:
                        throw new IllegalStateException("Unknown token type " + tok.type);
                }
            }

            if (status == Status.BINDINGS) {
                throw unmatchedOpening(tokens.get(bindingOpen).location);
            }
            if (!openStack.isEmpty()) {
                throw unmatchedOpening(tokens.get(openStack.pop()).location);
            }
            return finish();
        }

        private void closeNested(Token tok, int i) {
            if (openStack.isEmpty()) {
                throw new Diagnostics()
                        .error(tok.location, "Unmatched closing parentheses!")
                        .note(null, "Delete it.")
                        .toException();
            }
            int open = openStack.pop();
            if (openStack.isEmpty()) {
                Location at = tokens.get(open).location;
                Statement nested = parseSpan(open, i + 1, at, depth + 1);
                addArg(new Var(Value.statement(nested)), at);
            }
        }

        private void keyword(Token tok, int i) {
            switch (tok.keyword) {
                case LET:
                    if (i + 1 >= to || tokens.get(i + 1).type != TokenType.START_STATEMENT) {
                        throw new Diagnostics()
                                .error(tok.location, "`let` must be followed by a list of bindings!")
                                .note(null, "Write it as `(let ((name value)) ...)`.")
                                .toException();
                    }
                    status = Status.BINDINGS;
                    bindingOpen = i + 1;
                    bindingDepth = 0;
                    break;
                case LAMBDA:
                    throw new Diagnostics()
                            .error(tok.location, "Lambdas are not currently implemented!")
                            .toException();
                default:
                    throw new IllegalStateException("Unknown keyword " + tok.keyword);
            }
        }

        private void collectBindingToken(Token tok, int i) {
            if (tok.type == TokenType.START_STATEMENT) {
                bindingDepth++;
            } else if (tok.type == TokenType.END_STATEMENT) {
                bindingDepth--;
                if (bindingDepth == 0) {
                    introduce(new BindingList(bindingOpen + 1, i).collect());
                    status = Status.ARGUMENTS;
                }
            }
        }

        private Var resolveIdentifier(Token tok) {
            Var v = scope.lookup(tok.lexeme);
            if (v == null) {
                throw PaleException.at(tok.location, "Unknown identifier `" + tok.lexeme + "`!");
            }
            return v.newRef();
        }

        private void addArg(Var v, Location at) {
            if (args.isEmpty()) opLocation = at;
            args.add(v);
        }

        private Statement finish() {
            if (args.isEmpty()) throw rawList(startLoc);

            Var first = args.get(0);
            if (first.get().isFunc()) {
                return new Statement(first, args.subList(1, args.size()), opLocation);
            }
            if (args.size() == 1 && first.get().isStatement()) {
                return first.get().asStatement();
            }
            throw rawList(startLoc);
        }
    }

    private static PaleException unmatchedOpening(Location at) {
        return new Diagnostics()
                .error(at, "Unmatched opening parentheses!")
                .note(null, "Deleting it might fix this error.")
                .toException();
    }

    /** One {@code name value} pair of a let binding list, before it touches the scope. */
    private static final class Binding {
        final String name;
        final Location nameLoc;
        Value literal = Value.nil();
        String reference;
        Location referenceLoc;

        Binding(String name, Location nameLoc) {
            this.name = name;
            this.nameLoc = nameLoc;
        }
    }

    /** Reads the tokens between the parentheses of a binding list. */
    private final class BindingList {
        private final int from;
        private final int to;

        private boolean inSlot = false;
        private Location slotLoc;
        private Binding current;
        private boolean hasValue;

        BindingList(int from, int to) {
            this.from = from;
            this.to = to;
        }

        List<Binding> collect() {
            List<Binding> out = new ArrayList<>();
            for (int i = from; i < to; i++) {
                Token tok = tokens.get(i);
                if (tok.type == TokenType.KEYWORD) {
                    throw PaleException.at(tok.location, "Keywords are not allowed in variable assignments!");
                }
                if (inSlot) {
                    insideSlot(tok, out);
                } else {
                    outsideSlot(tok, out);
                }
            }
            return out;
        }

        private void outsideSlot(Token tok, List<Binding> out) {
            switch (tok.type) {
                case IDENTIFIER:
                    // a bare name binds nil
                    out.add(new Binding(tok.lexeme, tok.location));
                    break;
                case START_STATEMENT:
                    inSlot = true;
                    slotLoc = tok.location;
                    current = null;
                    hasValue = false;
                    break;
                case LITERAL:
                    throw new Diagnostics()
                            .error(tok.location, "Unknown literal in `let` statement.")
                            .note(null, "Bind it to a variable name.")
                            .note(tok.location, "Delete it.")
                            .toException();
                default:
                    throw new IllegalStateException("Unbalanced binding list at " + tok.location);
            }
        }

        private void insideSlot(Token tok, List<Binding> out) {
            switch (tok.type) {
                case START_STATEMENT:
                    if (current == null) {
                        throw PaleException.at(tok.location, "Variable names must be literals!");
                    }
                    if (!hasValue) {
                        throw PaleException.at(tok.location, "Variables must be literals or other values (not expressions)!");
                    }
                    throw new Diagnostics()
                            .error(tok.location, "Unknown opening parenthesis.")
                            .note(tok.location, "Delete it.")
                            .toException();
                case IDENTIFIER:
                    if (current == null) {
                        current = new Binding(tok.lexeme, tok.location);
                    } else if (!hasValue) {
                        current.reference = tok.lexeme;
                        current.referenceLoc = tok.location;
                        hasValue = true;
                    } else {
                        throw new Diagnostics()
                                .error(slotLoc, "Identifier not allowed here!")
                                .note(tok.location, "Remove it.")
                                .toException();
                    }
                    break;
                case LITERAL:
                    if (current == null) {
                        throw PaleException.at(tok.location, "Cannot assign to literal value!");
                    }
                    if (hasValue) {
                        throw new Diagnostics()
                                .error(tok.location, "Only one initial value is allowed!")
                                .note(tok.location, "Delete it.")
                                .toException();
                    }
                    current.literal = tok.literal;
                    hasValue = true;
                    break;
                case END_STATEMENT:
                    if (current == null) {
                        throw new Diagnostics()
                                .error(slotLoc, "Empty bindings are not allowed!")
                                .note(slotLoc, "Delete it.")
                                .toException();
                    }
                    if (!hasValue) {
                        throw new Diagnostics()
                                .error(slotLoc, "Variable defined in parentheses must have an initial value.")
                                .note(slotLoc, "Remove the parentheses around it.")
                                .toException();
                    }
                    out.add(current);
                    inSlot = false;
                    break;
                default:
                    throw new IllegalStateException("Unexpected token in binding " + tok);
            }
        }
    }

    /**
     * Second phase of a let: check every name, build every handle, and only
     * then touch the scope, so a failing binding list leaves it unchanged.
     */
    private void introduce(List<Binding> bindings) {
        Set<String> siblings = new HashSet<>();
        for (Binding b : bindings) {
            if (!siblings.add(b.name) || scope.contains(b.name)) {
                throw new Diagnostics()
                        .error(b.nameLoc, "Shadowing is not currently allowed!")
                        .note(null, "Change its name.")
                        .toException();
            }
        }

        List<Var> values = new ArrayList<>(bindings.size());
        for (Binding b : bindings) {
            if (b.reference == null) {
                values.add(new Var(b.literal));
                continue;
            }
            if (siblings.contains(b.reference)) {
                throw PaleException.at(b.referenceLoc,
                        "Making a variable depend upon another in the statement is not currently implemented!");
            }
            Var target = scope.lookup(b.reference);
            if (target == null) {
                throw PaleException.at(b.referenceLoc, "Unknown identifier `" + b.reference + "`!");
            }
            values.add(target.newRef());
        }

        for (int i = 0; i < bindings.size(); i++) {
            Binding b = bindings.get(i);
            scope.define(b.name, values.get(i), b.nameLoc);
            Debug.get().d(TAG, "let " + b.name + " = " + values.get(i) + " at " + b.nameLoc);
        }
    }
}
