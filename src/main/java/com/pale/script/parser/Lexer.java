package com.pale.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.pale.debug.Debug;

/**
 * Turns source text into a flat token list.
 *
 * Three modes: normal text, inside a string literal, inside a {* block comment *}.
 * One character of lookback detects the two-character delimiters {@code //},
 * {@code {*} and {@code *}}.
 *
 * {@code $} opens an implicit statement that is closed by the next {@code )}
 * (or by the end of input), so {@code (print $+ 1 2)} reads as
 * {@code (print (+ 1 2))}.
 */
public class Lexer {
    private enum Mode { NORMAL, STRING, COMMENT }

    private static final String TAG = "Lexer";

    private static final Pattern WHOLE = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

    private final String source;
    private final String filename;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder buffer = new StringBuilder();

    private Mode mode = Mode.NORMAL;
    private int pendingWraps = 0;
    private char previous = '\0';
    private Location bufferStart;
    private Location stringStart;
    private Location commentStart;
    private int line = 1;
    private int column = 0;
    private boolean consumed = false;

    public Lexer(String source, String filename) {
        this.source = (source == null) ? "" : source;
        this.filename = filename;
    }

    public List<Token> tokenize() {
        if (consumed) throw new IllegalStateException("Lexer instances are single use");
        consumed = true;

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            column++;
            switch (mode) {
                case STRING:
                    scanString(c);
                    break;
                case COMMENT:
                    scanComment(c);
                    break;
                default:
                    if (c == '/' && previous == '/') {
                        dropLastBuffered();
                        flush();
                        previous = '\0';
                        // discard up to (not including) the line break
                        while (i + 1 < source.length() && source.charAt(i + 1) != '\n') {
                            i++;
                            column++;
                        }
                    } else {
                        scanNormal(c);
                    }
            }
            if (c == '\n') {
                line++;
                column = 0;
            }
            i++;
        }

        if (mode == Mode.STRING) {
            throw new Diagnostics()
                    .error(stringStart, "Unterminated string literal!")
                    .note(null, "Add a closing `\"`.")
                    .toException();
        }
        if (mode == Mode.COMMENT) {
            throw new Diagnostics()
                    .error(commentStart, "Unterminated block comment!")
                    .note(null, "Close it with `*}`.")
                    .toException();
        }

        flush();
        closeWraps(new Location(filename, line, column + 1));

        Debug.get().t(TAG, "tokenized " + filename + ": " + tokens.size() + " tokens");
        return tokens;
    }

    private void scanNormal(char c) {
        Location here = here();
        if (c == '*' && previous == '{') {
            dropLastBuffered();
            flush();
            mode = Mode.COMMENT;
            commentStart = new Location(filename, line, column - 1);
            // the opening '*' may also close: {*} is an empty comment
            previous = '*';
            return;
        }

        switch (c) {
            case '"':
                flush();
                mode = Mode.STRING;
                stringStart = here;
                break;
            case '(':
                flush();
                tokens.add(Token.start(here));
                break;
            case ')':
                flush();
                closeWraps(here);
                tokens.add(Token.end(here));
                break;
            case '$':
                flush();
                tokens.add(Token.start(here));
                pendingWraps++;
                break;
            default:
                if (Character.isWhitespace(c)) {
                    flush();
                } else {
                    if (buffer.length() == 0) bufferStart = here;
                    buffer.append(c);
                    previous = c;
                    return;
                }
        }
        previous = '\0';
    }

    private void scanString(char c) {
        if (c == '"') {
            String text = buffer.toString();
            buffer.setLength(0);
            tokens.add(Token.literal('"' + text + '"', Value.string(text), stringStart));
            mode = Mode.NORMAL;
            previous = '\0';
        } else {
            buffer.append(c);
        }
    }

    private void scanComment(char c) {
        if (c == '}' && previous == '*') {
            mode = Mode.NORMAL;
            previous = '\0';
        } else {
            previous = c;
        }
    }

    private void closeWraps(Location at) {
        for (int i = 0; i < pendingWraps; i++) tokens.add(Token.end(at));
        pendingWraps = 0;
    }

    private void dropLastBuffered() {
        if (buffer.length() > 0) buffer.setLength(buffer.length() - 1);
    }

    private void flush() {
        if (buffer.length() == 0) return;
        String text = buffer.toString();
        buffer.setLength(0);
        tokens.add(classify(text, bufferStart));
    }

    private Token classify(String text, Location at) {
        Keyword k = Keyword.of(text);
        if (k != null) return Token.keyword(k, at);

        if (WHOLE.matcher(text).matches()) {
            try {
                return Token.literal(text, Value.integer(Long.parseLong(text)), at);
            } catch (NumberFormatException e) {
                throw new Diagnostics()
                        .error(at, "Integer literal is out of range!")
                        .note(null, "Integers are 64-bit signed.")
                        .toException();
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return Token.literal(text, Value.floating(Double.parseDouble(text)), at);
        }
        if ("nil".equals(text)) {
            return Token.literal(text, Value.nil(), at);
        }
        return Token.identifier(text, at);
    }

    private Location here() {
        return new Location(filename, line, column);
    }
}
