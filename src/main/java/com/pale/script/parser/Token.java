package com.pale.script.parser;

import java.util.Objects;

public class Token {
    public final TokenType type;
    public final String lexeme;
    /** Set for LITERAL tokens only. */
    public final Value literal;
    /** Set for KEYWORD tokens only. */
    public final Keyword keyword;
    public final Location location;

    Token(TokenType type, String lexeme, Value literal, Keyword keyword, Location location) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.keyword = keyword;
        this.location = location;
    }

    public static Token start(Location at) { return new Token(TokenType.START_STATEMENT, "(", null, null, at); }
    public static Token end(Location at) { return new Token(TokenType.END_STATEMENT, ")", null, null, at); }
    public static Token keyword(Keyword k, Location at) { return new Token(TokenType.KEYWORD, k.text, null, k, at); }
    public static Token identifier(String name, Location at) { return new Token(TokenType.IDENTIFIER, name, null, null, at); }

    public static Token literal(String lexeme, Value v, Location at) {
        return new Token(TokenType.LITERAL, lexeme, v, null, at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type
                && lexeme.equals(other.lexeme)
                && Objects.equals(literal, other.literal)
                && keyword == other.keyword
                && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme, keyword, location);
    }

    @Override
    public String toString() {
        switch (type) {
            case LITERAL:
                return location + " " + literal.typeName() + " " + literal;
            case IDENTIFIER:
                return location + " Ident " + lexeme;
            default:
                return location + " " + type + (keyword == null ? "" : " " + keyword);
        }
    }
}
