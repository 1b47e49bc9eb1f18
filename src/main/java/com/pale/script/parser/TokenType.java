package com.pale.script.parser;

public enum TokenType {
    START_STATEMENT,
    END_STATEMENT,
    KEYWORD,
    LITERAL,
    IDENTIFIER
}
