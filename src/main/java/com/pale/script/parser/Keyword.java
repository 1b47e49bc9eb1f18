package com.pale.script.parser;

public enum Keyword {
    LET("let"),
    LAMBDA("lambda");

    public final String text;

    Keyword(String text) {
        this.text = text;
    }

    /** Exact match only; returns null for anything that is not a keyword. */
    static Keyword of(String s) {
        for (Keyword k : values()) {
            if (k.text.equals(s)) return k;
        }
        return null;
    }
}
