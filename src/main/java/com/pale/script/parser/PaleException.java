package com.pale.script.parser;

/**
 * A lexing, parsing or evaluation error the user can fix.
 * The message is the rendered {@link Diagnostics}.
 */
public class PaleException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient Diagnostics diagnostics;

    public PaleException(Diagnostics diagnostics) {
        super(diagnostics.toString());
        this.diagnostics = diagnostics;
    }

    /** Shorthand for a single error with no notes. */
    public static PaleException at(Location location, String message) {
        return new PaleException(new Diagnostics().error(location, message));
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }
}
