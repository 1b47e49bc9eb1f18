package com.pale.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

import com.pale.debug.Debug;
import com.pale.script.parser.RunResult;

/**
 * Line-at-a-time read loop over a session engine.
 *
 * Every line is its own source ("<repl:N>"). Errors are printed and the loop
 * carries on; let bindings from earlier lines stay visible.
 */
public final class PaleRepl {

    public static final String PROMPT = "pale> ";

    private final PaleScript engine;
    private final BufferedReader in;
    private final PrintStream out;
    private final boolean json;

    public PaleRepl(PaleScript engine, BufferedReader in, PrintStream out, boolean json) {
        if (!engine.isSession()) {
            throw new IllegalArgumentException("The REPL needs a session engine (PaleScript.session())");
        }
        this.engine = engine;
        this.in = in;
        this.out = out;
        this.json = json;
    }

    /** Runs until EOF or {@code :quit}. Returns the number of lines that failed. */
    public int loop() throws IOException {
        int failures = 0;
        int lineNo = 0;
        while (true) {
            out.print(PROMPT);
            out.flush();

            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            lineNo++;

            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            if (trimmed.equals(":quit") || trimmed.equals(":q")) break;

            RunResult r = engine.run(line, "<repl:" + lineNo + ">");
            if (!r.ok()) failures++;

            if (json) {
                out.println(JsonReport.render(r));
            } else if (r.ok()) {
                out.println(r.output());
            } else {
                out.println("An error occurred: " + r.output());
            }
        }
        Debug.get().i("PaleRepl", "session ended after " + lineNo + " lines, " + failures + " failed");
        return failures;
    }
}
