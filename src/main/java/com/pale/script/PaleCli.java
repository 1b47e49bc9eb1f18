package com.pale.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.pale.debug.Debug;
import com.pale.debug.DebugLevel;
import com.pale.script.parser.PaleException;
import com.pale.script.parser.RunResult;

/**
 * Command line front end.
 *
 * <pre>
 *   pale -c "(+ 34 35)"      evaluate the argument
 *   pale script.pale         evaluate a file
 *   pale                     interactive session on stdin
 *
 *   -d, --dump      print tokens and statement tree first
 *       --json      machine readable output
 *   -v, --verbose   debug log on stderr
 * </pre>
 *
 * Exit codes: 0 ok, 1 language error, 2 usage, 3 unreadable file.
 */
public final class PaleCli {

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: pale [-d|--dump] [--json] [-v|--verbose] [-c <source> | <script-file>]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /** Entry point without System.exit, so it can be driven from tests. */
    public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        boolean command = false;
        boolean dump = false;
        boolean json = false;
        String input = null;

        for (String a : args) {
            switch (a) {
                case "-c":
                case "--command":
                    command = true;
                    break;
                case "-d":
                case "--dump":
                    dump = true;
                    break;
                case "--json":
                    json = true;
                    break;
                case "-v":
                case "--verbose":
                    Debug.useSysErr(DebugLevel.DEBUG);
                    break;
                case "-h":
                case "--help":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    if (a.startsWith("-") && a.length() > 1) {
                        err.println("Unknown option: " + a);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    if (input != null) {
                        err.println("Only one input may be given.");
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    input = a;
            }
        }

        if (command && input == null) {
            err.println("A command must be provided!");
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (input == null) {
            PaleScript session = PaleScript.session();
            session.setOutput(out);
            BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            try {
                new PaleRepl(session, reader, out, json).loop();
                return EXIT_OK;
            } catch (IOException e) {
                err.println("Failed to read standard input: " + e.getMessage());
                return EXIT_IO;
            }
        }

        final String source;
        final String sourceName;
        if (command) {
            source = input;
            sourceName = PaleScript.DEFAULT_SOURCE_NAME;
        } else {
            Path path = Path.of(input);
            try {
                source = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Failed to read script file: " + path);
                Debug.get().e("PaleCli", "read failed", e);
                return EXIT_IO;
            }
            sourceName = input;
        }

        PaleScript engine = new PaleScript();
        engine.setOutput(out);

        if (dump) {
            try {
                out.println(engine.dump(source, sourceName));
            } catch (PaleException e) {
                // the run below reports the same error
                Debug.get().d("PaleCli", "dump failed: " + e.getMessage());
            }
        }

        RunResult r = engine.run(source, sourceName);
        if (json) {
            out.println(JsonReport.render(r));
        } else if (r.ok()) {
            out.println(r.output());
        } else {
            err.println("An error occurred: " + r.output());
        }
        return r.ok() ? EXIT_OK : EXIT_SCRIPT_ERROR;
    }

    private PaleCli() {}
}
