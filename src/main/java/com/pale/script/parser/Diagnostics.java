package com.pale.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collection of errors tied to source locations.
 *
 * Each entry is a primary message plus any number of notes. Notes always
 * attach to the most recently added entry:
 *
 * <pre>
 *   new Diagnostics()
 *       .error(loc, "Unmatched closing parentheses!")
 *       .note(null, "Delete it.");
 * </pre>
 */
public final class Diagnostics {

    public static final class Entry {
        public final Location location;
        public final String message;
        private final List<String> notes = new ArrayList<>();

        Entry(Location location, String message) {
            this.location = location;
            this.message = message;
        }

        public List<String> notes() {
            return Collections.unmodifiableList(notes);
        }

        /** "file:line:col - message" */
        public String headline() {
            return location + " - " + message;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public Diagnostics error(Location location, String message) {
        entries.add(new Entry(location, message));
        return this;
    }

    /** Attach a note to the latest entry. Ignored when there is no entry yet. */
    public Diagnostics note(Location location, String text) {
        if (entries.isEmpty()) return this;
        Entry last = entries.get(entries.size() - 1);
        last.notes.add(location == null
                ? "NOTE: " + text
                : "NOTE: " + location + " - " + text);
        return this;
    }

    public Diagnostics extend(Diagnostics other) {
        if (other != null && other != this) entries.addAll(other.entries);
        return this;
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Convenience: wrap this collection in an exception ready to be thrown. */
    public PaleException toException() {
        return new PaleException(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < entries.size(); i++) {
            Entry e = entries.get(i);
            if (i > 0) sb.append('\n');
            sb.append(e.headline());
            for (String n : e.notes) sb.append("\n\t").append(n);
        }
        return sb.toString();
    }
}
