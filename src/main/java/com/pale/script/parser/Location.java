package com.pale.script.parser;

import java.util.Objects;

/** A point in a named source. Lines and columns start at 1. */
public final class Location {
    public final String filename;
    public final int line;
    public final int column;

    public Location(String filename, int line, int column) {
        this.filename = (filename == null) ? "<unknown>" : filename;
        this.line = line;
        this.column = column;
    }

    /** The location used for a whole source before any token is known. */
    public static Location startOf(String filename) {
        return new Location(filename, 1, 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location other = (Location) o;
        return line == other.line && column == other.column && filename.equals(other.filename);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, line, column);
    }

    @Override
    public String toString() {
        return filename + ":" + line + ":" + column;
    }
}
