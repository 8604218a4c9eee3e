package com.cssast.ast;

public record Range(Location start, Location end) {

    /**
     * Zero-width range at the given point.
     */
    public static Range point(int line, int column) {
        Location location = new Location(line, column);
        return new Range(location, location);
    }
}
