package com.cssast.ast;

/**
 * Associates a span of the original input with a span of the generated output.
 *
 * @param source      span in the original input, {@code null} when the origin is unknown
 * @param destination span in the generated output, {@code null} when the node was not printed
 */
public record Mapping(Range source, Range destination) {

    public static Mapping destinationOnly(Range destination) {
        return new Mapping(null, destination);
    }
}
