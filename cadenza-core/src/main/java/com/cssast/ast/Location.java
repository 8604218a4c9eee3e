package com.cssast.ast;

/**
 * A point in text: 1-based line, 0-based column.
 */
public record Location(int line, int column) {
}
