package com.cssast.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A comment. The value is the raw body without the {@code /* *}{@code /} delimiters.
 */
public final class Comment implements AstNode {

    private String value;
    private final List<Mapping> mappings;

    public Comment(String value) {
        this(value, List.of());
    }

    public Comment(String value, List<Mapping> mappings) {
        this.value = Objects.requireNonNull(value, "value");
        this.mappings = new ArrayList<>(Objects.requireNonNull(mappings, "mappings"));
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public List<Mapping> getMappings() {
        return mappings;
    }

    @Override
    public String kind() {
        return "comment";
    }

    @Override
    public String toString() {
        return "Comment[" + value + "]";
    }
}
