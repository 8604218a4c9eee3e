package com.cssast.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single {@code property: value} pair.
 */
public final class Declaration implements AstNode {

    private String property;
    private String value;  // Can be null
    private boolean important;
    private final List<Mapping> mappings;

    public Declaration(String property, String value) {
        this(property, value, List.of());
    }

    public Declaration(String property, String value, List<Mapping> mappings) {
        this.property = Objects.requireNonNull(property, "property");
        this.value = value;
        this.important = false;
        this.mappings = new ArrayList<>(Objects.requireNonNull(mappings, "mappings"));
    }

    public String getProperty() {
        return property;
    }

    public void setProperty(String property) {
        this.property = Objects.requireNonNull(property, "property");
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public boolean isImportant() {
        return important;
    }

    public void setImportant(boolean important) {
        this.important = important;
    }

    @Override
    public List<Mapping> getMappings() {
        return mappings;
    }

    @Override
    public String kind() {
        return "declaration";
    }

    @Override
    public String toString() {
        return "Declaration[" + property + ": " + value + (important ? "!important" : "") + "]";
    }
}
