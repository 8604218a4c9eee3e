package com.cssast.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A qualified rule ({@code .a { ... }}) or an at-rule ({@code @media ...}), told apart by the
 * leading {@code @} of the selector.
 */
public final class Rule implements AstNode {

    private String selector;
    private final List<AstNode> nodes;
    private final List<Mapping> mappings;

    public Rule(String selector, List<? extends AstNode> nodes) {
        this(selector, nodes, List.of());
    }

    public Rule(String selector, List<? extends AstNode> nodes, List<Mapping> mappings) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.nodes = new ArrayList<>(Objects.requireNonNull(nodes, "nodes"));
        this.mappings = new ArrayList<>(Objects.requireNonNull(mappings, "mappings"));
    }

    public String getSelector() {
        return selector;
    }

    public void setSelector(String selector) {
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    /**
     * Children in output order. Passes edit this list in place.
     */
    public List<AstNode> getNodes() {
        return nodes;
    }

    public boolean isAtRule() {
        return selector.startsWith("@");
    }

    @Override
    public List<Mapping> getMappings() {
        return mappings;
    }

    @Override
    public String kind() {
        return "rule";
    }

    @Override
    public String toString() {
        return "Rule[selector=" + selector + ", nodes=" + nodes + "]";
    }
}
