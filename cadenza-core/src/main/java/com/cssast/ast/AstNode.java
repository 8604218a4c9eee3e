package com.cssast.ast;

import java.util.List;

/**
 * Base interface for all CSS AST nodes
 */
public sealed interface AstNode permits
    Rule,
    Declaration,
    Comment {

    /**
     * Discriminant for the node variant: {@code "rule"}, {@code "declaration"} or {@code "comment"}.
     */
    String kind();

    /**
     * Mappings recorded for this node so far. The list is owned by the node and only ever appended to.
     */
    List<Mapping> getMappings();
}
