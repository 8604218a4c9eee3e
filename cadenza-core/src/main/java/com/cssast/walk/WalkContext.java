package com.cssast.walk;

import com.cssast.ast.AstNode;

import java.util.List;

/**
 * Controls handed to an {@link AstVisitor} for the node currently being visited.
 */
public interface WalkContext {

    /**
     * Replaces the current node with another node. The replacement is visited next.
     */
    void replaceWith(AstNode node);

    /**
     * Replaces the current node with zero or more nodes, keeping sibling order. The inserted
     * nodes are visited before the walk moves past this position; an empty list removes the
     * node. Calling this again during the same visit replaces what the previous call inserted.
     */
    void replaceWith(List<? extends AstNode> nodes);
}
