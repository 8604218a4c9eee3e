package com.cssast.walk;

import com.cssast.ast.AstNode;

/**
 * Callback invoked by {@link Walker} for every node, in depth-first pre-order.
 */
@FunctionalInterface
public interface AstVisitor {

    /**
     * Visits a node.
     *
     * @param node    the node at the current position
     * @param context controls for rewriting the current position
     * @return how to proceed; {@code null} means {@link WalkAction#CONTINUE}
     */
    WalkAction visit(AstNode node, WalkContext context);
}
