package com.cssast.walk;

/**
 * Directive returned by an {@link AstVisitor} to steer the walk.
 */
public enum WalkAction {
    /** Continue walking, which is the default */
    CONTINUE,

    /** Skip visiting the children of this node */
    SKIP,

    /** Stop the walk entirely */
    STOP
}
