package com.cssast.walk;

import com.cssast.ast.AstNode;
import com.cssast.ast.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Depth-first, pre-order traversal over a mutable forest of {@link AstNode}s.
 *
 * <p>Visitors may rewrite the tree while it is being walked. Replacement splices the new nodes
 * into the containing list at the current index and the walk resumes at that same index, so
 * every inserted node is visited (and may itself be replaced) before its following siblings.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Walker.walk(ast, (node, ctx) -> {
 *     if (node instanceof Declaration decl && decl.getProperty().equals("--tw-sort")) {
 *         ctx.replaceWith(List.of());
 *     }
 *     return WalkAction.CONTINUE;
 * });
 * }</pre>
 */
public final class Walker {

    private static final Logger LOG = LoggerFactory.getLogger(Walker.class);

    private Walker() {
        // Utility class
    }

    /**
     * Walks the given forest. The list must be mutable if the visitor replaces nodes.
     *
     * @param ast     the top-level nodes
     * @param visitor callback invoked once per node encounter
     */
    public static void walk(List<AstNode> ast, AstVisitor visitor) {
        walkNodes(ast, visitor);
    }

    /**
     * @return false if the visitor asked to stop
     */
    private static boolean walkNodes(List<AstNode> nodes, AstVisitor visitor) {
        for (int i = 0; i < nodes.size(); i++) {
            AstNode node = nodes.get(i);
            Splice splice = new Splice(nodes, i);

            WalkAction action = visitor.visit(node, splice);
            if (action == null) {
                action = WalkAction.CONTINUE;
            }

            // Replacement is already applied, so stopping leaves the tree rewritten
            if (action == WalkAction.STOP) {
                return false;
            }

            if (splice.replaced) {
                // Revisit this index, which now holds the first replacement (or the next sibling)
                i--;
                continue;
            }

            if (action == WalkAction.SKIP) {
                continue;
            }

            if (node instanceof Rule rule && !walkNodes(rule.getNodes(), visitor)) {
                return false;
            }
        }
        return true;
    }

    private static final class Splice implements WalkContext {
        private final List<AstNode> nodes;
        private final int index;
        // Number of nodes currently occupying the splice point
        private int width = 1;
        private boolean replaced;

        Splice(List<AstNode> nodes, int index) {
            this.nodes = nodes;
            this.index = index;
        }

        @Override
        public void replaceWith(AstNode node) {
            replaceWith(List.of(node));
        }

        @Override
        public void replaceWith(List<? extends AstNode> replacement) {
            nodes.subList(index, index + width).clear();
            nodes.addAll(index, replacement);
            width = replacement.size();
            replaced = true;
            LOG.trace("Replaced node at index {} with {} node(s)", index, width);
        }
    }
}
