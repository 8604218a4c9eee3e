package com.cssast;

import com.cssast.ast.AstNode;
import com.cssast.ast.Comment;
import com.cssast.ast.Declaration;
import com.cssast.ast.Mapping;
import com.cssast.ast.Range;
import com.cssast.ast.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints a forest of {@link AstNode}s as CSS text, two spaces of indentation per nesting level.
 *
 * <p>Structural special cases:</p>
 * <ul>
 *   <li>{@code @at-root} rules print nothing in place; their children are appended after the
 *       rest of the output, at the top level.</li>
 *   <li>{@code @tailwind utilities} rules are transparent: their children print at the
 *       current depth without a wrapping block.</li>
 *   <li>At-rules without children print as statements ({@code @layer a, b;}).</li>
 *   <li>Top-level {@code @property} rules print once per selector.</li>
 *   <li>{@code --tw-sort} declarations and declarations without a value never print.</li>
 * </ul>
 *
 * <p>Each call uses a fresh printer, so the hoisted content, the seen {@code @property}
 * selectors and the output cursor never leak between calls.</p>
 */
public final class CssPrinter {

    private static final Logger LOG = LoggerFactory.getLogger(CssPrinter.class);

    static final String AT_ROOT = "@at-root";
    static final String TAILWIND_UTILITIES = "@tailwind utilities";
    static final String AT_PROPERTY_PREFIX = "@property ";
    static final String SORT_PROPERTY = "--tw-sort";

    private static final String INDENT = "  ";

    private final boolean trackDestination;
    private final StringBuilder css = new StringBuilder();
    private final List<AstNode> atRoots = new ArrayList<>();
    private final Set<String> seenAtProperties = new HashSet<>();

    // Output line the next printed node starts on
    private int line = 1;

    private CssPrinter(PrintOptions options) {
        this.trackDestination = options.trackDestination();
    }

    public static String toCss(List<AstNode> ast) {
        return toCss(ast, PrintOptions.DEFAULT);
    }

    /**
     * Prints the forest. With destination tracking enabled, appends one mapping to every node
     * that produced output.
     *
     * @param ast     the top-level nodes
     * @param options printer options
     * @return the CSS text, every statement newline-terminated
     */
    public static String toCss(List<AstNode> ast, PrintOptions options) {
        CssPrinter printer = new CssPrinter(options);
        printer.printAll(ast, 0);
        printer.flushAtRoots();
        return printer.css.toString();
    }

    private void flushAtRoots() {
        // Hoisted content may itself contain @at-root rules, so drain until nothing is left
        while (!atRoots.isEmpty()) {
            List<AstNode> batch = new ArrayList<>(atRoots);
            atRoots.clear();
            LOG.debug("Printing {} hoisted @at-root node(s)", batch.size());
            printAll(batch, 0);
        }
    }

    private void printAll(List<AstNode> nodes, int depth) {
        for (AstNode node : nodes) {
            print(node, depth);
        }
    }

    private void print(AstNode node, int depth) {
        String indent = INDENT.repeat(depth);

        if (node instanceof Rule rule) {
            printRule(rule, depth, indent);
        } else if (node instanceof Comment comment) {
            record(comment, indent);
            css.append(indent).append("/*").append(comment.getValue()).append("*/\n");
            advance(1 + countNewlines(comment.getValue()));
        } else if (node instanceof Declaration decl) {
            if (decl.getProperty().equals(SORT_PROPERTY) || decl.getValue() == null) {
                return;
            }
            record(decl, indent);
            css.append(indent)
               .append(decl.getProperty())
               .append(": ")
               .append(decl.getValue())
               .append(decl.isImportant() ? "!important" : "")
               .append(";\n");
            advance(1 + countNewlines(decl.getValue()));
        }
    }

    private void printRule(Rule rule, int depth, String indent) {
        String selector = rule.getSelector();

        if (selector.equals(AT_ROOT)) {
            atRoots.addAll(rule.getNodes());
            return;
        }

        if (selector.equals(TAILWIND_UTILITIES)) {
            printAll(rule.getNodes(), depth);
            return;
        }

        // At-rules without children are statements, e.g. `@layer base, components;`
        if (rule.isAtRule() && rule.getNodes().isEmpty()) {
            record(rule, indent);
            css.append(indent).append(selector).append(";\n");
            advance(1);
            return;
        }

        if (depth == 0 && selector.startsWith(AT_PROPERTY_PREFIX) && !seenAtProperties.add(selector)) {
            LOG.debug("Skipping duplicate {}", selector);
            return;
        }

        record(rule, indent);
        css.append(indent).append(selector).append(" {\n");
        advance(1);
        printAll(rule.getNodes(), depth + 1);
        css.append(indent).append("}\n");
        advance(1);
    }

    private void record(AstNode node, String indent) {
        if (trackDestination) {
            node.getMappings().add(Mapping.destinationOnly(Range.point(line, indent.length())));
        }
    }

    private void advance(int lines) {
        if (trackDestination) {
            line += lines;
        }
    }

    private static int countNewlines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
