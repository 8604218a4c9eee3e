package com.cssast.walk;

import com.cssast.CssPrinter;
import com.cssast.ast.AstNode;
import com.cssast.ast.Comment;
import com.cssast.ast.Declaration;
import com.cssast.ast.Rule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WalkerTest {

    // Nine nodes: .a { color; .b { margin } }, a comment, .d { padding; @media print { display } }
    private static List<AstNode> sampleTree() {
        List<AstNode> ast = new ArrayList<>();
        ast.add(new Rule(".a", List.of(
            new Declaration("color", "red"),
            new Rule(".b", List.of(new Declaration("margin", "0")))
        )));
        ast.add(new Comment(" c "));
        ast.add(new Rule(".d", List.of(
            new Declaration("padding", "0"),
            new Rule("@media print", List.of(new Declaration("display", "none")))
        )));
        return ast;
    }

    private static String label(AstNode node) {
        if (node instanceof Rule rule) {
            return rule.getSelector();
        } else if (node instanceof Declaration decl) {
            return decl.getProperty();
        } else if (node instanceof Comment comment) {
            return "/*" + comment.getValue() + "*/";
        }
        throw new IllegalArgumentException("Unknown node " + node);
    }

    @Test
    void testVisitsEveryNodeOnceInPreOrder() {
        List<String> visited = new ArrayList<>();
        Walker.walk(sampleTree(), (node, ctx) -> {
            visited.add(label(node));
            return WalkAction.CONTINUE;
        });

        assertEquals(List.of(
            ".a", "color", ".b", "margin",
            "/* c */",
            ".d", "padding", "@media print", "display"
        ), visited);
    }

    @Test
    void testNullActionMeansContinue() {
        List<String> visited = new ArrayList<>();
        Walker.walk(sampleTree(), (node, ctx) -> {
            visited.add(label(node));
            return null;
        });
        assertEquals(9, visited.size());
    }

    @Test
    void testSkipDoesNotDescend() {
        List<String> visited = new ArrayList<>();
        Walker.walk(sampleTree(), (node, ctx) -> {
            visited.add(label(node));
            if (node instanceof Rule rule && rule.getSelector().equals(".a")) {
                return WalkAction.SKIP;
            }
            return WalkAction.CONTINUE;
        });

        assertEquals(List.of(".a", "/* c */", ".d", "padding", "@media print", "display"), visited);
    }

    @Test
    void testStopHaltsTraversal() {
        List<AstNode> ast = sampleTree();
        ast.add(new Comment(" tail "));  // 10 nodes

        int[] visits = {0};
        Walker.walk(ast, (node, ctx) -> {
            visits[0]++;
            return visits[0] == 3 ? WalkAction.STOP : WalkAction.CONTINUE;
        });

        assertEquals(3, visits[0]);
    }

    @Test
    void testStopInsideNestedRuleStopsAncestors() {
        List<String> visited = new ArrayList<>();
        Walker.walk(sampleTree(), (node, ctx) -> {
            visited.add(label(node));
            return label(node).equals("margin") ? WalkAction.STOP : WalkAction.CONTINUE;
        });
        assertEquals(List.of(".a", "color", ".b", "margin"), visited);
    }

    @Test
    void testReplacementIsRevisited() {
        List<AstNode> ast = new ArrayList<>();
        ast.add(new Rule(".a", List.of(
            new Declaration("inset", "0"),
            new Declaration("color", "red")
        )));

        List<String> visited = new ArrayList<>();
        Walker.walk(ast, (node, ctx) -> {
            visited.add(label(node));
            if (node instanceof Declaration decl && decl.getProperty().equals("inset")) {
                ctx.replaceWith(List.of(
                    new Declaration("top", decl.getValue()),
                    new Declaration("bottom", decl.getValue())
                ));
            }
            return WalkAction.CONTINUE;
        });

        assertEquals(List.of(".a", "inset", "top", "bottom", "color"), visited);
        assertEquals(".a {\n  top: 0;\n  bottom: 0;\n  color: red;\n}\n", CssPrinter.toCss(ast));
    }

    @Test
    void testReplacementIsRecursive() {
        List<AstNode> ast = new ArrayList<>();
        ast.add(new Declaration("step", "3"));

        List<String> visited = new ArrayList<>();
        Walker.walk(ast, (node, ctx) -> {
            Declaration decl = (Declaration) node;
            visited.add(decl.getValue());
            int n = Integer.parseInt(decl.getValue());
            if (n > 0) {
                ctx.replaceWith(List.of(
                    new Declaration("step", String.valueOf(n - 1)),
                    new Declaration("done", "-1")
                ));
            }
            return WalkAction.CONTINUE;
        });

        assertEquals(List.of("3", "2", "1", "0", "-1", "-1", "-1"), visited);
        assertEquals(4, ast.size());
    }

    @Test
    void testReplaceWithEmptyListRemovesNode() {
        List<AstNode> ast = sampleTree();
        Walker.walk(ast, (node, ctx) -> {
            if (node instanceof Comment) {
                ctx.replaceWith(List.of());
            }
            return WalkAction.CONTINUE;
        });

        assertEquals(2, ast.size());
        assertEquals(".d", ((Rule) ast.get(1)).getSelector());
    }

    @Test
    void testReplacedRuleChildrenAreNotWalked() {
        List<AstNode> ast = new ArrayList<>();
        ast.add(new Rule(".old", List.of(new Declaration("color", "red"))));

        List<String> visited = new ArrayList<>();
        Walker.walk(ast, (node, ctx) -> {
            visited.add(label(node));
            if (node instanceof Rule rule && rule.getSelector().equals(".old")) {
                ctx.replaceWith(new Rule(".new", List.of(new Declaration("color", "blue"))));
            }
            return WalkAction.CONTINUE;
        });

        assertEquals(List.of(".old", ".new", "color"), visited);
    }

    @Test
    void testSecondReplaceWithReplacesFirstReplacement() {
        List<AstNode> ast = new ArrayList<>();
        ast.add(new Comment("before"));
        ast.add(new Declaration("color", "red"));
        ast.add(new Comment("after"));

        Walker.walk(ast, (node, ctx) -> {
            if (node instanceof Declaration decl && decl.getProperty().equals("color")) {
                ctx.replaceWith(List.of(new Declaration("a", "1"), new Declaration("b", "2")));
                ctx.replaceWith(new Declaration("c", "3"));
            }
            return WalkAction.CONTINUE;
        });

        assertEquals("/*before*/\nc: 3;\n/*after*/\n", CssPrinter.toCss(ast));
    }

    @Test
    void testStopAfterReplacementKeepsReplacement() {
        List<AstNode> ast = sampleTree();
        int[] visits = {0};
        Walker.walk(ast, (node, ctx) -> {
            visits[0]++;
            if (node instanceof Comment) {
                ctx.replaceWith(List.of());
                return WalkAction.STOP;
            }
            return WalkAction.CONTINUE;
        });

        assertEquals(5, visits[0]);
        assertEquals(2, ast.size());
    }

    @Test
    void testInPlaceMutationIsVisible() {
        List<AstNode> ast = sampleTree();
        Walker.walk(ast, (node, ctx) -> {
            if (node instanceof Declaration decl) {
                decl.setImportant(true);
            }
            return WalkAction.CONTINUE;
        });

        Rule a = (Rule) ast.get(0);
        assertTrue(((Declaration) a.getNodes().get(0)).isImportant());
    }
}
