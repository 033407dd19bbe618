package com.raditha.ompx.util;

import com.raditha.ompx.ast.CapturedStmt;
import com.raditha.ompx.ast.CompoundStmt;
import com.raditha.ompx.ast.DirectiveStmt;
import com.raditha.ompx.ast.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tree walking helpers shared by the indexer, the statistics collector and the
 * association engine.
 */
public class NodeFlattener {

    private NodeFlattener() {
        /* this is only a utility class */
    }

    /**
     * Flatten a subtree into a pre-order list.
     * <p>
     * A captured statement contributes itself and then only the statement it
     * wraps. Every other child is first passed through
     * {@link #ignoreContainers(Node)}, so single-statement blocks never appear
     * in the result.
     *
     * @param root subtree root, may be {@code null}
     * @return nodes in pre-order, the root first
     */
    public static List<Node> flatten(Node root) {
        List<Node> nodes = new ArrayList<>();
        visit(root, nodes);
        return nodes;
    }

    private static void visit(Node node, List<Node> nodes) {
        if (node == null) {
            return;
        }
        nodes.add(node);
        if (node instanceof CapturedStmt captured) {
            visit(captured.getCapturedStmt(), nodes);
            return;
        }
        for (Node child : node.getChildren()) {
            visit(ignoreContainers(child), nodes);
        }
    }

    /**
     * Strip one captured-statement wrapper, then any number of blocks that hold
     * exactly one statement.
     */
    public static Node ignoreContainers(Node node) {
        Node current = node;
        if (current instanceof CapturedStmt captured) {
            current = captured.getCapturedStmt();
        }
        while (current instanceof CompoundStmt block && block.getStatements().size() == 1) {
            current = block.getStatements().get(0);
        }
        return current;
    }

    /**
     * The statement a directive applies to with all captured wrappers removed.
     * Any other node is returned as is.
     */
    public static Optional<Node> innermostCaptured(Node node) {
        if (node instanceof DirectiveStmt directive) {
            return directive.getInnermostCapturedStmt();
        }
        return Optional.ofNullable(node);
    }
}
