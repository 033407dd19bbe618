package com.raditha.ompx.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for building child lists.
 */
final class Nodes {

    private Nodes() {
        /* this is only a utility class */
    }

    /**
     * List of the given nodes in order, skipping {@code null} slots such as an
     * absent for-loop initializer.
     */
    static List<Node> present(Node... nodes) {
        List<Node> result = new ArrayList<>(nodes.length);
        for (Node node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return List.copyOf(result);
    }
}
