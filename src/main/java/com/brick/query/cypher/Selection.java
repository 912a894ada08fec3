package com.brick.query.cypher;

import java.util.List;

/**
 * A selected field and its nested selection, if any.
 */
public record Selection(String name, List<Selection> children) {

    public Selection {
        children = children != null ? List.copyOf(children) : List.of();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
