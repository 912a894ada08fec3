package com.brick.query.graphql;

import java.util.List;

/**
 * One entry of a selection set, optionally with its own nested selection.
 */
record QueryField(String name, List<QueryField> children) {

    QueryField {
        children = children != null ? List.copyOf(children) : List.of();
    }

    static QueryField of(String name, QueryField... children) {
        return new QueryField(name, List.of(children));
    }

    static List<QueryField> scalars(List<String> names) {
        return names.stream().map(n -> new QueryField(n, List.of())).toList();
    }

    static List<QueryField> scalars(String... names) {
        return scalars(List.of(names));
    }

    void render(StringBuilder out, int depth) {
        String indent = " ".repeat(6 + 4 * depth);
        out.append(indent).append(name);
        if (!children.isEmpty()) {
            out.append(" {\n");
            for (QueryField child : children) {
                child.render(out, depth + 1);
            }
            out.append(indent).append("}");
        }
        out.append('\n');
    }
}
