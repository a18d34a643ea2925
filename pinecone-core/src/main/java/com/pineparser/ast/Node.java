package com.pineparser.ast;

import java.util.List;

/**
 * Base interface for all Pine Script AST nodes.
 *
 * <p>Every node exposes its fields as an ordered list of name/value pairs. A value is
 * a scalar ({@code String}, {@code Long}, {@code Double}, {@code Boolean} or {@code null}),
 * another {@link Node}, or a {@link List} of either. The order is the declaration order
 * of the node and never changes between calls.</p>
 */
public sealed interface Node permits
    Script,
    Statement,
    Expression,
    Arg,
    Param,
    Case,
    TypeField {

    String type();

    SourceLocation loc();

    List<Field> fields();

    /**
     * A single named field of a node.
     */
    record Field(String name, Object value) {}

    static Field field(String name, Object value) {
        return new Field(name, value);
    }
}
