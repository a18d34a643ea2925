package com.pineparser.ast;

import java.util.List;

/**
 * Library import: {@code import namespace/name/version [as alias]}.
 */
public record Import(
    SourceLocation loc,
    String namespace,
    String name,
    Long version,
    String alias
) implements Statement {

    public Import(String namespace, String name, Long version, String alias) {
        this(SourceLocation.NONE, namespace, name, version, alias);
    }

    @Override
    public List<Field> fields() {
        return List.of(
            Node.field("namespace", namespace),
            Node.field("name", name),
            Node.field("version", version),
            Node.field("alias", alias));
    }

    @Override
    public String type() {
        return "Import";
    }
}
