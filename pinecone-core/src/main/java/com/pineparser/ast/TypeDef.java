package com.pineparser.ast;

import java.util.List;

public record TypeDef(
    SourceLocation loc,
    String name,
    List<TypeField> body,
    boolean export
) implements Statement {

    public TypeDef(String name, List<TypeField> body) {
        this(SourceLocation.NONE, name, body, false);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("name", name), Node.field("body", body), Node.field("export", export));
    }

    @Override
    public String type() {
        return "TypeDef";
    }
}
