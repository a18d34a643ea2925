package com.pineparser.ast;

import java.util.List;

/**
 * One arm of a {@link Switch}. The default arm has a null pattern.
 */
public record Case(
    SourceLocation loc,
    Expression pattern,
    List<Statement> body
) implements Node {

    public Case(Expression pattern, List<Statement> body) {
        this(SourceLocation.NONE, pattern, body);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("pattern", pattern), Node.field("body", body));
    }

    @Override
    public String type() {
        return "Case";
    }
}
