package com.pineparser.ast;

import java.util.List;

/**
 * User function. A single-line function ({@code f(x) => x * 2}) has a body of one {@link Expr}.
 */
public record FunctionDef(
    SourceLocation loc,
    String name,
    List<Param> args,
    List<Statement> body,
    boolean method,
    boolean export
) implements Statement {

    public FunctionDef(String name, List<Param> args, List<Statement> body) {
        this(SourceLocation.NONE, name, args, body, false, false);
    }

    @Override
    public List<Field> fields() {
        return List.of(
            Node.field("name", name),
            Node.field("args", args),
            Node.field("body", body),
            Node.field("method", method),
            Node.field("export", export));
    }

    @Override
    public String type() {
        return "FunctionDef";
    }
}
