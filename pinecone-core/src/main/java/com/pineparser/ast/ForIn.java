package com.pineparser.ast;

import java.util.List;

/**
 * Collection loop {@code for target in iter}; the target is a {@link Name} or a two-element {@link Tuple}.
 */
public record ForIn(
    SourceLocation loc,
    Expression target,
    Expression iter,
    List<Statement> body
) implements Expression {

    public ForIn(Expression target, Expression iter, List<Statement> body) {
        this(SourceLocation.NONE, target, iter, body);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("target", target), Node.field("iter", iter), Node.field("body", body));
    }

    @Override
    public String type() {
        return "ForIn";
    }
}
