package com.pineparser.ast;

import java.util.List;

/**
 * {@code switch} structure. {@code subject} is null for the condition-only form.
 */
public record Switch(
    SourceLocation loc,
    Expression subject,
    List<Case> cases
) implements Expression {

    public Switch(Expression subject, List<Case> cases) {
        this(SourceLocation.NONE, subject, cases);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("subject", subject), Node.field("cases", cases));
    }

    @Override
    public String type() {
        return "Switch";
    }
}
