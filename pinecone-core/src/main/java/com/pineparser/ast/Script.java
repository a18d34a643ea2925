package com.pineparser.ast;

import java.util.List;

/**
 * Root node of a parsed script. The version is the value of the first version
 * directive found in the source, or {@code null} when there is none.
 */
public record Script(
    SourceLocation loc,
    List<Statement> body,
    String version
) implements Node {

    public Script(List<Statement> body) {
        this(SourceLocation.NONE, body, null);
    }

    public Script(List<Statement> body, String version) {
        this(SourceLocation.NONE, body, version);
    }

    public Script withVersion(String version) {
        return new Script(loc, body, version);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("body", body), Node.field("version", version));
    }

    @Override
    public String type() {
        return "Script";
    }
}
