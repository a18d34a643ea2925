package com.pineparser.unparse;

import com.pineparser.ParseOptions;
import com.pineparser.ParseOutcome;
import com.pineparser.PineParser;
import com.pineparser.ast.Node;
import com.pineparser.ast.Script;
import com.pineparser.dump.AstDump;

import java.nio.charset.Charset;

/**
 * One-stop API over the parser, the dump and the unparser.
 *
 * <pre>{@code
 * Script script = PineAst.parse("//@version=5\nplot(close)\n");
 * String tree = PineAst.dump(script, 2);
 * String source = PineAst.unparse(script);
 * }</pre>
 */
public final class PineAst {

    static final String LITERAL_EVAL = "literal_eval";

    private PineAst() {
        // Utility class
    }

    public static Script parse(Object source) {
        return PineParser.parse(source);
    }

    public static Script parse(Object source, Charset encoding, ParseOptions options) {
        return PineParser.parse(source, encoding, options);
    }

    public static String dump(Node node) {
        return AstDump.dump(node);
    }

    public static String dump(Node node, int indent) {
        return AstDump.dump(node, indent);
    }

    public static String dump(Node node, String indent) {
        return AstDump.dump(node, indent);
    }

    public static String unparse(Node node) {
        return new Unparser().unparse(node);
    }

    /**
     * Evaluation of constant expressions is not implemented; the outcome is always
     * {@link ParseOutcome.Unsupported}.
     */
    public static ParseOutcome<Object> literalEval(String source) {
        return new ParseOutcome.Unsupported<>(LITERAL_EVAL);
    }

    public static ParseOutcome<Object> literalEval(Node node) {
        return new ParseOutcome.Unsupported<>(LITERAL_EVAL);
    }

    /**
     * @throws UnsupportedOperationException always
     */
    public static Object literalEvalOrThrow(Node node) {
        return literalEval(node).orElseThrow();
    }
}
