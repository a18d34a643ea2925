package com.pineparser.unparse;

import com.pineparser.ParseException;
import com.pineparser.ParseOutcome;
import com.pineparser.ast.Script;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PineAstTest {

    @Test
    void testParseDumpUnparse() {
        Script script = PineAst.parse("//@version=5\nplot(close)\n");
        assertEquals("5", script.version());
        assertTrue(PineAst.dump(script, 2).startsWith("Script(\n  body=["));
        assertEquals(PineAst.dump(script, 2), PineAst.dump(script, "  "));
        assertFalse(PineAst.dump(script).contains("\n"));
        assertEquals("//@version=5\nplot(close)\n", PineAst.unparse(script));
    }

    @Test
    void testLiteralEvalIsUnsupported() {
        ParseOutcome<Object> fromText = PineAst.literalEval("1 + 2");
        assertInstanceOf(ParseOutcome.Unsupported.class, fromText);
        assertEquals("literal_eval", ((ParseOutcome.Unsupported<Object>) fromText).operation());

        Script script = PineAst.parse("x = 1\n");
        assertInstanceOf(ParseOutcome.Unsupported.class, PineAst.literalEval(script));

        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
            () -> PineAst.literalEvalOrThrow(script));
        assertEquals("literal_eval is not supported", e.getMessage());
        assertFalse(ParseException.class.isAssignableFrom(e.getClass()));
    }
}
