package com.pineparser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DirectivePreprocessorTest {

    @Test
    void testProcess() {
        DirectivePreprocessor preprocessor = new DirectivePreprocessor(ParseOptions.defaults());
        PreprocessedSource prepared = preprocessor.process("//@version=5\nx =\t1 // one\n");

        assertEquals("5", prepared.version());
        assertEquals("//@version=5\nx = 1 // one\n", prepared.source());
        assertEquals("\nx = 1 \n", prepared.commentFree());
    }

    @Test
    void testTabsKeptWhenExpansionIsOff() {
        DirectivePreprocessor preprocessor = new DirectivePreprocessor(ParseOptions.defaults().withExpandTabs(false));
        assertEquals("\tx", preprocessor.process("\tx").source());
    }

    @Test
    void testFindVersion() {
        DirectivePreprocessor preprocessor = new DirectivePreprocessor(ParseOptions.defaults());
        assertEquals("6", preprocessor.findVersion("plot(close)\n  //  @version = 6\n"));
        assertNull(preprocessor.findVersion("plot(close)\n"));
    }

    @Test
    void testStripCommentsKeepsStringsAndLineCount() {
        String text = "a = 'x // y' // z\nb = \"q\\\"//\" //\n// only\n";
        String stripped = DirectivePreprocessor.stripComments(text);
        assertEquals("a = 'x // y' \nb = \"q\\\"//\" \n\n", stripped);
        assertEquals(text.split("\n", -1).length, stripped.split("\n", -1).length);
    }

    @Test
    void testTabExpansion() {
        assertEquals("ab  c", TabExpander.expand("ab\tc", 4));
        assertEquals("    x\n  y", TabExpander.expand("\tx\n  y", 4));
        assertEquals("a       b", TabExpander.expand("a\tb", 8));
        assertEquals(12, TabExpander.width("b = (1 +\t", 4));
    }
}
