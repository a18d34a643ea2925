package com.pineparser.jackson;

import com.pineparser.ParseOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ParseOptionsReaderTest {

    @Test
    void testReadFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("options.json");
        Files.writeString(file, "{\"tabWidth\": 8, \"parseAll\": false, \"versionPattern\": \"//\\\\s*(?<version>v\\\\d+)\"}");

        ParseOptions options = ParseOptionsReader.read(file);
        assertEquals(8, options.tabWidth());
        assertFalse(options.parseAll());
        assertTrue(options.expandTabs());
        assertEquals(1000, options.recursionLimit());
        assertEquals("//\\s*(?<version>v\\d+)", options.versionPattern());
    }

    @Test
    void testEmptyObjectGivesDefaults() {
        ParseOptions options = ParseOptionsReader.read("{}");
        ParseOptions defaults = ParseOptions.defaults();
        assertEquals(defaults.parseAll(), options.parseAll());
        assertEquals(defaults.debug(), options.debug());
        assertEquals(defaults.tabWidth(), options.tabWidth());
        assertEquals(defaults.versionPattern(), options.versionPattern());
    }

    @Test
    void testUnknownKeyRejected() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> ParseOptionsReader.read("{\"tabWidht\": 2}"));
        System.out.println(e.getMessage());
        assertTrue(e.getMessage().startsWith("Invalid parse options"));
    }

    @Test
    void testMalformedJsonRejected() {
        assertThrows(AstJsonException.class, () -> ParseOptionsReader.read("{\"debug\": "));
        assertThrows(AstJsonException.class, () -> ParseOptionsReader.read("null"));
    }

    @Test
    void testInvalidValueRejectedByOptions() {
        assertThrows(IllegalArgumentException.class, () -> ParseOptionsReader.read("{\"recursionLimit\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> ParseOptionsReader.read("{\"versionPattern\": \"(?<version>[\"}"));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> ParseOptionsReader.read(dir.resolve("nope.json")));
    }
}
