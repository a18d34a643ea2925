package com.pineparser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SourceInputTest {

    private static class TrackingStream extends ByteArrayInputStream {
        boolean closed;

        TrackingStream(byte[] bytes) {
            super(bytes);
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void testFileKinds(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("a.pine");
        Files.writeString(file, "plot(close)\n");

        assertEquals("plot(close)\n", SourceInput.read(file, null));
        assertEquals("plot(close)\n", SourceInput.read(file.toString(), StandardCharsets.UTF_8));
        assertEquals("plot(close)\n", SourceInput.read(new File(file.toString()), null));
    }

    @Test
    void testBytesAndStreams() {
        byte[] bytes = "s = \"é\"".getBytes(StandardCharsets.UTF_8);
        assertEquals("s = \"é\"", SourceInput.read(bytes, null));

        byte[] latin = "é".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals("é", SourceInput.read(latin, StandardCharsets.ISO_8859_1));

        TrackingStream stream = new TrackingStream("x = 1".getBytes(StandardCharsets.UTF_8));
        assertEquals("x = 1", SourceInput.read(stream, null));
        assertFalse(stream.closed, "caller's stream must stay open");

        assertEquals("y = 2", SourceInput.read(new StringReader("y = 2"), null));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> SourceInput.read(dir.resolve("missing.pine"), null));
    }

    @Test
    void testUnsupportedKinds() {
        UnsupportedInputTypeException e = assertThrows(UnsupportedInputTypeException.class,
            () -> SourceInput.read(3.5, null));
        assertTrue(e.getMessage().contains("java.lang.Double"));
        assertThrows(UnsupportedInputTypeException.class, () -> SourceInput.read(null, null));
        assertInstanceOf(IllegalArgumentException.class, new UnsupportedInputTypeException(new Object()));
    }
}
