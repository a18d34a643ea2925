package com.pineparser;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reduces the accepted input kinds to one decoded string.
 *
 * <p>Kinds are tried in a fixed order: a {@code String}, {@code File} or {@code Path} names a
 * file which is opened and closed here; a {@code byte[]} is wrapped as a stream; an
 * {@code InputStream} is decoded with the encoding; a {@code Reader} is read to the end.
 * Streams and readers passed in by the caller are left open.</p>
 */
public final class SourceInput {

    private SourceInput() {
        // Utility class
    }

    public static String read(Object input, Charset encoding) {
        Charset charset = encoding != null ? encoding : StandardCharsets.UTF_8;
        Object in = input;

        if (in instanceof String name) {
            in = Path.of(name);
        }
        if (in instanceof File file) {
            in = file.toPath();
        }
        if (in instanceof Path path) {
            try (Reader reader = Files.newBufferedReader(path, charset)) {
                return readAll(reader);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + path, e);
            }
        }
        if (in instanceof byte[] bytes) {
            in = new ByteArrayInputStream(bytes);
        }
        if (in instanceof InputStream stream) {
            in = new InputStreamReader(stream, charset);
        }
        if (in instanceof Reader reader) {
            try {
                return readAll(reader);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read source", e);
            }
        }
        throw new UnsupportedInputTypeException(input);
    }

    private static String readAll(Reader reader) throws IOException {
        StringWriter writer = new StringWriter();
        reader.transferTo(writer);
        return writer.toString();
    }
}
