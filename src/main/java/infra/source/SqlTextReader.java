package infra.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads SQL text (UTF-8) from a file or a stream.
 */
public final class SqlTextReader {

    public String read(Path file) {
        if (file == null) throw new IllegalArgumentException("file is null");
        try {
            return stripBom(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read sql file: " + file, e);
        }
    }

    public String read(InputStream in) {
        if (in == null) throw new IllegalArgumentException("input stream is null");
        try {
            return stripBom(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read sql from stream", e);
        }
    }

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
