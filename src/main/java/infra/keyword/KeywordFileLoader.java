package infra.keyword;

import domain.format.KeywordVocabulary;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a keyword vocabulary from a text file.
 *
 * <p>Format:
 * <ul>
 *   <li>one keyword per line (if a line has commas, only the first column is used)</li>
 *   <li>lines starting with '#' are comments</li>
 *   <li>blank lines are ignored; keywords are uppercased</li>
 * </ul>
 *
 * <p>A missing file, or a file without any keyword, falls back to
 * {@link KeywordVocabulary#standard()}.</p>
 */
public final class KeywordFileLoader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT
            .builder()
            .setCommentMarker('#')
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .build();

    public KeywordVocabulary loadOrDefault(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return KeywordVocabulary.standard();
        }
        List<String> words = readKeywords(file);
        if (words.isEmpty()) return KeywordVocabulary.standard();
        return KeywordVocabulary.of(words);
    }

    public List<String> readKeywords(Path file) {
        if (file == null) throw new IllegalArgumentException("keyword file is null");

        try (InputStream is = Files.newInputStream(file);
             Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return readKeywords(reader);
        } catch (IOException | UncheckedIOException e) {
            throw new IllegalStateException("Failed to read keyword file: " + file, e);
        }
    }

    List<String> readKeywords(Reader reader) throws IOException {
        List<String> out = new ArrayList<>(128);
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord rec : parser) {
                if (rec.size() == 0) continue;
                String w = stripBom(rec.get(0));
                if (w == null || w.isBlank()) continue;
                out.add(w.trim());
            }
        }
        return out;
    }

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
