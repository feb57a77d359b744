package infra.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Collects SQL files under a directory (recursive, "*.sql", case-insensitive),
 * sorted by path so batch runs are reproducible.
 */
public final class SqlFileScanner {

    private static final String SQL_EXT = ".sql";

    public List<Path> scan(Path dir) {
        if (dir == null) return List.of();
        if (!Files.isDirectory(dir)) return List.of();

        List<Path> out = new ArrayList<>(256);
        try (Stream<Path> s = Files.walk(dir)) {
            s.filter(p -> Files.isRegularFile(p))
                    .filter(SqlFileScanner::isSqlFile)
                    .forEach(out::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan sql files under: " + dir, e);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }

    static boolean isSqlFile(Path p) {
        if (p == null || p.getFileName() == null) return false;
        return p.getFileName()
                .toString()
                .toLowerCase(Locale.ROOT)
                .endsWith(SQL_EXT);
    }
}
