package cli;

import java.nio.file.Files;

import java.nio.file.Path;

import java.nio.file.Paths;

/** CLI path helpers (relative paths resolve against user.dir). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static Path resolvePath(String input) {
        if (input == null || input.isBlank()) return null;
        return resolveAgainstUserDir(input).toAbsolutePath().normalize();
    }
    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }
    public static void validateFileExists(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is null");
        if (!Files.exists(p)) throw new IllegalArgumentException(label + " not found: " + p);
    }
    public static void mkdirs(Path p) {
        if (p == null) return;
        try {
            Files.createDirectories(p);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create directory: " + p, e);
        }
    }
    /**
     * Target path for a batch input: same relative path under {@code outDir}.
     */
    public static Path mirror(Path inDir, Path file, Path outDir) {
        Path rel = inDir.toAbsolutePath().normalize()
                .relativize(file.toAbsolutePath().normalize());
        return outDir.resolve(rel).toAbsolutePath().normalize();
    }
}
