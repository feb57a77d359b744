package infra.output;

import domain.output.SqlOutputWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores formatted SQL into files (UTF-8).
 * Missing parent directories are created.
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public void write(Path target, String sqlText) {
        if (target == null) throw new IllegalArgumentException("target is null");

        Path parent = target.toAbsolutePath()
                .normalize()
                .getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to create output directory: " + parent, e);
            }
        }

        try {
            Files.writeString(target, sqlText == null ? "" : sqlText, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write sql file: " + target, e);
        }
    }
}
