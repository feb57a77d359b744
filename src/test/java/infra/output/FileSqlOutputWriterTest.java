package infra.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSqlOutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_create_parent_dirs_and_write_utf8() throws Exception {
        FileSqlOutputWriter w = new FileSqlOutputWriter();

        Path target = tempDir.resolve("output")
                .resolve("reports")
                .resolve("daily.sql");
        w.write(target, "SELECT '日本' \nFROM t");

        assertTrue(Files.exists(target), "expected file not found: " + target);
        assertEquals("SELECT '日本' \nFROM t", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    void should_reject_null_target() {
        assertThrows(IllegalArgumentException.class, () -> new FileSqlOutputWriter().write(null, "x"));
    }

    @Test
    void console_writer_prints_sql_line() {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(bos, true, StandardCharsets.UTF_8);

        new ConsoleSqlOutputWriter(ps).write(null, "SELECT 1");

        assertEquals("SELECT 1" + System.lineSeparator(), bos.toString(StandardCharsets.UTF_8));
    }
}
