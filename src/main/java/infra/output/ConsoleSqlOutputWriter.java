package infra.output;

import domain.output.SqlOutputWriter;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Prints formatted SQL to a stream (stdout). The target path is ignored.
 */
public final class ConsoleSqlOutputWriter implements SqlOutputWriter {

    private final PrintStream out;

    public ConsoleSqlOutputWriter(PrintStream out) {
        this.out = (out == null) ? System.out : out;
    }

    @Override
    public void write(Path target, String sqlText) {
        out.println(sqlText == null ? "" : sqlText);
        out.flush();
    }
}
