package domain.output;

import java.nio.file.Path;

/** Writes formatted SQL to its destination. */
public interface SqlOutputWriter {
    void write(Path target, String sqlText);
}
