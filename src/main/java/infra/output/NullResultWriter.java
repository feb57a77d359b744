package infra.output;

import domain.model.FormatResult;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (no --report given).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path reportFile, List<FormatResult> results) {
        // intentionally no-op
    }
}
