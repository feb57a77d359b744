package domain.output;

import java.nio.file.Path;

import java.util.List;

import domain.model.FormatResult;

/** Stores the run report. */
public interface ResultWriter {

    void write(Path reportFile, List<FormatResult> results);
}
