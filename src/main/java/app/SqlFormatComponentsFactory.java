package app;

import domain.format.KeywordVocabulary;
import domain.format.SqlFormatter;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import infra.keyword.KeywordFileLoader;
import infra.output.ConsoleSqlOutputWriter;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.XlsxResultWriter;
import infra.source.SqlFileScanner;
import infra.source.SqlTextReader;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Object-assembly factory for {@link SqlFormatCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging.
 */
final class SqlFormatComponentsFactory {

    KeywordVocabulary createVocabulary(Path keywordFile) {
        if (keywordFile == null) return KeywordVocabulary.standard();
        return new KeywordFileLoader().loadOrDefault(keywordFile);
    }

    SqlFormatter createFormatter(KeywordVocabulary vocabulary) {
        return new SqlFormatter(vocabulary);
    }

    SqlTextReader createReader() {
        return new SqlTextReader();
    }

    SqlFileScanner createScanner() {
        return new SqlFileScanner();
    }

    SqlOutputWriter createSqlOutputWriter(boolean toConsole, PrintStream stdout) {
        if (toConsole) return new ConsoleSqlOutputWriter(stdout);
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter();
    }
}
