package app;

import java.io.InputStream;

import java.io.PrintStream;

import java.nio.file.Files;

import java.nio.file.Path;

import java.util.ArrayList;

import java.util.List;

import java.util.Map;

import cli.CliArgParser;

import cli.CliPathResolver;

import cli.CliProgressMonitor;

import cli.SqlFormatCli;

import domain.format.FormatOptions;

import domain.format.KeywordVocabulary;

import domain.format.SqlFormatter;

import domain.model.FormatResult;

import domain.output.ResultWriter;

import domain.output.SqlOutputWriter;

import infra.source.SqlFileScanner;

import infra.source.SqlTextReader;

/** CLI entry (invoked by {@link SqlFormatCli}). */
public final class SqlFormatCliApp {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String STDIN = "<stdin>";
    private static final String STDOUT = "<stdout>";

    private SqlFormatCliApp() {}

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    /**
     * Runs one CLI invocation.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_FAILED} (some input failed) or {@link #EXIT_USAGE}
     */
    public static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        if (CliArgParser.flag(argv, "help")) {
            printUsage(stdout);
            return EXIT_OK;
        }

        // ------------------------------------------------------------
        // input / output / options
        // ------------------------------------------------------------
        Path in = CliPathResolver.resolvePath(CliArgParser.option(argv, "in"));
        Path out = CliPathResolver.resolvePath(CliArgParser.option(argv, "out"));
        Path keywords = CliPathResolver.resolvePath(CliArgParser.option(argv, "keywords"));
        Path report = CliPathResolver.resolvePath(CliArgParser.option(argv, "report"));

        boolean toConsole = (out == null);
        // formatted SQL owns stdout when no --out is given
        PrintStream log = toConsole ? stderr : stdout;

        FormatOptions options = FormatOptions.builder()
                .indentSize(CliArgParser.parseInt(CliArgParser.option(argv, "indent"), FormatOptions.DEFAULT_INDENT_SIZE))
                .useTab(CliArgParser.flagOrProperty(argv, "tab", false))
                .keywordCase(CliArgParser.parseKeywordCase(CliArgParser.option(argv, "case")))
                .breakBeforeComma(CliArgParser.flagOrProperty(argv, "breakBeforeComma", false))
                .breakAfterComma(CliArgParser.flagOrProperty(argv, "breakAfterComma", true))
                .maxLineLength(CliArgParser.parseInt(CliArgParser.option(argv, "maxLineLength"), FormatOptions.DEFAULT_MAX_LINE_LENGTH))
                .build();

        boolean failFast = CliArgParser.flagOrProperty(argv, "failFast", false);
        int logEvery = CliArgParser.parseInt(CliArgParser.option(argv, "logEvery"), 100);

        log.println("==================================================");
        log.println("[START] SQL format");
        log.println("[CONF] in             = " + (in == null ? STDIN : in));
        log.println("[CONF] out            = " + (out == null ? STDOUT : out));
        log.println("[CONF] options        = " + options);
        log.println("[CONF] keywords       = " + (keywords == null ? "(standard)" : keywords));
        log.println("[CONF] report         = " + (report == null ? "(none)" : report));
        log.println("[CONF] failFast       = " + failFast);
        log.println("[CONF] logEvery       = " + logEvery);
        log.println("==================================================");

        SqlFormatComponentsFactory factory = new SqlFormatComponentsFactory();
        List<FormatResult> results;

        try {
            if (in != null) CliPathResolver.validateFileExists(in, "input (--in)");
            if (keywords != null) CliPathResolver.validateFileExists(keywords, "keyword file (--keywords)");

            KeywordVocabulary vocabulary = factory.createVocabulary(keywords);
            log.println("[INIT] keyword vocabulary size = " + vocabulary.size());

            SqlFormatter formatter = factory.createFormatter(vocabulary);
            SqlTextReader reader = factory.createReader();

            if (in != null && Files.isDirectory(in)) {
                if (out == null) {
                    throw new IllegalArgumentException("--out directory is required when --in is a directory");
                }
                if (Files.exists(out) && !Files.isDirectory(out)) {
                    throw new IllegalArgumentException("--out must be a directory when --in is a directory: " + out);
                }
                CliPathResolver.mkdirs(out);
                SqlOutputWriter writer = factory.createSqlOutputWriter(false, stdout);
                results = formatDirectory(in, out, factory.createScanner(), reader, formatter, options,
                        writer, failFast, logEvery, log);
            } else {
                if (in != null && out != null && Files.isDirectory(out)) {
                    out = out.resolve(in.getFileName());
                }
                SqlOutputWriter writer = factory.createSqlOutputWriter(toConsole, stdout);
                results = new ArrayList<>(1);
                results.add(formatOne(in, out, stdin, reader, formatter, options, writer, log));
            }
        } catch (IllegalArgumentException e) {
            log.println("[ERROR] " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalStateException e) {
            log.println("[ERROR] " + describe(e));
            return EXIT_FAILED;
        }

        int success = 0;
        for (FormatResult r : results) {
            if (r.isSuccess()) success++;
        }
        int fail = results.size() - success;
        log.println("[STAT] success=" + success + ", fail=" + fail);

        long tReport0 = System.nanoTime();
        ResultWriter resultWriter = factory.createResultWriter(report != null);
        try {
            resultWriter.write(report, results);
            if (report != null) {
                log.println("[REPORT] written. rows=" + results.size() + ", elapsed=" + ms(tReport0) + "ms");
            }
        } catch (IllegalStateException e) {
            log.println("[ERROR] report write failed: " + e.getMessage());
            fail++;
        }

        log.println("==================================================");
        log.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        log.println("==================================================");

        return fail > 0 ? EXIT_FAILED : EXIT_OK;
    }

    private static FormatResult formatOne(
            Path in,
            Path out,
            InputStream stdin,
            SqlTextReader reader,
            SqlFormatter formatter,
            FormatOptions options,
            SqlOutputWriter writer,
            PrintStream log
    ) {
        String source = (in == null) ? STDIN : in.toString();
        String target = (out == null) ? STDOUT : out.toString();
        long one0 = System.nanoTime();

        try {
            String sql = (in == null) ? reader.read(stdin) : reader.read(in);
            String formatted = formatter.format(sql, options);
            writer.write(out, formatted);
            return FormatResult.success(source, target, sql.length(), formatted.length(), ms(one0));
        } catch (IllegalStateException e) {
            log.println("[ERROR] format failed: " + source);
            log.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
            return FormatResult.fail(source, target, ms(one0), describe(e));
        }
    }

    private static List<FormatResult> formatDirectory(
            Path inDir,
            Path outDir,
            SqlFileScanner scanner,
            SqlTextReader reader,
            SqlFormatter formatter,
            FormatOptions options,
            SqlOutputWriter writer,
            boolean failFast,
            int logEvery,
            PrintStream log
    ) {
        long tScan0 = System.nanoTime();
        List<Path> files = scanner.scan(inDir);
        log.println("[STEP1] scanned sql files. size=" + files.size() + ", elapsed=" + ms(tScan0) + "ms");

        List<FormatResult> results = new ArrayList<>(Math.max(16, files.size()));
        int total = files.size();
        int success = 0;
        int fail = 0;
        long tLoop0 = System.nanoTime();
        log.println("[STEP2] formatting start. total=" + total);

        for (int i = 0; i < total; i++) {
            Path file = files.get(i);
            Path target = CliPathResolver.mirror(inDir, file, outDir);

            FormatResult r = formatOne(file, target, null, reader, formatter, options, writer, log);
            results.add(r);

            if (r.isSuccess()) {
                success++;
            } else {
                fail++;
                if (failFast) {
                    log.println("[FAILFAST] stop on first error.");
                    break;
                }
            }

            if (CliProgressMonitor.shouldLog(i + 1, total, logEvery)) {
                CliProgressMonitor.logProgress(log, i + 1, total, success, fail, tLoop0, file.toString());
            }
        }

        log.println("[STEP2] formatting done. elapsed=" + ms(tLoop0) + "ms");
        return results;
    }

    private static void printUsage(PrintStream out) {
        out.println("usage: sql-format [--in=<file|dir>] [--out=<file|dir>] [options]");
        out.println("  --in=<path>              input file or directory of *.sql (default: stdin)");
        out.println("  --out=<path>             output file or directory (default: stdout)");
        out.println("  --indent=<n>             indent width in spaces (default 4)");
        out.println("  --tab                    indent with tabs");
        out.println("  --case=upper|lower|unchanged");
        out.println("  --breakBeforeComma       put commas at the start of the next line");
        out.println("  --breakAfterComma=<bool> line break after commas (default true)");
        out.println("  --maxLineLength=<n>      accepted for compatibility; lines are not wrapped");
        out.println("  --keywords=<file>        keyword list, one per line, '#' comments");
        out.println("  --report=<xlsx>          write a run report");
        out.println("  --failFast               stop at the first failing file");
        out.println("  --logEvery=<n>           progress interval for directory runs (default 100)");
        out.println("Any option may also be given as -D" + CliArgParser.PROP_PREFIX + "<name>=<value>.");
    }

    private static String describe(Exception e) {
        String m = safe(e.getMessage());
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null) {
            m = m + " (" + cause.getClass().getSimpleName() + ": " + cause.getMessage() + ")";
        }
        return e.getClass().getSimpleName() + ": " + m;
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
