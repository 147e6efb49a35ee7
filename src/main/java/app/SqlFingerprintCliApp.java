package app;

import cli.CliArgParser;
import cli.CliProgressMonitor;
import cli.SqlFingerprintCli;
import domain.category.SqlCategorizer;
import domain.category.StatementCategory;
import domain.fingerprint.FingerprintOptions;
import domain.fingerprint.OrderByStyle;
import domain.fingerprint.SqlFingerprinter;
import domain.model.FingerprintWarning;
import domain.model.ListWarningSink;
import domain.model.RecursionLimitExceededException;
import domain.model.StatementContext;
import domain.model.StatementSignature;
import domain.model.WarningCode;
import domain.model.WarningSink;
import domain.output.ReportFormat;
import domain.output.ReportWriter;
import domain.text.SourceStatement;
import domain.text.StatementFormat;
import domain.text.StatementSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI app (invoked by {@link SqlFingerprintCli}): reads statements, fingerprints each one,
 * groups them by signature and writes a report.
 *
 * <pre>
 * --input=queries.sql   file, classpath:..., or - for stdin (default)
 * --format=lines|csv    default: csv for *.csv, else lines
 * --report=text|csv|xlsx|none
 * --out=path            report file (text defaults to the console)
 * --maxDepth=16  --orderBy=flat|paired  --max=-1  --logEvery=1000  --failFast  --quiet
 * </pre>
 * Each option may also be given as {@code -Dfingerprint.<name>=...}.
 */
public final class SqlFingerprintCliApp {

    static final int RC_OK = 0;
    static final int RC_FAILED = 1;
    static final int RC_USAGE = 2;

    private SqlFingerprintCliApp() {}

    public static int run(String[] args) {
        return run(args, new SqlFingerprintComponentsFactory());
    }

    static int run(String[] args, SqlFingerprintComponentsFactory factory) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // options
        // ------------------------------------------------------------
        String input = CliArgParser.option(argv, "input", "-");
        StatementFormat inputFormat = CliArgParser.parseStatementFormat(CliArgParser.option(argv, "format", null), input);
        ReportFormat reportFormat = CliArgParser.parseReportFormat(CliArgParser.option(argv, "report", "text"));
        Path out = resolveOut(CliArgParser.option(argv, "out", null), reportFormat);

        int maxDepth = CliArgParser.parseInt(CliArgParser.option(argv, "maxDepth", null),
                FingerprintOptions.DEFAULT_MAX_SUBQUERY_DEPTH);
        OrderByStyle orderBy = CliArgParser.parseOrderByStyle(CliArgParser.option(argv, "orderBy", null));
        int max = CliArgParser.parseInt(CliArgParser.option(argv, "max", null), -1);
        int logEvery = CliArgParser.parseInt(CliArgParser.option(argv, "logEvery", null), 1000);
        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean quiet = CliArgParser.flag(argv, "quiet");

        FingerprintOptions options;
        try {
            options = FingerprintOptions.defaults()
                    .withMaxSubqueryDepth(maxDepth)
                    .withOrderByStyle(orderBy);
        } catch (IllegalArgumentException e) {
            System.out.println("[ERROR] invalid option: " + e.getMessage());
            return RC_USAGE;
        }

        info(quiet, "==================================================");
        info(quiet, "[START] SQL fingerprint");
        info(quiet, "[CONF] input          = " + input + " (" + inputFormat + ")");
        info(quiet, "[CONF] report         = " + reportFormat + (out == null ? "" : " -> " + out.toAbsolutePath()));
        info(quiet, "[CONF] options        = " + options);
        info(quiet, "[CONF] max            = " + max);
        info(quiet, "[CONF] logEvery       = " + logEvery);
        info(quiet, "[CONF] failFast       = " + failFast);
        info(quiet, "==================================================");

        // ------------------------------------------------------------
        // STEP1: load
        // ------------------------------------------------------------
        long tLoad0 = System.nanoTime();
        List<SourceStatement> statements;
        try {
            StatementSource source = factory.createStatementSource(inputFormat);
            statements = source.load(input);
        } catch (RuntimeException e) {
            System.out.println("[ERROR] failed to load statements: " + input);
            System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
            return RC_FAILED;
        }
        info(quiet, "[STEP1] statements loaded. size=" + statements.size() + ", elapsed=" + ms(tLoad0) + "ms");

        if (max > 0 && statements.size() > max) {
            statements = new ArrayList<>(statements.subList(0, max));
            info(quiet, "[STEP1] apply max => truncated to " + statements.size());
        }

        // ------------------------------------------------------------
        // STEP2: fingerprint + categorize
        // ------------------------------------------------------------
        SqlFingerprinter fingerprinter = factory.createFingerprinter(options);
        SqlCategorizer categorizer = factory.createCategorizer();
        List<FingerprintWarning> warnings = new ArrayList<>();
        WarningSink warningSink = new ListWarningSink(warnings);

        long tLoop0 = System.nanoTime();
        int total = statements.size();
        int skip = 0;
        int rc = RC_OK;

        for (int i = 0; i < total; i++) {
            SourceStatement st = statements.get(i);
            StatementContext ctx = st.toContext();
            String key = ctx.toString();

            try {
                StatementSignature signature = fingerprinter.fingerprint(st.getSql(), ctx, warningSink);
                categorizer.add(signature, st);

            } catch (RecursionLimitExceededException e) {
                skip++;
                warningSink.warn(FingerprintWarning.of(WarningCode.RECURSION_LIMIT_EXCEEDED, ctx,
                        "statement skipped", e.getMessage()));
                System.out.println("[WARN] nesting too deep, skipped: " + key + " (" + e.getMessage() + ")");
                if (failFast) {
                    System.out.println("[FAILFAST] stop on first error.");
                    rc = RC_FAILED;
                    break;
                }

            } catch (RuntimeException e) {
                skip++;
                warningSink.warn(FingerprintWarning.of(WarningCode.FINGERPRINT_ERROR, ctx,
                        e.getClass().getSimpleName(), safe(e.getMessage())));
                System.out.println("[ERROR] fingerprint failed: " + key);
                System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
                e.printStackTrace(System.out);
                if (failFast) {
                    System.out.println("[FAILFAST] stop on first error.");
                    rc = RC_FAILED;
                    break;
                }
            }

            if (!quiet && CliProgressMonitor.shouldLog(i + 1, total, logEvery)) {
                CliProgressMonitor.logProgress(i + 1, total, categorizer.size(), warnings.size(), skip, tLoop0, key);
            }
        }

        List<StatementCategory> categories = categorizer.getCategories();
        info(quiet, "[STEP2] fingerprinting done. elapsed=" + ms(tLoop0) + "ms");
        info(quiet, "[STAT] statements=" + total + ", categories=" + categories.size() + ", skip=" + skip);
        info(quiet, "[STAT] warnings=" + warnings.size());

        // ------------------------------------------------------------
        // STEP3: report
        // ------------------------------------------------------------
        long tReport0 = System.nanoTime();
        try {
            ReportWriter writer = factory.createReportWriter(reportFormat);
            writer.write(out, categories, warnings);
            if (reportFormat == ReportFormat.NONE) {
                info(quiet, "[STEP3] report skipped (--report=none).");
            } else {
                info(quiet, "[STEP3] report written. elapsed=" + ms(tReport0) + "ms");
            }
        } catch (RuntimeException e) {
            System.out.println("[ERROR] report write failed: " + (out == null ? "console" : out));
            System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
            rc = RC_FAILED;
        }

        info(quiet, "==================================================");
        info(quiet, "[DONE] totalElapsed=" + ms(t0) + "ms");
        info(quiet, "==================================================");
        return rc;
    }

    private static Path resolveOut(String raw, ReportFormat format) {
        if (raw != null && !raw.isBlank()) return Path.of(raw.trim());
        return switch (format) {
            case CSV -> Path.of("output", "sql-fingerprint.csv");
            case XLSX -> Path.of("output", "sql-fingerprint.xlsx");
            case TEXT, NONE -> null;
        };
    }

    private static void info(boolean quiet, String msg) {
        if (!quiet) System.out.println(msg);
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
