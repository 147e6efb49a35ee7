package app;

import domain.category.SqlCategorizer;
import domain.fingerprint.FingerprintOptions;
import domain.fingerprint.SqlFingerprinter;
import domain.output.ReportFormat;
import domain.output.ReportWriter;
import domain.text.StatementFormat;
import domain.text.StatementSource;
import infra.output.CsvReportWriter;
import infra.output.NullReportWriter;
import infra.output.TextReportWriter;
import infra.output.XlsxReportWriter;
import infra.text.CsvStatementSource;
import infra.text.LineStatementSource;

/**
 * Object-assembly factory for {@link SqlFingerprintCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging and moves object creation here.
 */
final class SqlFingerprintComponentsFactory {

    StatementSource createStatementSource(StatementFormat format) {
        if (format == null) format = StatementFormat.LINES;

        return switch (format) {
            case LINES -> new LineStatementSource();
            case CSV -> new CsvStatementSource();
        };
    }

    SqlFingerprinter createFingerprinter(FingerprintOptions options) {
        return new SqlFingerprinter(options);
    }

    SqlCategorizer createCategorizer() {
        return new SqlCategorizer();
    }

    ReportWriter createReportWriter(ReportFormat format) {
        if (format == null) format = ReportFormat.TEXT;

        return switch (format) {
            case TEXT -> new TextReportWriter();
            case CSV -> new CsvReportWriter();
            case XLSX -> new XlsxReportWriter();
            case NONE -> new NullReportWriter();
        };
    }
}
