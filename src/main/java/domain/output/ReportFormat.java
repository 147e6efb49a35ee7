package domain.output;

/**
 * Report layout chosen on the command line.
 */
public enum ReportFormat {
    TEXT,
    CSV,
    XLSX,
    NONE
}
