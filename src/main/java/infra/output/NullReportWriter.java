package infra.output;

import domain.category.StatementCategory;
import domain.model.FingerprintWarning;
import domain.output.ReportWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullReportWriter implements ReportWriter {
    @Override
    public void write(Path out, List<StatementCategory> categories, List<FingerprintWarning> warnings) {
        // intentionally no-op
    }
}
