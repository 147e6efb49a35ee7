package domain.output;

import domain.category.StatementCategory;
import domain.model.FingerprintWarning;

import java.nio.file.Path;
import java.util.List;

/** Saves the categorized statements and collected warnings. */
public interface ReportWriter {

    void write(Path out, List<StatementCategory> categories, List<FingerprintWarning> warnings);
}
