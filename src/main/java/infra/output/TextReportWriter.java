package infra.output;

import domain.category.StatementCategory;
import domain.model.FingerprintWarning;
import domain.output.ReportWriter;
import domain.text.SourceStatement;


import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Human-readable report:
 * <pre>
 * Category: (('table1',), (), 'id = 9', (), ())
 *   SELECT * FROM table1 WHERE id = 1
 *   SELECT * FROM table1 WHERE id = 2
 *
 * </pre>
 * Written to {@code out}, or to the console stream when {@code out} is null.
 */
public final class TextReportWriter implements ReportWriter {

    private final PrintStream console;

    public TextReportWriter() {
        this(System.out);
    }

    public TextReportWriter(PrintStream console) {
        this.console = console;
    }

    @Override
    public void write(Path out, List<StatementCategory> categories, List<FingerprintWarning> warnings) {
        if (out == null) {
            // console stays open
            PrintWriter pw = new PrintWriter(console);
            render(pw, categories, warnings);
            pw.flush();
            return;
        }

        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
                 PrintWriter pw = new PrintWriter(w)) {
                render(pw, categories, warnings);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write text report: " + out, e);
        }
    }

    static void render(PrintWriter pw, List<StatementCategory> categories, List<FingerprintWarning> warnings) {
        for (StatementCategory c : categories) {
            pw.println("Category: " + c.getSignature());
            for (SourceStatement m : c.getMembers()) {
                pw.println("  " + m.getSql());
            }
            pw.println();
        }
        if (warnings != null && !warnings.isEmpty()) {
            pw.println("Warnings:");
            for (FingerprintWarning w : warnings) {
                pw.println("  " + w);
            }
        }
    }
}
