package cli;

import java.util.Locale;

/**
 * Progress line for long statement files: how far the loop is, how fast it goes,
 * and how many categories and warnings it has produced so far.
 */
public final class CliProgressMonitor {

    private CliProgressMonitor() {
    }

    public static boolean shouldLog(int done, int total, int logEvery) {
        return logEvery > 0 && (done % logEvery == 0 || done == total);
    }

    public static void logProgress(int done, int total, int categories, int warnings, int skip,
                                   long loopStartNs, String lastKey) {
        long elapsedMs = (System.nanoTime() - loopStartNs) / 1_000_000L;
        System.out.println(formatProgress(done, total, categories, warnings, skip, elapsedMs, lastKey));
    }

    static String formatProgress(int done, int total, int categories, int warnings, int skip,
                                 long elapsedMs, String lastKey) {
        int pct = total > 0 ? (int) (100L * done / total) : 100;
        long perSec = elapsedMs > 0 ? done * 1000L / elapsedMs : done;
        return String.format(Locale.ROOT,
                "[PROGRESS] statements=%d/%d (%d%%) rate=%d/s categories=%d warnings=%d skipped=%d last=%s",
                done, total, pct, perSec, categories, warnings, skip, lastKey == null ? "-" : lastKey);
    }
}
