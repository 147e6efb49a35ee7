package infra.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens statement inputs: {@code -} (stdin), {@code classpath:...} or a file path. UTF-8.
 */
final class InputLocations {

    static final String STDIN = "-";
    private static final String CLASSPATH_PREFIX = "classpath:";

    private InputLocations() {
    }

    static Reader open(String location) throws IOException {
        String s = location.trim();

        if (s.equals(STDIN)) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }

        if (s.startsWith(CLASSPATH_PREFIX)) {
            String cp = s.substring(CLASSPATH_PREFIX.length());
            InputStream is = InputLocations.class.getResourceAsStream(cp.startsWith("/") ? cp : ("/" + cp));
            if (is == null) throw new IOException("classpath resource not found: " + s);
            return new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        }

        return Files.newBufferedReader(Path.of(s), StandardCharsets.UTF_8);
    }

    static String displayName(String location) {
        String s = location.trim();
        if (s.equals(STDIN)) return "stdin";
        if (s.startsWith(CLASSPATH_PREFIX)) return s.substring(CLASSPATH_PREFIX.length());
        Path name = Path.of(s).getFileName();
        return name == null ? s : name.toString();
    }

    static String stripBom(String s) {
        if (s == null) return "";
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
