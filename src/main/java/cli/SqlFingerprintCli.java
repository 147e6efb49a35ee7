package cli;

import app.SqlFingerprintCliApp;

/**
 * CLI entrypoint facade. The orchestration lives in {@link SqlFingerprintCliApp}.
 */
public class SqlFingerprintCli {

    public static void main(String[] args) {
        int rc = SqlFingerprintCliApp.run(args);
        if (rc != 0) System.exit(rc);
    }
}
