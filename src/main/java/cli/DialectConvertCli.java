package cli;

import app.DialectConvertCliApp;

/**
 * CLI entrypoint.
 *
 * <p>Kept minimal; orchestration lives in {@link DialectConvertCliApp}.</p>
 */
public class DialectConvertCli {

    public static void main(String[] args) {
        DialectConvertCliApp.main(args);
    }
}
