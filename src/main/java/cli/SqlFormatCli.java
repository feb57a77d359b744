package cli;

import app.SqlFormatCliApp;


/**
 * CLI entrypoint facade.
 *
 * <p>Orchestration lives in {@link SqlFormatCliApp} so it can be tested
 * without spawning a JVM.</p>
 */
public class SqlFormatCli {

    public static void main(String[] args) {
        SqlFormatCliApp.main(args);
    }
}
