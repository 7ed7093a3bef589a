package cli;

import app.CstDumpCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Option handling and orchestration live in {@link CstDumpCliApp}.</p>
 */
public class CstDumpCli {

    public static void main(String[] args) {
        CstDumpCliApp.main(args);
    }
}
