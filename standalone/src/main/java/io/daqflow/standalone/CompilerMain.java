package io.daqflow.standalone;

import io.daqflow.standalone.cli.CliCommand;
import io.daqflow.standalone.cli.CompilerApp;
import io.daqflow.standalone.cli.LogbackConfigurator;
import io.daqflow.standalone.config.CompilerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone compiler. Parses the command line, loads settings, configures
 * logging and runs the command. On failure, logs the error and exits with status 1.
 */
public final class CompilerMain {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerMain.class);

    private CompilerMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args e.g. {@code compile --project plant.daq --out plant.py}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            CliCommand command = CliCommand.parse(args);
            CompilerSettings settings = CompilerApp.loadSettings(command, System::getenv);
            LogbackConfigurator.configure(settings.loggingFormat(), settings.loggingLevel());
            new CompilerApp(settings).run(command, System.out);
        } catch (Exception e) {
            LOG.error("Compilation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
