package io.rowcheck.standalone;

import io.rowcheck.standalone.runner.ExitStatus;
import io.rowcheck.standalone.runner.ValidatorApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the command-line validator.
 *
 * <p>Delegates to {@link ValidatorApp#start(String[])} and exits with the resulting
 * {@link ExitStatus} code. Unexpected failures exit with {@link ExitStatus#CONFIG_ERROR}.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/rowcheck.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        ExitStatus status;
        try {
            status = ValidatorApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            status = ExitStatus.CONFIG_ERROR;
        }
        System.exit(status.code());
    }
}
