package loci.imagestats.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import java.io.File;
import java.net.URL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility for writing the engine's log to a session directory.
 *
 * <p>When enabled, everything logged is written both to the console and to
 * {@code <directory>/logs/imagestats.log}. The file appender in {@code logback.xml} is
 * switched on by the {@value #PROPERTY_NAME} system property, so enabling and disabling
 * reloads the Logback configuration.</p>
 *
 * <pre>{@code
 * try (SessionLogger.Session session = SessionLogger.start(sessionDir)) {
 *     logger.info("Listening...");
 * } // file logging stops here
 * }</pre>
 */
public class SessionLogger {
    private static final Logger logger = LoggerFactory.getLogger(SessionLogger.class);

    public static final String PROPERTY_NAME = "imagestats.session.logdir";
    public static final String LOG_FILE = "logs/imagestats.log";

    private static volatile String currentSessionPath;

    private SessionLogger() {
    }

    /**
     * Enables session logging in the given directory.
     *
     * @param sessionDir existing directory; a {@code logs} subdirectory is created
     * @return true if enabled, false if the directory is unusable
     */
    public static synchronized boolean enable(File sessionDir) {
        if (sessionDir == null || !sessionDir.isDirectory()) {
            logger.warn("Cannot enable session logging: invalid directory: {}", sessionDir);
            return false;
        }

        File logsDir = new File(sessionDir, "logs");
        if (!logsDir.exists() && !logsDir.mkdirs()) {
            logger.warn("Cannot enable session logging: failed to create logs directory: {}", logsDir);
            return false;
        }

        String path = sessionDir.getAbsolutePath();
        System.setProperty(PROPERTY_NAME, path);
        currentSessionPath = path;
        reconfigureLogback();

        logger.info("Session logging enabled: {}/{}", path, LOG_FILE);
        return true;
    }

    /**
     * Enables session logging in the directory at {@code sessionPath}.
     */
    public static boolean enable(String sessionPath) {
        if (sessionPath == null || sessionPath.trim().isEmpty()) {
            logger.warn("Cannot enable session logging: path is null or empty");
            return false;
        }
        return enable(new File(sessionPath));
    }

    /**
     * Stops writing the session log file.
     */
    public static synchronized void disable() {
        String path = currentSessionPath;
        if (path != null) {
            logger.info("Session logging disabled: {}/{}", path, LOG_FILE);
            currentSessionPath = null;
        }
        System.clearProperty(PROPERTY_NAME);
        reconfigureLogback();
    }

    public static boolean isEnabled() {
        return currentSessionPath != null;
    }

    /** Current session directory, or null if session logging is off. */
    public static String getCurrentSessionPath() {
        return currentSessionPath;
    }

    /**
     * Enables session logging until the returned session is closed.
     */
    public static Session start(File sessionDir) {
        return new Session(enable(sessionDir));
    }

    /**
     * Re-reads the Logback configuration so that the session appender follows the
     * system property.
     */
    private static void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.debug("Logback is not the active SLF4J backend, session file not reconfigured");
            return;
        }
        URL config = SessionLogger.class.getResource("/logback-test.xml");
        if (config == null) {
            config = SessionLogger.class.getResource("/logback.xml");
        }
        if (config == null) {
            logger.debug("No logback configuration on the class path");
            return;
        }
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(config);
        } catch (JoranException e) {
            logger.warn("Could not reconfigure logback from {}: {}", config, e.getMessage());
        }
    }

    /**
     * Auto-closeable session. Disables session logging on close if it was enabled.
     */
    public static class Session implements AutoCloseable {
        private final boolean wasEnabled;

        private Session(boolean wasEnabled) {
            this.wasEnabled = wasEnabled;
        }

        public boolean isActive() {
            return wasEnabled;
        }

        @Override
        public void close() {
            if (wasEnabled) {
                disable();
            }
        }
    }
}
