package helios.panelcal.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for writing a per-file log next to the outputs of that file.
 *
 * <p>While a session is open, every event logged under the {@code helios.panelcal} logger
 * tree is also appended to {@code <output-folder>/correction.log}. The appender is detached
 * when the session closes, so use try-with-resources:</p>
 * <pre>{@code
 * try (RunLogger.Session session = RunLogger.start(outputFolder)) {
 *     logger.info("Correcting {}", file);
 *     // ... pipeline ...
 * }
 * }</pre>
 *
 * <p>When SLF4J is not bound to Logback the session is inactive and closing it does
 * nothing.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class RunLogger {
    private static final Logger logger = LoggerFactory.getLogger(RunLogger.class);

    static final String LOGGER_NAME = "helios.panelcal";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private RunLogger() {}

    /**
     * Starts a log session writing to {@code <folder>/correction.log}.
     *
     * @param folder existing output folder
     * @return a session that detaches the file appender when closed
     */
    public static Session start(Path folder) {
        return start(folder, CorrectionConfig.RUN_LOG_FILE_NAME);
    }

    /**
     * Starts a log session writing to {@code <folder>/<fileName>}.
     */
    public static Session start(Path folder, String fileName) {
        if (folder == null || !Files.isDirectory(folder)) {
            logger.warn("Cannot enable run logging: invalid directory: {}", folder);
            return new Session(null, null);
        }

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            logger.debug("SLF4J is not bound to Logback; run log disabled");
            return new Session(null, null);
        }

        Path logFile = folder.resolve(fileName);

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("RUN_LOG-" + logFile);
        appender.setFile(logFile.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        ch.qos.logback.classic.Logger target = context.getLogger(LOGGER_NAME);
        target.addAppender(appender);
        logger.info("Run logging enabled: {}", logFile);
        return new Session(target, appender);
    }

    /**
     * Auto-closeable session for per-file logging.
     */
    public static class Session implements AutoCloseable {
        private final ch.qos.logback.classic.Logger target;
        private final FileAppender<ILoggingEvent> appender;
        private boolean closed;

        private Session(ch.qos.logback.classic.Logger target, FileAppender<ILoggingEvent> appender) {
            this.target = target;
            this.appender = appender;
        }

        /**
         * @return true if a file appender was attached
         */
        public boolean isActive() {
            return appender != null && !closed;
        }

        /**
         * @return the log file, or null when the session is inactive
         */
        public String getFile() {
            return appender == null ? null : appender.getFile();
        }

        @Override
        public void close() {
            if (appender == null || closed) {
                return;
            }
            closed = true;
            logger.info("Run logging disabled: {}", appender.getFile());
            target.detachAppender(appender);
            appender.stop();
        }
    }
}
