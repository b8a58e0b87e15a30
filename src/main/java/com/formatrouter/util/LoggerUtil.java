package com.formatrouter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.*;

/**
 * Logging bootstrap shared by the router, the engine and the configuration
 * loader.
 * <p>
 * The configuration comes from the file named by the
 * {@code formatrouter.logging.config} system property, then from
 * {@code /logging.properties} on the classpath. Without either, only the
 * {@code com.formatrouter} logger gets a console handler, so a host
 * application's root logging stays as it was.
 */
public class LoggerUtil {
    public static final String CONFIG_PROPERTY = "formatrouter.logging.config";
    static final String BASE_LOGGER_NAME = "com.formatrouter";

    private static final Logger baseLogger = Logger.getLogger(BASE_LOGGER_NAME);
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;

    private LoggerUtil() {
    }

    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            String external = System.getProperty(CONFIG_PROPERTY);
            Path externalPath = external == null ? null : Paths.get(external);
            if (externalPath != null && Files.isReadable(externalPath)) {
                try (InputStream is = Files.newInputStream(externalPath)) {
                    LogManager.getLogManager().readConfiguration(is);
                }
            } else {
                try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                    if (is != null) {
                        LogManager.getLogManager().readConfiguration(is);
                    } else {
                        configureBaseLogger();
                    }
                }
            }
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize router logging: " + e.getMessage());
            e.printStackTrace();
        }
    }

    private static void configureBaseLogger() {
        for (Handler handler : baseLogger.getHandlers()) {
            baseLogger.removeHandler(handler);
            handler.close();
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        consoleHandler.setFormatter(new SimpleFormatter());
        baseLogger.addHandler(consoleHandler);
        baseLogger.setUseParentHandlers(false);
        baseLogger.setLevel(Level.INFO);
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }
}
