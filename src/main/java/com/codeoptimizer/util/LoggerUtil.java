package com.codeoptimizer.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Configures java.util.logging for the optimizer. Console output is set up from /logging.properties;
 * a run may additionally write a detailed log file.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final Logger optimizerLogger = Logger.getLogger("com.codeoptimizer");
    private static final String LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static FileHandler fileHandler;

    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                _configureConsole();
            }
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            _configureConsole();
        }
        initialized = true;
    }

    private static void _configureConsole() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.WARNING);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
    }

    /**
     * Sets the level of every console handler. Levels below INFO also open up the optimizer's loggers.
     */
    public static synchronized void setConsoleLevel(Level level) {
        initialize();
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        if (level.intValue() < Level.INFO.intValue()) {
            optimizerLogger.setLevel(level);
        }
    }

    /**
     * Appends FINE and above to the given file, replacing a log file opened earlier.
     */
    public static synchronized void enableFileLogging(Path path) throws IOException {
        initialize();
        _closeFileHandler();

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileHandler handler = new FileHandler(path.toString(), true);
        handler.setLevel(Level.FINE);
        handler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(handler);
        fileHandler = handler;

        Level current = optimizerLogger.getLevel();
        if (current == null || current.intValue() > Level.FINE.intValue()) {
            optimizerLogger.setLevel(Level.FINE);
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes the console and closes the log file, if one is open.
     */
    public static synchronized void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
        }
        _closeFileHandler();
    }

    private static void _closeFileHandler() {
        if (fileHandler != null) {
            rootLogger.removeHandler(fileHandler);
            fileHandler.close();
            fileHandler = null;
        }
    }
}
