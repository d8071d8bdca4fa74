package com.project.capsule.crypto;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Centralized logging for capsule operations.
 * Writes to the console and, when a log file is configured, appends to it as well.
 *
 * <p>The file sink is taken from the {@code capsule.errorLog} system property, then the
 * {@code CAPSULE_ERROR_LOG} environment variable, defaulting to {@code capsule-errors.log}.
 * A blank value disables the file sink.</p>
 *
 * <p>Never pass key bytes, shared secrets or plaintext to this class.</p>
 */
public final class ErrorLogger {
    private static final String DEFAULT_LOG_FILE = "capsule-errors.log";
    private static final ReentrantLock lock = new ReentrantLock();
    private static PrintWriter logWriter;

    static {
        String configured = System.getProperty("capsule.errorLog");
        if (configured == null) {
            configured = System.getenv().getOrDefault("CAPSULE_ERROR_LOG", DEFAULT_LOG_FILE);
        }
        if (!configured.isBlank()) {
            logWriter = open(Path.of(configured.trim()));
        }
    }

    private ErrorLogger() {
    }

    /**
     * Redirect the file sink. {@code null} disables it.
     */
    public static void configure(Path logFile) {
        lock.lock();
        try {
            if (logWriter != null) {
                logWriter.close();
            }
            logWriter = logFile == null ? null : open(logFile);
        } finally {
            lock.unlock();
        }
    }

    public static void logError(String operation, String message, Throwable error) {
        lock.lock();
        try {
            String logEntry = format("ERROR", operation, message);

            System.err.println(logEntry);
            if (error != null) {
                System.err.println("  Exception: " + error.getClass().getName());
                System.err.println("  Message: " + error.getMessage());
            }

            if (logWriter != null) {
                logWriter.println(logEntry);
                if (error != null) {
                    logWriter.println("  Exception: " + error.getClass().getName());
                    logWriter.println("  Message: " + error.getMessage());
                    error.printStackTrace(logWriter);
                }
                logWriter.flush();
            }
        } finally {
            lock.unlock();
        }
    }

    public static void logWarning(String operation, String message) {
        lock.lock();
        try {
            String logEntry = format("WARN", operation, message);
            System.err.println(logEntry);
            writeLine(logEntry);
        } finally {
            lock.unlock();
        }
    }

    public static void logInfo(String operation, String message) {
        lock.lock();
        try {
            writeLine(format("INFO", operation, message));
        } finally {
            lock.unlock();
        }
    }

    public static void close() {
        configure(null);
    }

    private static String format(String level, String operation, String message) {
        return String.format("[%s] %s in %s: %s", Instant.now(), level, operation, message);
    }

    private static void writeLine(String logEntry) {
        if (logWriter != null) {
            logWriter.println(logEntry);
            logWriter.flush();
        }
    }

    private static PrintWriter open(Path logFile) {
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new PrintWriter(new FileWriter(logFile.toFile(), true));
        } catch (IOException e) {
            System.err.println("Failed to initialize error logger: " + e.getMessage());
            return null;
        }
    }
}
