package com.storylens;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes log lines to the StoryLens log file and, in dev mode, to the console.
 * Until {@link #initialize} is called {@link #get()} returns null; callers guard for that so
 * the highlighter can run embedded without a log file.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final boolean debugEnabled;

    private static AppLogger instance;

    private AppLogger(Path logFile, boolean consoleEnabled, boolean debugEnabled) throws IOException {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;
        this.debugEnabled = debugEnabled;

        FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
        this.fileOutput = new PrintStream(fos, true, StandardCharsets.UTF_8);

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("StoryLens started at " + LocalDateTime.now().format(TIME_FORMAT));
        fileOutput.println(separator);
    }

    public static synchronized void initialize(Path logFile, boolean devMode) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, devMode, devMode);
        }
    }

    public static synchronized AppLogger get() {
        return instance;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void debug(String message) {
        if (debugEnabled) {
            log("DEBUG", message);
        }
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        synchronized (this) {
            t.printStackTrace(fileOutput);
            if (consoleEnabled) {
                t.printStackTrace(consoleOutput);
            }
        }
    }

    private synchronized void log(String level, String message) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] [%s] %s", timestamp, level, Thread.currentThread().getName(), message);
        fileOutput.println(line);
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Console banner lines; also copied to the file.
     */
    public synchronized void console(String message) {
        consoleOutput.println(message);
        fileOutput.println(message);
    }

    public synchronized void close() {
        fileOutput.close();
    }
}
