package io.netnotes.textarea.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import io.netnotes.textarea.utils.executors.SerializedExecutor;

/**
 * LoggingHelpers - level filtered file log of the text area engine
 *
 * DESTINATION:
 * - one file per day, textarea-yyyy-MM-dd.txt, under ./logs
 * - the directory is taken from the netnotes.textarea.logDir system property
 *   when it is set
 * - nothing is created on disk until the first entry is written
 *
 * ORDERING:
 * - entries are formatted and appended by one serialized thread, so lines
 *   never interleave; every call returns a future completed once the entry
 *   is on disk or dropped
 */
public class LoggingHelpers {
    public static final String UNKNOWN_ERROR = "Unknown Error";

    public static final String LOG_DIR_PROPERTY = "netnotes.textarea.logDir";
    public static final String DEFAULT_LOG_DIR = "logs";
    public static final String LOG_NAME = "textarea";

    public enum LogLevel {
        NONE(0),
        GENERAL(1),
        HIGH_PRIORITY(2),
        ERROR(3),
        ALL(4);

        private final int value;

        LogLevel(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }
    }

    public static class Log {
        private static final long WRITE_TIMEOUT_MS = 2000;
        private static final Gson PRETTY_GSON = new GsonBuilder().setPrettyPrinting().create();
        private static final SerializedExecutor writer = new SerializedExecutor("TextArea-Log");

        private static volatile int logLevel = LogLevel.ALL.getValue();

        // writer thread only; null until the first entry picks the dated default
        private static Path logFile = null;

        private Log() {}

        public static int getLogLevel() {
            return logLevel;
        }

        /**
         * Entries above {@code level} are dropped from now on.
         */
        public static CompletableFuture<Void> setLogLevel(LogLevel level) {
            return writer.execute(() -> logLevel = level.getValue());
        }

        /**
         * Sends later entries to {@code file}; null goes back to the dated file
         * under {@link #getLogDir()}.
         */
        public static CompletableFuture<Void> setLogFile(Path file) {
            return writer.execute(() -> logFile = file);
        }

        public static Path getLogDir() {
            String dir = System.getProperty(LOG_DIR_PROPERTY);
            return Paths.get(dir == null || dir.isBlank() ? DEFAULT_LOG_DIR : dir);
        }

        public static CompletableFuture<Void> log(String scope, String msg, LogLevel level) {
            return enqueue(level, () -> scope + ": " + msg);
        }

        public static CompletableFuture<Void> logError(String msg) {
            return enqueue(LogLevel.ERROR, () -> "[ERROR] " + msg);
        }

        public static CompletableFuture<Void> logError(String scope, Throwable error) {
            return enqueue(LogLevel.ERROR, () -> scope + ": " + getThrowableMsg(error));
        }

        public static CompletableFuture<Void> logError(String scope, String msg, Throwable error) {
            return enqueue(LogLevel.ERROR, () -> scope + ": '" + msg + "' - " + getThrowableMsg(error));
        }

        /**
         * Pretty printed dump of {@code json} under a {@code **scope**} heading,
         * written only at {@link LogLevel#ALL}.
         */
        public static CompletableFuture<Void> logJson(String scope, JsonObject json) {
            return enqueue(LogLevel.ALL, () -> "**" + scope + "**\n" + PRETTY_GSON.toJson(json));
        }

        private static CompletableFuture<Void> enqueue(LogLevel level, Supplier<String> entry) {
            if (level.getValue() > logLevel || writer.isShutdown()) {
                return CompletableFuture.completedFuture(null);
            }

            return writer.execute(() -> append(entry.get() + "\n"))
                .orTimeout(WRITE_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .whenComplete((v, ex) -> {
                    if (ex instanceof TimeoutException) {
                        System.err.println("[LOG TIMEOUT] entry not written after " + WRITE_TIMEOUT_MS + "ms");
                    } else if (ex != null) {
                        System.err.println("[LOG ERROR] " + ex);
                    }
                });
        }

        private static void append(String text) {
            if (logFile == null) {
                String stamp = new SimpleDateFormat("yyyy-MM-dd").format(new Date());
                logFile = getLogDir().resolve(LOG_NAME + "-" + stamp + ".txt");
            }
            try {
                Path dir = logFile.toAbsolutePath().getParent();
                if (dir != null) {
                    Files.createDirectories(dir);
                }
                Files.writeString(logFile, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                System.err.println("[LOG WRITE FAILED] " + logFile + ": " + e.getMessage());
            }
        }
    }

    public static String getThrowableMsg(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN_ERROR;
        }
        return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
    }
}
