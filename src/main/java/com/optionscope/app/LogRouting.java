package com.optionscope.app;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends {@code System.out} and {@code System.err} through the {@code STDOUT}/{@code STDERR}
 * loggers, so CLI progress lines also land in the rolling run log. Installed at most once per JVM.
 */
final class LogRouting {
    private static final AtomicBoolean INSTALLED = new AtomicBoolean(false);

    private LogRouting() {
    }

    static boolean install(Path logDir) {
        if (!INSTALLED.compareAndSet(false, true)) {
            return false;
        }
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            INSTALLED.set(false);
            System.err.println("WARN: log directory " + logDir + " unavailable, console only: " + e.getMessage());
            return false;
        }
        System.setProperty("optionscope.log.dir", logDir.toAbsolutePath().toString());

        // Log4j must initialise before the swap so its console appender binds the real streams.
        LogManager.getLogger(LogRouting.class).info("Run log directory {}", logDir.toAbsolutePath());
        System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
        System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());
        return true;
    }
}
