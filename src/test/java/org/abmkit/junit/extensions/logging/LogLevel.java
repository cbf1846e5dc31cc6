package org.abmkit.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can watch for.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
