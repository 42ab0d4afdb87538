package org.astrewrite.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can be configured with.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
