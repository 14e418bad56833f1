package org.hdlforge.junit.extensions.logging;

/**
 * Log levels that {@link LogWatchExtension} can expect or allow.
 */
public enum LogLevel {
    WARN,
    ERROR
}
