package org.sysmlite.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can check.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
