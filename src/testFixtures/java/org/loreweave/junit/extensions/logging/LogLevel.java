package org.loreweave.junit.extensions.logging;

/**
 * Levels that log annotations can refer to.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
