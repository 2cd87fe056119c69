package com.phillippitts.reqlog.service.source;

import org.apache.logging.log4j.Level;

/** Threshold accepted by {@link LoggingSettings}. */
public enum LogLevel {
    ERROR(Level.ERROR),
    WARNING(Level.WARN),
    INFO(Level.INFO),
    DEBUG(Level.DEBUG);

    private final Level log4jLevel;

    LogLevel(Level log4jLevel) {
        this.log4jLevel = log4jLevel;
    }

    public Level toLog4j() {
        return log4jLevel;
    }
}
