package com.phillippitts.reqlog.service.format;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.pattern.AnsiEscape;

/**
 * Display metadata of a log level: its five-character label and its console color.
 */
public enum LevelStyle {
    APP("     ", AnsiEscape.WHITE),
    ERROR("ERROR", AnsiEscape.RED),
    WARN(" WARN", AnsiEscape.YELLOW),
    INFO(" INFO", AnsiEscape.GREEN),
    DEBUG("DEBUG", AnsiEscape.BLUE);

    /**
     * Unleveled tier: passes every threshold except OFF.
     */
    public static final Level APP_LEVEL = Level.forName("APP", 50);

    private final String label;
    private final AnsiEscape color;

    LevelStyle(String label, AnsiEscape color) {
        this.label = label;
        this.color = color;
    }

    public String label() {
        return label;
    }

    public AnsiEscape color() {
        return color;
    }

    /**
     * Maps a Log4j2 level to its display style. FATAL shares the ERROR label, TRACE the DEBUG one.
     */
    public static LevelStyle of(Level level) {
        int value = level.intLevel();
        if (value < Level.FATAL.intLevel()) {
            return APP;
        }
        if (value <= Level.ERROR.intLevel()) {
            return ERROR;
        }
        if (value <= Level.WARN.intLevel()) {
            return WARN;
        }
        if (value <= Level.INFO.intLevel()) {
            return INFO;
        }
        return DEBUG;
    }
}
