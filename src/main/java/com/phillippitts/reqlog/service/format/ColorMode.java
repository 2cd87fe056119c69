package com.phillippitts.reqlog.service.format;

/**
 * Console color policy.
 */
public enum ColorMode {
    /** Ask the {@link TerminalDetector}. */
    AUTO,
    ALWAYS,
    NEVER;

    public boolean resolve(TerminalDetector detector) {
        return switch (this) {
            case ALWAYS -> true;
            case NEVER -> false;
            case AUTO -> detector.supportsColor();
        };
    }
}
