package com.phillippitts.reqlog.service.format;

import java.util.Map;

/**
 * Decides whether the diagnostic stream understands ANSI color.
 *
 * <p>Consulted once, when the reporter is built, so the answer reflects the runtime environment
 * rather than the state at class-loading time.
 */
@FunctionalInterface
public interface TerminalDetector {

    boolean supportsColor();

    /**
     * Detector for the process's real terminal: a console must be attached, {@code TERM} must not
     * be {@code dumb}, and {@code NO_COLOR} must be unset.
     */
    static TerminalDetector system() {
        return () -> System.console() != null && supportsColor(System.getenv());
    }

    static boolean supportsColor(Map<String, String> environment) {
        if (environment.containsKey("NO_COLOR")) {
            return false;
        }
        return !"dumb".equals(environment.get("TERM"));
    }
}
