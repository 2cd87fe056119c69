package com.phillippitts.reqlog.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

/** Utility for rendering throwables as log lines. */
public final class StackTraces {

    private StackTraces() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the non-empty lines of the throwable's printed stack trace, including causes.
     *
     * @param throwable throwable to render; null yields an empty list
     */
    public static List<String> lines(Throwable throwable) {
        if (throwable == null) {
            return List.of();
        }
        StringWriter out = new StringWriter();
        try (PrintWriter writer = new PrintWriter(out)) {
            throwable.printStackTrace(writer);
        }
        return Arrays.stream(out.toString().split("\\R"))
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
