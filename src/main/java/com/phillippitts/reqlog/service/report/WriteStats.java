package com.phillippitts.reqlog.service.report;

/** Counters of the reporter's writes since it was built. */
public record WriteStats(long pending, long written, long failed, long dropped) {

    public static final WriteStats EMPTY = new WriteStats(0, 0, 0, 0);
}
