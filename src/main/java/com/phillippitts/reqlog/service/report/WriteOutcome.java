package com.phillippitts.reqlog.service.report;

/** How a scheduled write ended. */
public enum WriteOutcome {
    WRITTEN,
    /** The stream rejected the payload; the entry is lost. */
    FAILED,
    /** Discarded by the overflow policy before reaching the stream. */
    DROPPED
}
