package com.phillippitts.livetranslate.domain;

/** Which request triggered a processing job. */
public enum JobKind {
    /** Threshold-triggered pass while audio keeps streaming. */
    INTERIM,
    /** Pass requested by a client flush. */
    FINAL;

    public String tag() {
        return name().toLowerCase();
    }
}
