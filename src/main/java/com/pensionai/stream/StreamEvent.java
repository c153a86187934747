package com.pensionai.stream;

import java.time.Instant;

public record StreamEvent(long id, Instant timestamp, String type, Object data) {

    public static final String STATUS = "status";
    public static final String STEP = "step";
    public static final String FINAL = "final";
    public static final String ERROR = "error";
    public static final String RUN_COMPLETE = "run-complete";
    public static final String RUN_CANCEL = "run-cancel";

    static boolean endsRun(String type) {
        return RUN_COMPLETE.equals(type) || ERROR.equals(type);
    }
}
