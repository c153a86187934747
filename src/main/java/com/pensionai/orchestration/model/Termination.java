package com.pensionai.orchestration.model;

public enum Termination {
    CONSOLIDATED,
    FINISHED,
    TURN_CAP,
    TIMEOUT,
    CANCELLED,
    FAILED;

    public boolean isPartial() {
        return this == TURN_CAP || this == TIMEOUT || this == CANCELLED || this == FAILED;
    }
}
