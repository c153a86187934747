package com.pensionai.orchestration.model;

public enum MessageRole {
    USER,
    WORKER,
    SYSTEM_NOTE
}
