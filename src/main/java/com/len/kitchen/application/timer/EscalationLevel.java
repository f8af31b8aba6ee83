package com.len.kitchen.application.timer;

public enum EscalationLevel {
    NORMAL,
    WARNING,
    CRITICAL
}
