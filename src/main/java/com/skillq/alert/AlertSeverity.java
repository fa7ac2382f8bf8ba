package com.skillq.alert;

public enum AlertSeverity {
    WARNING,
    ERROR,
    CRITICAL
}
