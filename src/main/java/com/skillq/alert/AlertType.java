package com.skillq.alert;

public enum AlertType {
    JOB_FAILED,
    JOB_STUCK,
    HIGH_ERROR_RATE
}
