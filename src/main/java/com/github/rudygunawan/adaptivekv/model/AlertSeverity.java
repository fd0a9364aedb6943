package com.github.rudygunawan.adaptivekv.model;

public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
