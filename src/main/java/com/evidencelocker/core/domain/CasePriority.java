package com.evidencelocker.core.domain;

public enum CasePriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
