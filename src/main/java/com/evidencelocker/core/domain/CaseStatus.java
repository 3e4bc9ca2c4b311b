package com.evidencelocker.core.domain;

public enum CaseStatus {
    ACTIVE,
    COMPLETED,
    CLOSED,
    ARCHIVED
}
