package com.evidencelocker.core.domain;

public enum Role {
    ADMIN,
    INVESTIGATOR,
    ANALYST,
    LEGAL
}
