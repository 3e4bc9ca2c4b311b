package com.evidencelocker.core.domain;

public enum CustodyAction {
    CREATED,
    TRANSFERRED,
    ACCESSED,
    DOWNLOADED,
    MODIFIED,
    ARCHIVED
}
