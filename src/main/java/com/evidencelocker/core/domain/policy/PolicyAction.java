package com.evidencelocker.core.domain.policy;

public enum PolicyAction {
    READ,
    UPDATE,
    DELETE
}
