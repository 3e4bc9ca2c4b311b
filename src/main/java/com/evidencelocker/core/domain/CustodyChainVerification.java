package com.evidencelocker.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustodyChainVerification(
        UUID evidenceId,
        Status status,
        long totalEntries,
        long verifiedEntries,
        OffsetDateTime verifiedAt,
        BrokenLink brokenLink
) {
    public record BrokenLink(UUID entryId, long sequenceNo, String problem, String expectedHash, String actualHash) {}

    public enum Status { VALID, BROKEN, EMPTY }
}
