package com.evidencelocker.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One immutable link in an evidence item's chain of custody. {@code sequenceNo} starts at 1 and
 * {@code entryHash} covers {@code previousHash} plus every other field.
 */
public record CustodyEntry(
        UUID id,
        UUID evidenceId,
        long sequenceNo,
        CustodyAction action,
        UUID fromPrincipalId,
        UUID toPrincipalId,
        String location,
        String notes,
        OffsetDateTime occurredAt,
        String previousHash,
        String entryHash
) {
}
