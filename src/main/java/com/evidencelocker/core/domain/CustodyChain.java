package com.evidencelocker.core.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds and checks the SHA-256 links between consecutive custody entries of one evidence item.
 *
 * <p>Each entry hashes the previous entry's hash together with its own fields, so editing or
 * removing any stored row breaks every later link.
 */
public final class CustodyChain {

    private CustodyChain() {
    }

    /**
     * Creates the entry that follows {@code previous} (null for the first one). The timestamp is
     * kept strictly after the previous entry's, moving forward by one microsecond when the clock
     * has not advanced.
     */
    public static CustodyEntry next(CustodyEntry previous, UUID entryId, UUID evidenceId, CustodyAction action,
                                    UUID fromPrincipalId, UUID toPrincipalId, String location, String notes,
                                    OffsetDateTime now) {
        OffsetDateTime occurredAt = now.truncatedTo(ChronoUnit.MICROS);
        long sequenceNo = 1;
        String previousHash = null;
        if (previous != null) {
            sequenceNo = previous.sequenceNo() + 1;
            previousHash = previous.entryHash();
            if (!occurredAt.isAfter(previous.occurredAt())) {
                occurredAt = previous.occurredAt().plus(1, ChronoUnit.MICROS);
            }
        }
        String entryHash = hash(previousHash, evidenceId, sequenceNo, action, fromPrincipalId, toPrincipalId,
                location, notes, occurredAt);
        return new CustodyEntry(entryId, evidenceId, sequenceNo, action, fromPrincipalId, toPrincipalId,
                location, notes, occurredAt, previousHash, entryHash);
    }

    /**
     * Recomputes every link of a chain given oldest first.
     */
    public static CustodyChainVerification verify(UUID evidenceId, List<CustodyEntry> oldestFirst, OffsetDateTime now) {
        if (oldestFirst.isEmpty()) {
            return new CustodyChainVerification(evidenceId, CustodyChainVerification.Status.EMPTY, 0, 0, now, null);
        }

        CustodyEntry previous = null;
        long verified = 0;
        for (CustodyEntry entry : oldestFirst) {
            String problem = null;
            String expectedPrevious = previous == null ? null : previous.entryHash();
            long expectedSequence = previous == null ? 1 : previous.sequenceNo() + 1;
            String recomputed = hash(entry.previousHash(), entry.evidenceId(), entry.sequenceNo(), entry.action(),
                    entry.fromPrincipalId(), entry.toPrincipalId(), entry.location(), entry.notes(), entry.occurredAt());

            if (entry.sequenceNo() != expectedSequence) {
                problem = "sequence gap, expected " + expectedSequence;
            } else if (!Objects.equals(entry.previousHash(), expectedPrevious)) {
                problem = "previous hash does not match preceding entry";
            } else if (previous != null && !entry.occurredAt().isAfter(previous.occurredAt())) {
                problem = "timestamp not after preceding entry";
            } else if (!recomputed.equals(entry.entryHash())) {
                problem = "entry hash does not match contents";
            }

            if (problem != null) {
                return new CustodyChainVerification(evidenceId, CustodyChainVerification.Status.BROKEN,
                        oldestFirst.size(), verified, now,
                        new CustodyChainVerification.BrokenLink(entry.id(), entry.sequenceNo(), problem,
                                recomputed, entry.entryHash()));
            }
            verified++;
            previous = entry;
        }
        return new CustodyChainVerification(evidenceId, CustodyChainVerification.Status.VALID,
                oldestFirst.size(), verified, now, null);
    }

    static String hash(String previousHash, UUID evidenceId, long sequenceNo, CustodyAction action,
                       UUID fromPrincipalId, UUID toPrincipalId, String location, String notes,
                       OffsetDateTime occurredAt) {
        // Length-prefixed fields so that no choice of notes text can imitate another field layout
        StringBuilder canonical = new StringBuilder();
        append(canonical, previousHash);
        append(canonical, evidenceId);
        append(canonical, sequenceNo);
        append(canonical, action);
        append(canonical, fromPrincipalId);
        append(canonical, toPrincipalId);
        append(canonical, location);
        append(canonical, notes);
        append(canonical, occurredAt.toInstant());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void append(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("-1:");
            return;
        }
        String s = value.toString();
        sb.append(s.length()).append(':').append(s);
    }
}
