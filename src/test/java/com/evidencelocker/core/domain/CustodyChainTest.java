package com.evidencelocker.core.domain;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CustodyChainTest {

    private final UUID evidenceId = UUID.randomUUID();
    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final OffsetDateTime t0 = OffsetDateTime.parse("2026-05-10T08:00:00Z");

    private List<CustodyEntry> chainOfThree() {
        List<CustodyEntry> chain = new ArrayList<>();
        CustodyEntry first = CustodyChain.next(null, UUID.randomUUID(), evidenceId, CustodyAction.CREATED,
                null, alice, "Intake desk", null, t0);
        chain.add(first);
        CustodyEntry second = CustodyChain.next(first, UUID.randomUUID(), evidenceId, CustodyAction.TRANSFERRED,
                alice, bob, "Lab 2", "sealed bag #7", t0.plusMinutes(5));
        chain.add(second);
        chain.add(CustodyChain.next(second, UUID.randomUUID(), evidenceId, CustodyAction.ACCESSED,
                bob, null, "Lab 2", null, t0.plusMinutes(9)));
        return chain;
    }

    @Test
    void firstEntryStartsTheChain() {
        CustodyEntry first = CustodyChain.next(null, UUID.randomUUID(), evidenceId, CustodyAction.CREATED,
                null, alice, "Intake desk", null, t0);

        assertThat(first.sequenceNo()).isEqualTo(1);
        assertThat(first.previousHash()).isNull();
        assertThat(first.entryHash()).hasSize(64);
    }

    @Test
    void nextEntryLinksToPrevious() {
        List<CustodyEntry> chain = chainOfThree();

        assertThat(chain).extracting(CustodyEntry::sequenceNo).containsExactly(1L, 2L, 3L);
        assertThat(chain.get(1).previousHash()).isEqualTo(chain.get(0).entryHash());
        assertThat(chain.get(2).previousHash()).isEqualTo(chain.get(1).entryHash());
    }

    @Test
    void timestampMovesForwardWhenClockStandsStill() {
        CustodyEntry first = CustodyChain.next(null, UUID.randomUUID(), evidenceId, CustodyAction.CREATED,
                null, alice, "Intake desk", null, t0);
        CustodyEntry second = CustodyChain.next(first, UUID.randomUUID(), evidenceId, CustodyAction.ACCESSED,
                alice, null, "Intake desk", null, t0.minusSeconds(3));

        assertThat(second.occurredAt()).isEqualTo(t0.plusNanos(1000));
    }

    @Test
    void intactChainVerifies() {
        CustodyChainVerification result = CustodyChain.verify(evidenceId, chainOfThree(), t0.plusHours(1));

        assertThat(result.status()).isEqualTo(CustodyChainVerification.Status.VALID);
        assertThat(result.totalEntries()).isEqualTo(3);
        assertThat(result.verifiedEntries()).isEqualTo(3);
        assertThat(result.brokenLink()).isNull();
    }

    @Test
    void emptyChainIsReportedAsEmpty() {
        assertThat(CustodyChain.verify(evidenceId, List.of(), t0).status())
                .isEqualTo(CustodyChainVerification.Status.EMPTY);
    }

    @Test
    void editedLocationBreaksTheChainAtThatEntry() {
        List<CustodyEntry> chain = chainOfThree();
        CustodyEntry original = chain.get(1);
        chain.set(1, new CustodyEntry(original.id(), original.evidenceId(), original.sequenceNo(), original.action(),
                original.fromPrincipalId(), original.toPrincipalId(), "Somewhere else", original.notes(),
                original.occurredAt(), original.previousHash(), original.entryHash()));

        CustodyChainVerification result = CustodyChain.verify(evidenceId, chain, t0.plusHours(1));

        assertThat(result.status()).isEqualTo(CustodyChainVerification.Status.BROKEN);
        assertThat(result.verifiedEntries()).isEqualTo(1);
        assertThat(result.brokenLink().sequenceNo()).isEqualTo(2);
        assertThat(result.brokenLink().problem()).contains("hash");
    }

    @Test
    void removedEntryShowsAsSequenceGap() {
        List<CustodyEntry> chain = chainOfThree();
        chain.remove(1);

        CustodyChainVerification result = CustodyChain.verify(evidenceId, chain, t0.plusHours(1));

        assertThat(result.status()).isEqualTo(CustodyChainVerification.Status.BROKEN);
        assertThat(result.brokenLink().sequenceNo()).isEqualTo(3);
        assertThat(result.brokenLink().problem()).startsWith("sequence gap");
    }

    @Test
    void hashDependsOnInstantNotOffset() {
        OffsetDateTime sameInstant = t0.withOffsetSameInstant(ZoneOffset.ofHours(2));

        String a = CustodyChain.hash(null, evidenceId, 1, CustodyAction.CREATED, null, alice, "Desk", null, t0);
        String b = CustodyChain.hash(null, evidenceId, 1, CustodyAction.CREATED, null, alice, "Desk", null, sameInstant);

        assertThat(a).isEqualTo(b);
    }
}
