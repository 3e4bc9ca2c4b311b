package com.evidencelocker.core.infrastructure.adapters;

import com.evidencelocker.core.domain.CustodyAction;
import com.evidencelocker.core.domain.CustodyEntry;
import com.evidencelocker.core.domain.ports.CustodyLedgerRepository;
import com.evidencelocker.core.infrastructure.jpa.CustodyEntryEntity;
import com.evidencelocker.core.infrastructure.jpa.SpringCustodyRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaCustodyLedgerAdapter implements CustodyLedgerRepository {
    private final SpringCustodyRepository ledger;

    public JpaCustodyLedgerAdapter(SpringCustodyRepository ledger) {
        this.ledger = ledger;
    }

    @Override
    public CustodyEntry append(CustodyEntry c) {
        CustodyEntryEntity e = new CustodyEntryEntity();
        e.setId(c.id());
        e.setEvidenceId(c.evidenceId());
        e.setSequenceNo(c.sequenceNo());
        e.setAction(c.action().name());
        e.setFromPrincipalId(c.fromPrincipalId());
        e.setToPrincipalId(c.toPrincipalId());
        e.setLocation(c.location());
        e.setNotes(c.notes());
        e.setOccurredAt(c.occurredAt());
        e.setPreviousHash(c.previousHash());
        e.setEntryHash(c.entryHash());
        // flush inside the lock so the next appender sees this row
        ledger.saveAndFlush(e);
        return c;
    }

    @Override
    public Optional<CustodyEntry> findById(UUID entryId) {
        return ledger.findById(entryId).map(JpaCustodyLedgerAdapter::toDomain);
    }

    @Override
    public Optional<CustodyEntry> findLatest(UUID evidenceId) {
        return ledger.findFirstByEvidenceIdOrderBySequenceNoDesc(evidenceId).map(JpaCustodyLedgerAdapter::toDomain);
    }

    @Override
    public List<CustodyEntry> findByEvidenceNewestFirst(UUID evidenceId) {
        return ledger.findByEvidenceIdOrderBySequenceNoDesc(evidenceId).stream().map(JpaCustodyLedgerAdapter::toDomain).toList();
    }

    @Override
    public List<CustodyEntry> findByEvidenceOldestFirst(UUID evidenceId) {
        return ledger.findByEvidenceIdOrderBySequenceNoAsc(evidenceId).stream().map(JpaCustodyLedgerAdapter::toDomain).toList();
    }

    private static CustodyEntry toDomain(CustodyEntryEntity e) {
        return new CustodyEntry(e.getId(), e.getEvidenceId(), e.getSequenceNo(), CustodyAction.valueOf(e.getAction()),
                e.getFromPrincipalId(), e.getToPrincipalId(), e.getLocation(), e.getNotes(), e.getOccurredAt(),
                e.getPreviousHash(), e.getEntryHash());
    }
}
