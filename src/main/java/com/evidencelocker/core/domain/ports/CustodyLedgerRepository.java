package com.evidencelocker.core.domain.ports;

import com.evidencelocker.core.domain.CustodyEntry;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store for chain-of-custody entries: no update, no delete.
 */
public interface CustodyLedgerRepository {
    CustodyEntry append(CustodyEntry entry);
    Optional<CustodyEntry> findById(UUID entryId);
    Optional<CustodyEntry> findLatest(UUID evidenceId);
    List<CustodyEntry> findByEvidenceNewestFirst(UUID evidenceId);
    List<CustodyEntry> findByEvidenceOldestFirst(UUID evidenceId);
}
