package com.evidencelocker.core.infrastructure.adapters;

import com.evidencelocker.core.domain.Evidence;
import com.evidencelocker.core.domain.EvidenceStatus;
import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.ports.EvidenceRepository;
import com.evidencelocker.core.exception.ConflictException;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.infrastructure.jpa.EvidenceEntity;
import com.evidencelocker.core.infrastructure.jpa.SpringEvidenceRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaEvidenceRepositoryAdapter implements EvidenceRepository {
    private final SpringEvidenceRepository evidence;
    private final Clock clock;

    public JpaEvidenceRepositoryAdapter(SpringEvidenceRepository evidence, Clock clock) {
        this.evidence = evidence;
        this.clock = clock;
    }

    @Override
    public Evidence save(Evidence ev) {
        EvidenceEntity e = new EvidenceEntity();
        e.setId(ev.getId());
        e.setCaseId(ev.getCaseId());
        e.setTitle(ev.getTitle());
        e.setDescription(ev.getDescription());
        e.setFileName(ev.getFileName());
        e.setFileRef(ev.getFileRef());
        e.setFileSize(ev.getFileSize());
        e.setFileType(ev.getFileType());
        e.setHashValue(ev.getHashValue());
        e.setStatus(ev.getStatus().name());
        e.setCollectedAt(ev.getCollectedAt());
        e.setCollectedBy(ev.getCollectedBy());
        e.setLocationFound(ev.getLocationFound());
        e.setUploadedBy(ev.getUploaderId());
        e.setCreatedAt(ev.getCreatedAt());
        e.setUpdatedAt(ev.getUpdatedAt());
        return toDomain(evidence.saveAndFlush(e));
    }

    @Override
    public Optional<Evidence> findById(UUID evidenceId) {
        return evidence.findById(evidenceId).map(JpaEvidenceRepositoryAdapter::toDomain);
    }

    @Override
    public List<Evidence> findAllById(Collection<UUID> evidenceIds) {
        return evidence.findAllById(evidenceIds).stream().map(JpaEvidenceRepositoryAdapter::toDomain).toList();
    }

    @Override
    public long countByCase(UUID caseId) {
        return evidence.countByCaseId(caseId);
    }

    @Override
    public Evidence updateStatus(UUID evidenceId, EvidenceStatus status, Long expectedVersion) {
        EvidenceEntity e = evidence.findById(evidenceId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EVIDENCE, evidenceId));
        if (expectedVersion != null && !expectedVersion.equals(e.getVersion())) {
            throw new ConflictException("Evidence " + evidenceId + " is at version " + e.getVersion()
                    + ", not " + expectedVersion);
        }
        e.setStatus(status.name());
        e.setUpdatedAt(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS));
        return toDomain(evidence.saveAndFlush(e));
    }

    @Override
    public boolean lockForAppend(UUID evidenceId) {
        return evidence.findForUpdateById(evidenceId).isPresent();
    }

    private static Evidence toDomain(EvidenceEntity e) {
        return new Evidence(e.getId(), e.getCaseId(), e.getTitle(), e.getDescription(), e.getFileName(),
                e.getFileRef(), e.getFileSize(), e.getFileType(), e.getHashValue(),
                EvidenceStatus.valueOf(e.getStatus()), e.getCollectedAt(), e.getCollectedBy(),
                e.getLocationFound(), e.getUploadedBy(), e.getCreatedAt(), e.getUpdatedAt(),
                e.getVersion() == null ? 0L : e.getVersion());
    }
}
