package com.evidencelocker.core.api.dto;

import com.evidencelocker.core.domain.CasePriority;
import com.evidencelocker.core.domain.CaseRecord;
import com.evidencelocker.core.domain.CaseStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaseView(UUID id, String caseNumber, String title, String description, UUID creatorId,
                       UUID leadInvestigatorId, UUID assignedToId, String findings, OffsetDateTime dueDate,
                       CaseStatus status, CasePriority priority, OffsetDateTime createdAt,
                       OffsetDateTime updatedAt, long version, Long evidenceCount) {

    public static CaseView of(CaseRecord c) {
        return of(c, null);
    }

    public static CaseView of(CaseRecord c, Long evidenceCount) {
        return new CaseView(c.getId(), c.getCaseNumber(), c.getTitle(), c.getDescription(), c.getCreatorId(),
                c.getLeadInvestigatorId(), c.getAssignedToId(), c.getFindings(), c.getDueDate(), c.getStatus(),
                c.getPriority(), c.getCreatedAt(), c.getUpdatedAt(), c.getVersion(), evidenceCount);
    }
}
