package com.evidencelocker.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Partial update of a case. A null field means "leave unchanged"; the unassign flags clear the
 * relation explicitly.
 */
public record CaseChanges(
        String title,
        String description,
        String findings,
        OffsetDateTime dueDate,
        CaseStatus status,
        CasePriority priority,
        UUID leadInvestigatorId,
        boolean clearLeadInvestigator,
        UUID assignedToId,
        boolean clearAssignee
) {

    public boolean touchesRelations() {
        return leadInvestigatorId != null || clearLeadInvestigator || assignedToId != null || clearAssignee;
    }
}
