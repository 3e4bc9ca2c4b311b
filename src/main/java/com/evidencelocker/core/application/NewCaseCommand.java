package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.CasePriority;
import com.evidencelocker.core.domain.CaseStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public class NewCaseCommand {
    public final String caseNumber;
    public final String title;
    public final String description;
    public final CaseStatus status;
    public final CasePriority priority;
    public final UUID leadInvestigatorId;
    public final UUID assignedToId;
    public final OffsetDateTime dueDate;

    public NewCaseCommand(String caseNumber, String title, String description, CaseStatus status,
                          CasePriority priority, UUID leadInvestigatorId, UUID assignedToId, OffsetDateTime dueDate) {
        this.caseNumber = caseNumber;
        this.title = title;
        this.description = description;
        this.status = status;
        this.priority = priority;
        this.leadInvestigatorId = leadInvestigatorId;
        this.assignedToId = assignedToId;
        this.dueDate = dueDate;
    }
}
