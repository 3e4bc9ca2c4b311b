package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.CustodyAction;

import java.util.UUID;

public class CustodyAppendCommand {
    public final UUID evidenceId;
    public final CustodyAction action;
    public final UUID fromPrincipalId;
    public final UUID toPrincipalId;
    public final String location;
    public final String notes;

    public CustodyAppendCommand(UUID evidenceId, CustodyAction action, UUID fromPrincipalId, UUID toPrincipalId,
                                String location, String notes) {
        this.evidenceId = evidenceId;
        this.action = action;
        this.fromPrincipalId = fromPrincipalId;
        this.toPrincipalId = toPrincipalId;
        this.location = location;
        this.notes = notes;
    }
}
