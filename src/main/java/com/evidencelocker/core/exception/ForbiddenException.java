package com.evidencelocker.core.exception;

import com.evidencelocker.core.domain.ResourceType;

import java.util.UUID;

/**
 * Thrown when the access policy denies an operation. The message is logged server-side only.
 */
public class ForbiddenException extends RuntimeException {

    private final ResourceType resourceType;
    private final UUID resourceId;

    public ForbiddenException(ResourceType resourceType, UUID resourceId, String message) {
        super(message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public ForbiddenException(String message) {
        this(null, null, message);
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public UUID getResourceId() {
        return resourceId;
    }
}
