package com.evidencelocker.core.exception;

import com.evidencelocker.core.domain.ResourceType;

import java.util.UUID;

/**
 * Thrown when a resource does not exist, or when existence hiding is enabled and the policy
 * denied access to it.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final ResourceType resourceType;
    private final UUID resourceId;

    public ResourceNotFoundException(ResourceType resourceType, UUID resourceId) {
        super(resourceType + " " + resourceId + " not found");
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public UUID getResourceId() {
        return resourceId;
    }
}
