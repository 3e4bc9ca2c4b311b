package com.evidencelocker.core.domain.policy;

import com.evidencelocker.core.domain.ResourceType;

import java.util.UUID;

/**
 * Relation set of one resource, read in a single consistent snapshot.
 */
public interface ProtectedResource {

    ResourceType type();

    UUID id();
}
