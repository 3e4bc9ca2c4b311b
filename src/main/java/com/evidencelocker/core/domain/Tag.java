package com.evidencelocker.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public record Tag(UUID id, String name, String color, UUID creatorId, OffsetDateTime createdAt) {
}
