package com.evidencelocker.core.domain.ports;

import com.evidencelocker.core.domain.Tag;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TagRepository {
    Tag save(Tag tag);
    Optional<Tag> findById(UUID tagId);
    List<Tag> findAllNewestFirst();
    Optional<Tag> findByName(String name);
    Tag update(UUID tagId, String name, String color);
    void delete(UUID tagId);

    List<Tag> findByEvidence(UUID evidenceId);
    boolean attach(UUID evidenceId, UUID tagId);
    boolean detach(UUID evidenceId, UUID tagId);
}
