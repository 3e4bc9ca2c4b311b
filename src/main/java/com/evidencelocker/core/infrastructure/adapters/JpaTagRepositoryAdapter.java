package com.evidencelocker.core.infrastructure.adapters;

import com.evidencelocker.core.domain.ResourceType;
import com.evidencelocker.core.domain.Tag;
import com.evidencelocker.core.domain.ports.TagRepository;
import com.evidencelocker.core.exception.ResourceNotFoundException;
import com.evidencelocker.core.infrastructure.jpa.SpringTagRepository;
import com.evidencelocker.core.infrastructure.jpa.TagEntity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaTagRepositoryAdapter implements TagRepository {
    private final SpringTagRepository tags;

    public JpaTagRepositoryAdapter(SpringTagRepository tags) {
        this.tags = tags;
    }

    @Override
    public Tag save(Tag t) {
        TagEntity e = new TagEntity();
        e.setId(t.id());
        e.setName(t.name());
        e.setColor(t.color());
        e.setCreatedBy(t.creatorId());
        e.setCreatedAt(t.createdAt());
        return toDomain(tags.save(e));
    }

    @Override
    public Optional<Tag> findById(UUID tagId) {
        return tags.findById(tagId).map(JpaTagRepositoryAdapter::toDomain);
    }

    @Override
    public List<Tag> findAllNewestFirst() {
        return tags.findAllByOrderByCreatedAtDesc().stream().map(JpaTagRepositoryAdapter::toDomain).toList();
    }

    @Override
    public Optional<Tag> findByName(String name) {
        return tags.findByName(name).map(JpaTagRepositoryAdapter::toDomain);
    }

    @Override
    public Tag update(UUID tagId, String name, String color) {
        TagEntity e = tags.findById(tagId).orElseThrow(() -> new ResourceNotFoundException(ResourceType.TAG, tagId));
        e.setName(name);
        e.setColor(color);
        return toDomain(tags.save(e));
    }

    @Override
    public void delete(UUID tagId) {
        tags.deleteById(tagId);
    }

    @Override
    public List<Tag> findByEvidence(UUID evidenceId) {
        return tags.findByEvidenceId(evidenceId).stream().map(JpaTagRepositoryAdapter::toDomain).toList();
    }

    @Override
    public boolean attach(UUID evidenceId, UUID tagId) {
        if (tags.countLinks(evidenceId, tagId) > 0) {
            return false;
        }
        return tags.insertLink(evidenceId, tagId) == 1;
    }

    @Override
    public boolean detach(UUID evidenceId, UUID tagId) {
        return tags.deleteLink(evidenceId, tagId) > 0;
    }

    private static Tag toDomain(TagEntity e) {
        return new Tag(e.getId(), e.getName(), e.getColor(), e.getCreatedBy(), e.getCreatedAt());
    }
}
