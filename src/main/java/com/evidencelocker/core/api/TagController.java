package com.evidencelocker.core.api;

import com.evidencelocker.core.api.dto.TagRequest;
import com.evidencelocker.core.application.TagService;
import com.evidencelocker.core.config.IdentityContext;
import com.evidencelocker.core.domain.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@io.swagger.v3.oas.annotations.tags.Tag(name = "Tags", description = "Evidence labels")
public class TagController {

    private final TagService tags;
    private final IdentityContext identity;

    public TagController(TagService tags, IdentityContext identity) {
        this.tags = tags;
        this.identity = identity;
    }

    @GetMapping("/tags")
    public List<Tag> list() {
        return tags.list(identity.currentPrincipal());
    }

    @PostMapping("/tags")
    public ResponseEntity<Tag> create(@Valid @RequestBody TagRequest r) {
        Tag created = tags.create(identity.currentPrincipal(), r.name, r.color);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/tags/{id}")
    public Tag update(@PathVariable("id") UUID tagId, @Valid @RequestBody TagRequest r) {
        return tags.update(identity.currentPrincipal(), tagId, r.name, r.color);
    }

    @DeleteMapping("/tags/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID tagId) {
        tags.delete(identity.currentPrincipal(), tagId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/evidence/{id}/tags")
    public List<Tag> tagsFor(@PathVariable("id") UUID evidenceId) {
        return tags.tagsFor(identity.currentPrincipal(), evidenceId);
    }

    @PutMapping("/evidence/{id}/tags/{tagId}")
    public ResponseEntity<Void> attach(@PathVariable("id") UUID evidenceId, @PathVariable("tagId") UUID tagId) {
        tags.attach(identity.currentPrincipal(), evidenceId, tagId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/evidence/{id}/tags/{tagId}")
    public ResponseEntity<Void> detach(@PathVariable("id") UUID evidenceId, @PathVariable("tagId") UUID tagId) {
        tags.detach(identity.currentPrincipal(), evidenceId, tagId);
        return ResponseEntity.noContent().build();
    }
}
