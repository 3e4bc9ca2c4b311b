package com.evidencelocker.core.api;

import com.evidencelocker.core.api.dto.CommentRequest;
import com.evidencelocker.core.application.CommentService;
import com.evidencelocker.core.config.IdentityContext;
import com.evidencelocker.core.domain.Comment;
import com.evidencelocker.core.domain.ResourceType;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@Tag(name = "Comments", description = "Notes on cases and evidence items")
public class CommentController {

    private final CommentService comments;
    private final IdentityContext identity;

    public CommentController(CommentService comments, IdentityContext identity) {
        this.comments = comments;
        this.identity = identity;
    }

    @GetMapping("/cases/{id}/comments")
    public List<Comment> listForCase(@PathVariable("id") UUID caseId) {
        return comments.list(identity.currentPrincipal(), ResourceType.CASE, caseId);
    }

    @PostMapping("/cases/{id}/comments")
    public ResponseEntity<Comment> addToCase(@PathVariable("id") UUID caseId, @Valid @RequestBody CommentRequest r) {
        Comment created = comments.add(identity.currentPrincipal(), ResourceType.CASE, caseId, r.content);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/evidence/{id}/comments")
    public List<Comment> listForEvidence(@PathVariable("id") UUID evidenceId) {
        return comments.list(identity.currentPrincipal(), ResourceType.EVIDENCE, evidenceId);
    }

    @PostMapping("/evidence/{id}/comments")
    public ResponseEntity<Comment> addToEvidence(@PathVariable("id") UUID evidenceId, @Valid @RequestBody CommentRequest r) {
        Comment created = comments.add(identity.currentPrincipal(), ResourceType.EVIDENCE, evidenceId, r.content);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/comments/{id}")
    public Comment edit(@PathVariable("id") UUID commentId, @Valid @RequestBody CommentRequest r) {
        return comments.edit(identity.currentPrincipal(), commentId, r.content);
    }

    @DeleteMapping("/comments/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID commentId) {
        comments.delete(identity.currentPrincipal(), commentId);
        return ResponseEntity.noContent().build();
    }
}
