package com.brainvault.controller;

import com.brainvault.dto.request.IdeaCreateRequest;
import com.brainvault.dto.request.IdeaUpdateRequest;
import com.brainvault.dto.response.IdeaAnalysisResponse;
import com.brainvault.dto.response.IdeaResponse;
import com.brainvault.dto.response.IdeaStatsResponse;
import com.brainvault.entity.Idea;
import com.brainvault.exception.ResourceNotFoundException;
import com.brainvault.repository.IdeaFilter;
import com.brainvault.service.IdeaService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for the caller's ideas.
 *
 * Every endpoint is scoped to the authenticated caller: the token subject is the owner
 * key, and an idea owned by anyone else answers 404 exactly like a missing one.
 *
 * Endpoints:
 * - POST   /api/v1/ideas                 capture (201), enrichment follows asynchronously
 * - GET    /api/v1/ideas                 list with filters and pagination, or search when q is set
 * - GET    /api/v1/ideas/search?q=       full-text search
 * - GET    /api/v1/ideas/stats/summary   counts
 * - GET    /api/v1/ideas/{id}            single idea
 * - GET    /api/v1/ideas/{id}/analysis   enrichment view
 * - PUT    /api/v1/ideas/{id}            partial update
 * - DELETE /api/v1/ideas/{id}            delete (204)
 */
@RestController
@RequestMapping("/api/v1/ideas")
@RequiredArgsConstructor
@Slf4j
public class IdeaController {

    private final IdeaService ideaService;

    @PostMapping
    public ResponseEntity<IdeaResponse> createIdea(
            @Valid @RequestBody IdeaCreateRequest request,
            Authentication authentication) {

        log.info("Idea capture request received from user: {}", authentication.getName());

        try {
            Idea idea = ideaService.createIdea(authentication.getName(), request.getContent(), request.getSource());

            return ResponseEntity
                    .status(HttpStatus.CREATED)
                    .body(IdeaResponse.from(idea));

        } catch (IllegalArgumentException e) {
            log.warn("Idea capture validation failed: {}", e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    /**
     * List ideas newest first. When q is present the request is answered by search, and
     * the filters and pagination are ignored.
     */
    @GetMapping
    public ResponseEntity<List<IdeaResponse>> listIdeas(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String theme,
            @RequestParam(required = false) String emotion,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "10") int limit,
            Authentication authentication) {

        String owner = authentication.getName();
        if (q != null && !q.isBlank()) {
            log.debug("Idea listing with query delegated to search: user={}", owner);
            return ResponseEntity.ok(toResponses(ideaService.searchIdeas(owner, q)));
        }

        IdeaFilter filter = IdeaFilter.builder()
                .project(project)
                .theme(theme)
                .emotion(emotion)
                .build();

        log.debug("Idea listing: user={}, filter={}, skip={}, limit={}", owner, filter, skip, limit);
        return ResponseEntity.ok(toResponses(ideaService.listIdeas(owner, filter, skip, limit)));
    }

    @GetMapping("/search")
    public ResponseEntity<List<IdeaResponse>> searchIdeas(
            @RequestParam String q,
            Authentication authentication) {

        return ResponseEntity.ok(toResponses(ideaService.searchIdeas(authentication.getName(), q)));
    }

    @GetMapping("/stats/summary")
    public ResponseEntity<IdeaStatsResponse> getStats(Authentication authentication) {
        return ResponseEntity.ok(ideaService.getStats(authentication.getName()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<IdeaResponse> getIdea(
            @PathVariable Long id,
            Authentication authentication) {

        return ResponseEntity.ok(IdeaResponse.from(ideaService.getIdea(id, authentication.getName())));
    }

    @GetMapping("/{id}/analysis")
    public ResponseEntity<IdeaAnalysisResponse> getAnalysis(
            @PathVariable Long id,
            Authentication authentication) {

        return ResponseEntity.ok(IdeaAnalysisResponse.from(ideaService.getIdea(id, authentication.getName())));
    }

    @PutMapping("/{id}")
    public ResponseEntity<IdeaResponse> updateIdea(
            @PathVariable Long id,
            @Valid @RequestBody IdeaUpdateRequest request,
            Authentication authentication) {

        log.info("Idea update request: id={}, user={}", id, authentication.getName());

        Idea idea = ideaService.updateIdea(id, authentication.getName(), request)
                .orElseThrow(ResourceNotFoundException::idea);

        return ResponseEntity.ok(IdeaResponse.from(idea));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteIdea(
            @PathVariable Long id,
            Authentication authentication) {

        log.info("Idea delete request: id={}, user={}", id, authentication.getName());

        if (!ideaService.deleteIdea(id, authentication.getName())) {
            throw ResourceNotFoundException.idea();
        }
        return ResponseEntity.noContent().build();
    }

    private List<IdeaResponse> toResponses(List<Idea> ideas) {
        return ideas.stream().map(IdeaResponse::from).toList();
    }
}
