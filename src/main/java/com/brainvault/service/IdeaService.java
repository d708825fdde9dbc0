package com.brainvault.service;

import com.brainvault.dto.request.IdeaUpdateRequest;
import com.brainvault.dto.response.IdeaStatsResponse;
import com.brainvault.entity.Idea;
import com.brainvault.exception.ResourceNotFoundException;
import com.brainvault.messaging.IdeaCapturedEvent;
import com.brainvault.repository.IdeaFilter;
import com.brainvault.repository.IdeaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Owner-scoped store of ideas.
 *
 * Every read and write is filtered by the caller's owner key (the external auth id).
 * A foreign idea is treated exactly like a missing one: lookups come back empty, deletes
 * return false, and the HTTP layer answers 404 in both cases.
 *
 * Capture Flow:
 * 1. Validate content (1..10000 characters) and default the source to "manual"
 * 2. Persist the idea with null enrichment fields
 * 3. Publish IdeaCapturedEvent; enrichment is queued once the transaction commits
 * 4. Return the stored idea without waiting for enrichment
 *
 * Concurrency:
 * - No version column; concurrent writes to one idea are last-write-wins per field
 * - Enrichment writes only project/theme/emotion, user edits only the fields they carry
 *
 * @see com.brainvault.messaging.IdeaEnrichmentDispatcher
 * @see EnrichmentService
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdeaService {

    public static final String DEFAULT_SOURCE = "manual";
    public static final int MAX_LIMIT = 100;

    private final IdeaRepository ideaRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Capture a new idea.
     *
     * @param owner the caller's external auth id
     * @param content idea text, 1..10000 characters
     * @param source origin tag, null for "manual"
     * @return the stored idea, enrichment fields null
     * @throws IllegalArgumentException if content is empty or too long
     */
    @Transactional
    public Idea createIdea(String owner, String content, String source) {
        validateOwner(owner);
        validateContent(content);

        String resolvedSource = (source == null || source.trim().isEmpty()) ? DEFAULT_SOURCE : source.trim();

        Idea idea = ideaRepository.save(new Idea(owner, content, resolvedSource));
        log.info("Idea captured: id={}, user={}, source={}", idea.getId(), owner, resolvedSource);
        log.debug("Idea content length: {} characters", content.length());

        eventPublisher.publishEvent(new IdeaCapturedEvent(this, idea.getId()));

        return idea;
    }

    @Transactional(readOnly = true)
    public Optional<Idea> findIdea(Long id, String owner) {
        if (id == null || owner == null) {
            return Optional.empty();
        }
        return ideaRepository.findByIdAndUserId(id, owner);
    }

    /**
     * @throws ResourceNotFoundException if the idea is absent or owned by someone else
     */
    @Transactional(readOnly = true)
    public Idea getIdea(Long id, String owner) {
        return findIdea(id, owner).orElseThrow(() -> {
            log.debug("Idea not visible to caller: id={}, user={}", id, owner);
            return ResourceNotFoundException.idea();
        });
    }

    /**
     * List the caller's ideas, newest first.
     *
     * @param skip number of ideas to skip, at least 0
     * @param limit page size, 1..100
     * @throws IllegalArgumentException if skip or limit is out of range
     */
    @Transactional(readOnly = true)
    public List<Idea> listIdeas(String owner, IdeaFilter filter, int skip, int limit) {
        validateOwner(owner);
        if (skip < 0) {
            log.warn("Idea listing rejected: skip={}", skip);
            throw new IllegalArgumentException("Skip must be greater than or equal to 0");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            log.warn("Idea listing rejected: limit={}", limit);
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT);
        }

        return ideaRepository.findByOwner(owner, filter == null ? IdeaFilter.none() : filter, skip, limit);
    }

    /**
     * Full-text search over the caller's ideas, newest first.
     *
     * @throws IllegalArgumentException if the query is blank
     */
    @Transactional(readOnly = true)
    public List<Idea> searchIdeas(String owner, String query) {
        validateOwner(owner);
        if (query == null || query.trim().isEmpty()) {
            log.warn("Idea search rejected: empty query");
            throw new IllegalArgumentException("Search query cannot be empty");
        }

        List<Idea> results = ideaRepository.searchByContent(owner, query.trim());
        log.debug("Idea search: user={}, matches={}", owner, results.size());
        return results;
    }

    /**
     * Apply a partial update. Present fields overwrite, absent fields stay as they are.
     *
     * @return the updated idea, or empty if the caller has no such idea
     */
    @Transactional
    public Optional<Idea> updateIdea(Long id, String owner, IdeaUpdateRequest update) {
        Optional<Idea> existing = findIdea(id, owner);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Idea idea = existing.get();
        if (update == null || update.isEmpty()) {
            log.debug("No-op idea update: id={}", id);
            return Optional.of(idea);
        }

        if (update.getContent() != null) {
            validateContent(update.getContent());
            idea.setContent(update.getContent());
        }
        if (update.getProject() != null) {
            idea.setProject(update.getProject());
        }
        if (update.getTheme() != null) {
            idea.setTheme(update.getTheme());
        }
        if (update.getEmotion() != null) {
            idea.setEmotion(update.getEmotion());
        }
        if (update.getTransformedOutput() != null) {
            idea.setTransformedOutput(update.getTransformedOutput());
        }

        Idea saved = ideaRepository.save(idea);
        log.info("Idea updated: id={}, user={}", id, owner);
        return Optional.of(saved);
    }

    /**
     * @return true iff an idea matching both id and owner was removed
     */
    @Transactional
    public boolean deleteIdea(Long id, String owner) {
        if (id == null || owner == null) {
            return false;
        }
        boolean deleted = ideaRepository.deleteByIdAndOwner(id, owner) > 0;
        log.info("Idea delete: id={}, user={}, deleted={}", id, owner, deleted);
        return deleted;
    }

    /**
     * Remove every idea of an owner. Used when the owner's account is deleted.
     *
     * @return number of ideas removed
     */
    @Transactional
    public int deleteAllIdeas(String owner) {
        validateOwner(owner);
        int deleted = ideaRepository.deleteAllByOwner(owner);
        log.info("Deleted all ideas of user: user={}, count={}", owner, deleted);
        return deleted;
    }

    /**
     * Aggregate counts for the caller. "This month" starts at the first instant of the
     * current calendar month in the server time zone.
     */
    @Transactional(readOnly = true)
    public IdeaStatsResponse getStats(String owner) {
        validateOwner(owner);
        LocalDateTime monthStart = LocalDate.now().withDayOfMonth(1).atStartOfDay();

        return IdeaStatsResponse.builder()
                .totalIdeas(ideaRepository.countByUserId(owner))
                .ideasThisMonth(ideaRepository.countByUserIdAndCreatedAtGreaterThanEqual(owner, monthStart))
                .projectsCount(ideaRepository.countDistinctProjects(owner))
                .themesCount(ideaRepository.countDistinctThemes(owner))
                .emotionsCount(ideaRepository.countDistinctEmotions(owner))
                .build();
    }

    /**
     * Write enrichment results. Keyed by id only: the id comes from a freshly stored idea.
     *
     * @return false if the idea was deleted in the meantime
     */
    @Transactional
    public boolean applyEnrichment(Long id, String project, String theme, String emotion) {
        boolean updated = ideaRepository.updateEnrichment(id, project, theme, emotion) > 0;
        log.debug("Enrichment written: id={}, updated={}", id, updated);
        return updated;
    }

    /**
     * Overwrite the transformation result of the caller's idea.
     *
     * @throws ResourceNotFoundException if the idea is gone or not owned by the caller
     */
    @Transactional
    public void saveTransformedOutput(Long id, String owner, String output) {
        if (ideaRepository.updateTransformedOutput(id, owner, output) == 0) {
            throw ResourceNotFoundException.idea();
        }
    }

    private void validateContent(String content) {
        if (content == null || content.isEmpty()) {
            log.warn("Idea validation failed: content is null or empty");
            throw new IllegalArgumentException("Content cannot be null or empty");
        }
        // Characters are code points, so an emoji counts once
        int length = content.codePointCount(0, content.length());
        if (length > Idea.MAX_CONTENT_LENGTH) {
            log.warn("Idea validation failed: content length {} exceeds {}", length, Idea.MAX_CONTENT_LENGTH);
            throw new IllegalArgumentException("Content must be between 1 and 10000 characters");
        }
    }

    private void validateOwner(String owner) {
        if (owner == null || owner.trim().isEmpty()) {
            throw new IllegalArgumentException("Owner cannot be null or empty");
        }
    }
}
