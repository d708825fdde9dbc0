package com.brainvault.repository;

import com.brainvault.entity.Idea;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Criteria API implementation of {@link IdeaQueryRepository}.
 *
 * Builds one predicate per present filter, so each filter combination becomes a fixed
 * parameterized statement without string assembly.
 */
@Slf4j
public class IdeaQueryRepositoryImpl implements IdeaQueryRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Idea> findByOwner(String userId, IdeaFilter filter, int skip, int limit) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Idea> query = cb.createQuery(Idea.class);
        Root<Idea> idea = query.from(Idea.class);

        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(idea.get("userId"), userId));

        IdeaFilter effective = filter != null ? filter : IdeaFilter.none();
        if (effective.getProject() != null) {
            predicates.add(cb.equal(idea.get("project"), effective.getProject()));
        }
        if (effective.getTheme() != null) {
            predicates.add(cb.equal(idea.get("theme"), effective.getTheme()));
        }
        if (effective.getEmotion() != null) {
            predicates.add(cb.equal(idea.get("emotion"), effective.getEmotion()));
        }

        query.select(idea)
                .where(predicates.toArray(new Predicate[0]))
                .orderBy(cb.desc(idea.get("createdAt")), cb.desc(idea.get("id")));

        log.debug("Listing ideas: filters={}, skip={}, limit={}", predicates.size() - 1, skip, limit);

        return entityManager.createQuery(query)
                .setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }
}
