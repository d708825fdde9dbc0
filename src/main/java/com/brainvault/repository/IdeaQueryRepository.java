package com.brainvault.repository;

import com.brainvault.entity.Idea;

import java.util.List;

/**
 * Custom query fragment for owner-scoped listing with optional filters and offset pagination.
 */
public interface IdeaQueryRepository {

    /**
     * List the owner's ideas, newest first.
     *
     * @param userId the owner's external auth id
     * @param filter conjunctive equality filters, each optional
     * @param skip number of rows to skip, non-negative
     * @param limit maximum number of rows to return
     * @return the requested slice
     */
    List<Idea> findByOwner(String userId, IdeaFilter filter, int skip, int limit);
}
