package com.brainvault.repository;

import com.brainvault.entity.Idea;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Idea entity operations.
 *
 * Every read and write used by request handlers is scoped by the owner's user id, so a
 * caller can never observe or mutate another user's ideas. Filtered listing lives in
 * {@link IdeaQueryRepository}; the remaining queries are fixed and parameterized.
 *
 * The only unscoped write is {@link #updateEnrichment}, used by the enrichment consumer
 * with an id taken from a freshly created record.
 */
@Repository
public interface IdeaRepository extends JpaRepository<Idea, Long>, IdeaQueryRepository {

    /**
     * Find an idea by id, only if it belongs to the given owner.
     *
     * @param id the idea id
     * @param userId the owner's external auth id
     * @return Optional containing the idea if found and owned, empty otherwise
     */
    Optional<Idea> findByIdAndUserId(Long id, String userId);

    /**
     * Full-text search over idea content using PostgreSQL text search with the english
     * configuration. Results are ordered newest first, not by rank.
     *
     * @param userId the owner's external auth id
     * @param query free text, parsed with plainto_tsquery
     * @return matching ideas, newest first
     */
    @Query(value = "SELECT * FROM ideas " +
                   "WHERE user_id = :userId " +
                   "AND to_tsvector('english', content) @@ plainto_tsquery('english', :query) " +
                   "ORDER BY timestamp DESC",
           nativeQuery = true)
    List<Idea> searchByContent(@Param("userId") String userId, @Param("query") String query);

    long countByUserId(String userId);

    long countByUserIdAndCreatedAtGreaterThanEqual(String userId, LocalDateTime since);

    @Query("SELECT COUNT(DISTINCT i.project) FROM Idea i WHERE i.userId = :userId AND i.project IS NOT NULL")
    long countDistinctProjects(@Param("userId") String userId);

    @Query("SELECT COUNT(DISTINCT i.theme) FROM Idea i WHERE i.userId = :userId AND i.theme IS NOT NULL")
    long countDistinctThemes(@Param("userId") String userId);

    @Query("SELECT COUNT(DISTINCT i.emotion) FROM Idea i WHERE i.userId = :userId AND i.emotion IS NOT NULL")
    long countDistinctEmotions(@Param("userId") String userId);

    /**
     * Delete an idea only if it belongs to the given owner.
     *
     * @return number of rows removed (0 or 1)
     */
    @Modifying
    @Query("DELETE FROM Idea i WHERE i.id = :id AND i.userId = :userId")
    int deleteByIdAndOwner(@Param("id") Long id, @Param("userId") String userId);

    @Modifying
    @Query("DELETE FROM Idea i WHERE i.userId = :userId")
    int deleteAllByOwner(@Param("userId") String userId);

    /**
     * Write the three derived enrichment fields. Touches no other column, so a concurrent
     * content edit is not overwritten; the enrichment fields themselves are last-write-wins.
     *
     * @return number of rows updated (0 when the idea was deleted in the meantime)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Idea i SET i.project = :project, i.theme = :theme, i.emotion = :emotion WHERE i.id = :id")
    int updateEnrichment(@Param("id") Long id,
                         @Param("project") String project,
                         @Param("theme") String theme,
                         @Param("emotion") String emotion);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Idea i SET i.transformedOutput = :output WHERE i.id = :id AND i.userId = :userId")
    int updateTransformedOutput(@Param("id") Long id,
                                @Param("userId") String userId,
                                @Param("output") String output);
}
