package com.brainvault.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;

/**
 * Idea entity, a captured unit of text owned by one user.
 *
 * Ownership is a plain string key (the caller's external auth id) rather than an
 * association to {@link User}, so ideas and users are independent aggregates.
 *
 * Enrichment fields (project, theme, emotion) start null and are written later by the
 * enrichment consumer or an explicit update. transformedOutput is overwritten by each
 * transformation run.
 *
 * Database Table: ideas
 */
@Entity
@Table(name = "ideas", indexes = {
    @Index(name = "idx_ideas_user_id", columnList = "user_id"),
    @Index(name = "idx_ideas_timestamp", columnList = "timestamp"),
    @Index(name = "idx_ideas_project", columnList = "project"),
    @Index(name = "idx_ideas_theme", columnList = "theme"),
    @Index(name = "idx_ideas_emotion", columnList = "emotion")
})
@DynamicUpdate
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Idea {

    public static final int MAX_CONTENT_LENGTH = 10_000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Owner reference. Set once at creation.
     */
    @Column(name = "user_id", nullable = false, updatable = false, length = 100)
    private String userId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "source", nullable = false, updatable = false, length = 50)
    private String source;

    @CreationTimestamp
    @Column(name = "timestamp", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "project", length = 100)
    private String project;

    @Column(name = "theme", length = 100)
    private String theme;

    @Column(name = "emotion", length = 50)
    private String emotion;

    @Column(name = "transformed_output", columnDefinition = "TEXT")
    private String transformedOutput;

    public Idea(String userId, String content, String source) {
        this.userId = userId;
        this.content = content;
        this.source = source;
    }
}
