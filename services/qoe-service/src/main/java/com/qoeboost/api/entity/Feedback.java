package com.qoeboost.api.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Feedback - a user's rating of their network experience.
 *
 * Immutable once stored. userId is null only for anonymous submissions
 * accepted while the service runs on the fallback store.
 */
@Entity
@Table(name = "feedback")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Feedback {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    /** 1 (worst) to 5 (best). */
    @Column(name = "rating", nullable = false, updatable = false)
    private Integer rating;

    @Column(name = "category", updatable = false)
    private String category;

    @Column(name = "content", columnDefinition = "TEXT", updatable = false)
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
