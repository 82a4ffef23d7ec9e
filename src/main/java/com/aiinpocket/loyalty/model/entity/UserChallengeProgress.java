package com.aiinpocket.loyalty.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 使用者挑戰進度（user_challenge_progress 表）。
 * completed 只能由 false 變成 true，不會回退。
 */
@Entity
@Table(name = "user_challenge_progress", uniqueConstraints = {
        @UniqueConstraint(name = "uk_challenge_progress_user_challenge", columnNames = {"user_id", "challenge_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserChallengeProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "challenge_id", nullable = false, updatable = false)
    private Long challengeId;

    @Column(nullable = false)
    @Builder.Default
    private Integer progress = 0;

    @Column(nullable = false)
    private Integer target;

    @Column(nullable = false)
    @Builder.Default
    private boolean completed = false;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public int percentage() {
        if (target == null || target <= 0) {
            return completed ? 100 : 0;
        }
        return (int) Math.round(progress * 100.0 / target);
    }
}
