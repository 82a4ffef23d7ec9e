package com.aiinpocket.loyalty.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 使用者已獲得的徽章（user_badges 表）。
 * (user_id, badge_id) 的唯一約束是「是否已授予」的唯一依據。
 */
@Entity
@Table(name = "user_badges", uniqueConstraints = {
        @UniqueConstraint(name = "uk_user_badges_user_badge", columnNames = {"user_id", "badge_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserBadge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "badge_id", nullable = false, updatable = false)
    private Long badgeId;

    @Column(name = "earned_at", nullable = false, updatable = false)
    private Instant earnedAt;
}
