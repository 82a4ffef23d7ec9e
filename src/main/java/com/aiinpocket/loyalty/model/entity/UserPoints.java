package com.aiinpocket.loyalty.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 使用者積分彙總（user_points 表），每位使用者一筆。
 *
 * <p>totalPoints 永遠等於 points_history 中該使用者 points_earned 的總和。
 * 只能透過 {@code UserPointsRepository} 的原子增量更新修改，
 * 不可在應用程式記憶體中讀取後再寫回。
 */
@Entity
@Table(name = "user_points")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserPoints {

    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "total_points", nullable = false)
    @Builder.Default
    private Long totalPoints = 0L;

    /** 目前等級編號（由 totalPoints 推導） */
    @Column(name = "current_level", nullable = false)
    @Builder.Default
    private Integer currentLevel = 1;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
