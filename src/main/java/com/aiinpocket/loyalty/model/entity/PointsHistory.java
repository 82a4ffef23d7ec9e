package com.aiinpocket.loyalty.model.entity;

import com.aiinpocket.loyalty.model.enums.PointsType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 積分帳本事件（points_history 表）。只新增，不更新也不刪除。
 */
@Entity
@Table(name = "points_history", indexes = {
        @Index(name = "idx_points_history_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_points_history_created", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PointsHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "points_earned", nullable = false, updatable = false)
    private Integer pointsEarned;

    @Enumerated(EnumType.STRING)
    @Column(name = "points_type", nullable = false, updatable = false, length = 20)
    private PointsType pointsType;

    @Column(length = 255, updatable = false)
    private String description;

    /** 關聯的外送訂單（可為 null） */
    @Column(name = "order_id", updatable = false)
    private Long orderId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
