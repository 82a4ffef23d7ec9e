package com.aiinpocket.loyalty.model.entity;

import com.aiinpocket.loyalty.model.converter.RewardCriteriaConverter;
import com.aiinpocket.loyalty.model.criteria.RewardCriteria;
import com.aiinpocket.loyalty.model.enums.BadgeCategory;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 徽章定義（badges 表）。
 * category 由 criteria 推導後寫入，方便以索引過濾。
 */
@Entity
@Table(name = "badges", indexes = {
        @Index(name = "idx_badges_active_category", columnList = "active, category")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Badge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    @Column(name = "icon_url", length = 500)
    private String iconUrl;

    @Convert(converter = RewardCriteriaConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private RewardCriteria criteria;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BadgeCategory category;

    @Column(name = "points_reward", nullable = false)
    @Builder.Default
    private Integer pointsReward = 0;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        syncCategory();
    }

    @PreUpdate
    protected void syncCategory() {
        this.category = criteria == null ? BadgeCategory.OTHER : criteria.category();
    }
}
