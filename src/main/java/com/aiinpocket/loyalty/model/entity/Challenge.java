package com.aiinpocket.loyalty.model.entity;

import com.aiinpocket.loyalty.model.converter.RewardCriteriaConverter;
import com.aiinpocket.loyalty.model.criteria.RewardCriteria;
import com.aiinpocket.loyalty.model.enums.ChallengeType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 挑戰定義（challenges 表）。
 */
@Entity
@Table(name = "challenges", indexes = {
        @Index(name = "idx_challenges_active_window", columnList = "active, start_date, end_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Challenge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String title;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "challenge_type", nullable = false, length = 20)
    private ChallengeType challengeType;

    @Convert(converter = RewardCriteriaConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private RewardCriteria criteria;

    @Column(name = "points_reward", nullable = false)
    @Builder.Default
    private Integer pointsReward = 0;

    /** 完成後額外授予的徽章（可為 null） */
    @Column(name = "badge_reward_id")
    private Long badgeRewardId;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    /** 結束時間，null 表示無期限 */
    @Column(name = "end_date")
    private Instant endDate;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    /** now 是否落在 [startDate, endDate] 之內 */
    public boolean isWithinWindow(Instant now) {
        return !now.isBefore(startDate) && (endDate == null || !now.isAfter(endDate));
    }

    /** 目前可參與：啟用中且在有效期間內 */
    public boolean isOpenAt(Instant now) {
        return active && isWithinWindow(now);
    }
}
