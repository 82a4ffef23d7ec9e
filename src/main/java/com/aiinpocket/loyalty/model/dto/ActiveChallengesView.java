package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.criteria.RewardCriteria;
import com.aiinpocket.loyalty.model.enums.ChallengeStatus;
import com.aiinpocket.loyalty.model.enums.ChallengeType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ActiveChallengesView(
        List<Item> challenges,
        Map<ChallengeType, Long> countsByType,
        Filters filters
) {

    public record Item(
            Long id,
            String title,
            String description,
            ChallengeType type,
            RewardCriteria criteria,
            int pointsReward,
            BadgeSummary badgeReward,
            Instant startDate,
            Instant endDate,
            TimeSpan timeRemaining,
            ChallengeStatus status,
            UserProgress userProgress
    ) {}

    /** 只有在查詢帶入 userId 時才會出現 */
    public record UserProgress(
            int current,
            int target,
            int percentage,
            boolean completed,
            Instant completedAt,
            Instant startedAt
    ) {}

    public record Filters(ChallengeType type, Long userId, boolean includeCompleted) {}
}
