package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.criteria.RewardCriteria;
import com.aiinpocket.loyalty.model.enums.ChallengeStatus;
import com.aiinpocket.loyalty.model.enums.ChallengeType;

import java.time.Instant;
import java.util.List;

public record ChallengeProgressView(
        Long userId,
        List<Entry> challengeProgress,
        Statistics statistics,
        Filters filters
) {

    public record Entry(
            Long progressId,
            Long challengeId,
            String title,
            String description,
            ChallengeType type,
            RewardCriteria criteria,
            int pointsReward,
            BadgeSummary badgeReward,
            Instant startDate,
            Instant endDate,
            int current,
            int target,
            int percentage,
            int remaining,
            boolean completed,
            Instant completedAt,
            Instant startedAt,
            Instant lastUpdated,
            TimeSpan timeRemaining,
            TimeSpan timeSpent,
            ChallengeStatus status,
            boolean canComplete
    ) {}

    public record Statistics(
            int totalChallenges,
            long activeChallenges,
            long completedChallenges,
            long expiredChallenges,
            long inactiveChallenges,
            long totalPointsEarned,
            long averageCompletionDays,
            int completionRate,
            long nearCompletion,
            long canCompleteNow
    ) {}

    public record Filters(Long challengeId, String status) {}
}
