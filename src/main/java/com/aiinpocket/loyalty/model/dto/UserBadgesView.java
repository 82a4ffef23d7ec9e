package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.criteria.RewardCriteria;
import com.aiinpocket.loyalty.model.enums.BadgeCategory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record UserBadgesView(
        Long userId,
        List<EarnedBadge> badges,
        Map<BadgeCategory, List<EarnedBadge>> badgesByCategory,
        Statistics statistics
) {

    public record EarnedBadge(
            Long id,
            String name,
            String description,
            String iconUrl,
            RewardCriteria criteria,
            BadgeCategory category,
            int pointsReward,
            Instant earnedAt,
            long daysAgo
    ) {}

    public record Statistics(
            int totalEarned,
            long totalAvailable,
            int completionPercentage,
            long totalPointsFromBadges,
            long badgesThisMonth
    ) {}
}
