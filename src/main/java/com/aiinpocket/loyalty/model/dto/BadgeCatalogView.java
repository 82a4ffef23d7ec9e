package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.criteria.RewardCriteria;
import com.aiinpocket.loyalty.model.enums.BadgeCategory;
import com.aiinpocket.loyalty.model.enums.Difficulty;
import com.aiinpocket.loyalty.model.enums.Rarity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record BadgeCatalogView(
        List<BadgeView> badges,
        Statistics statistics,
        Filters filters
) {

    public record BadgeView(
            Long id,
            String name,
            String description,
            String iconUrl,
            RewardCriteria criteria,
            int pointsReward,
            BadgeCategory category,
            Difficulty difficulty,
            boolean earned,
            Instant earnedAt,
            long timesEarned,
            Instant firstEarned,
            Instant lastEarned,
            Rarity rarity
    ) {}

    public record Statistics(
            int totalBadges,
            long earnedBadges,
            long availableBadges,
            long totalPointsAvailable,
            Map<BadgeCategory, Long> categoryCounts,
            Map<Difficulty, Long> difficultyCounts
    ) {}

    public record Filters(Long userId, BadgeCategory category, boolean includeEarned) {}
}
