package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import com.aiinpocket.loyalty.model.criteria.LevelBenefits.BenefitChange;

import java.util.List;
import java.util.Map;

public record LevelListView(
        List<Entry> levels,
        int totalLevels,
        Integer userCurrentLevel,
        Statistics statistics
) {

    public record Entry(
            int number,
            String name,
            long pointsRequired,
            LevelBenefits benefits,
            boolean currentUserLevel,
            long pointsToReach,
            Map<String, BenefitChange> benefitImprovements
    ) {}

    public record Statistics(
            long totalUsers,
            List<LevelShare> levelDistribution,
            Integer mostPopularLevel
    ) {}

    public record LevelShare(
            int levelNumber,
            String levelName,
            long usersCount,
            int percentage,
            long averagePointsInLevel
    ) {}
}
