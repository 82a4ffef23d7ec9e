package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.criteria.LevelBenefits.BenefitChange;

import java.time.Instant;
import java.util.Map;

public record UserLevelView(
        Long userId,
        LevelView currentLevel,
        Instant achievedAt,
        LevelView previousLevel,
        LevelView nextLevel,
        Progress progress,
        Map<String, BenefitChange> nextLevelImprovements
) {

    public record Progress(
            long totalPoints,
            long pointsInCurrentLevel,
            long pointsNeededForNextLevel,
            int progressPercentage,
            boolean maxLevel
    ) {}
}
