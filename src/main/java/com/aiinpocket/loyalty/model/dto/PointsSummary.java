package com.aiinpocket.loyalty.model.dto;

import java.time.Instant;

public record PointsSummary(
        Long userId,
        long totalPoints,
        LevelView currentLevel,
        LevelView nextLevel,
        long pointsToNextLevel,
        Progress progress,
        Instant lastUpdated
) {

    public record Progress(
            long currentLevelProgress,
            long nextLevelTarget,
            int progressPercentage
    ) {}
}
