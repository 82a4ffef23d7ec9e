package com.aiinpocket.loyalty.model.dto;

import java.time.Instant;
import java.util.List;

/**
 * 完成挑戰結果。
 * 徽章獎勵為盡力而為：失敗時 badgeRewardFailed = true 並附上原因，
 * 挑戰完成與積分入帳不受影響。
 */
public record ChallengeCompletionResult(
        Long userId,
        Long challengeId,
        ChallengeSummary challenge,
        Instant completedAt,
        TimeSpan timeSpent,
        FinalProgress finalProgress,
        Rewards rewards,
        boolean badgeRewardFailed,
        String badgeRewardError,
        List<ChallengeSummary> newChallenges
) {

    public record FinalProgress(int current, int target, int percentage) {}

    public record Rewards(
            int pointsEarned,
            BadgeSummary badgeEarned,
            Long newTotalPoints,
            Integer currentLevel,
            Long pointsToNextLevel
    ) {}
}
