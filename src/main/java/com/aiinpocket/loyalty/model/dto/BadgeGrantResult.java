package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.criteria.RewardCriteria.SpecialReward;

import java.time.Instant;
import java.util.List;

/**
 * 授予徽章結果。
 * newlyGranted = false 表示使用者先前已擁有此徽章，本次為無操作且未發放積分。
 */
public record BadgeGrantResult(
        Long userId,
        BadgeSummary badge,
        boolean newlyGranted,
        Instant earnedAt,
        int pointsAwarded,
        Long newTotalPoints,
        Integer currentLevel,
        Long pointsToNextLevel,
        String reason,
        UnlockedContent unlockedContent
) {

    public static BadgeGrantResult alreadyGranted(Long userId, BadgeSummary badge, Instant earnedAt, String reason) {
        return new BadgeGrantResult(userId, badge, false, earnedAt, 0, null, null, null, reason,
                UnlockedContent.NONE);
    }

    public record UnlockedContent(
            boolean levelUp,
            List<ChallengeSummary> newChallenges,
            List<SpecialReward> specialRewards
    ) {
        public static final UnlockedContent NONE = new UnlockedContent(false, List.of(), List.of());
    }
}
