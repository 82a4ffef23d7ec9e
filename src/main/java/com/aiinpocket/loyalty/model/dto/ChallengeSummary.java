package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.entity.Challenge;
import com.aiinpocket.loyalty.model.enums.ChallengeType;

import java.time.Instant;

public record ChallengeSummary(
        Long id,
        String title,
        String description,
        ChallengeType type,
        int pointsReward,
        Instant endDate
) {

    public static ChallengeSummary from(Challenge challenge) {
        return new ChallengeSummary(challenge.getId(), challenge.getTitle(), challenge.getDescription(),
                challenge.getChallengeType(), challenge.getPointsReward(), challenge.getEndDate());
    }
}
