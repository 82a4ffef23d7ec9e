package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.entity.Badge;

public record BadgeSummary(
        Long id,
        String name,
        String description,
        String iconUrl,
        int pointsReward
) {

    public static BadgeSummary from(Badge badge) {
        if (badge == null) {
            return null;
        }
        return new BadgeSummary(badge.getId(), badge.getName(), badge.getDescription(),
                badge.getIconUrl(), badge.getPointsReward());
    }
}
