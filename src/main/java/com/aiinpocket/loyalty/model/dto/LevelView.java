package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import com.aiinpocket.loyalty.service.LevelTable.LevelDefinition;

public record LevelView(
        int number,
        String name,
        long pointsRequired,
        LevelBenefits benefits
) {

    public static LevelView from(LevelDefinition level) {
        if (level == null) {
            return null;
        }
        return new LevelView(level.levelNumber(), level.name(), level.pointsRequired(), level.benefits());
    }
}
