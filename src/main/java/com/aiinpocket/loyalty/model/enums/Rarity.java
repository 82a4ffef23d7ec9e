package com.aiinpocket.loyalty.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 徽章稀有度，依全站被授予次數分級。
 */
public enum Rarity {

    NOT_EARNED,
    VERY_RARE,
    RARE,
    COMMON,
    VERY_COMMON;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    public static Rarity fromTimesEarned(long timesEarned) {
        if (timesEarned == 0) return NOT_EARNED;
        if (timesEarned <= 5) return VERY_RARE;
        if (timesEarned <= 20) return RARE;
        if (timesEarned <= 100) return COMMON;
        return VERY_COMMON;
    }
}
