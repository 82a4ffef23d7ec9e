package com.aiinpocket.loyalty.model.enums;

import com.aiinpocket.loyalty.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 排行榜主要排序鍵（一律遞減）。
 * TOTAL_POINTS 在週榜／月榜代表該區間內取得的積分。
 */
@Getter
public enum RankingSort {

    TOTAL_POINTS("total_points"),
    CURRENT_LEVEL("current_level"),
    BADGE_COUNT("badges_count"),
    CHALLENGES_COMPLETED("challenges_completed");

    @JsonValue
    private final String code;

    RankingSort(String code) {
        this.code = code;
    }

    public static RankingSort fromCode(String code) {
        if (code == null || code.isBlank()) {
            return TOTAL_POINTS;
        }
        for (RankingSort sort : values()) {
            if (sort.code.equalsIgnoreCase(code) || sort.name().equalsIgnoreCase(code)) {
                return sort;
            }
        }
        throw new ValidationException("排序條件無效: " + code);
    }
}
