package com.aiinpocket.loyalty.model.enums;

import com.aiinpocket.loyalty.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 排行榜統計區間。
 */
@Getter
public enum RankingWindow {

    ALL_TIME("all-time"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    @JsonValue
    private final String code;

    RankingWindow(String code) {
        this.code = code;
    }

    public static RankingWindow fromCode(String code) {
        if (code == null || code.isBlank()) {
            return ALL_TIME;
        }
        for (RankingWindow window : values()) {
            if (window.code.equalsIgnoreCase(code) || window.name().equalsIgnoreCase(code)) {
                return window;
            }
        }
        throw new ValidationException("無效的排行榜區間: " + code);
    }
}
