package com.aiinpocket.loyalty.model.enums;

import com.aiinpocket.loyalty.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 挑戰週期類型。宣告順序即列表顯示順序（每日 → 每週 → 每月 → 特別）。
 */
@Getter
public enum ChallengeType {

    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    SPECIAL("special");

    @JsonValue
    private final String code;

    ChallengeType(String code) {
        this.code = code;
    }

    @JsonCreator
    public static ChallengeType fromCode(String code) {
        for (ChallengeType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new ValidationException("無效的挑戰類型: " + code);
    }
}
