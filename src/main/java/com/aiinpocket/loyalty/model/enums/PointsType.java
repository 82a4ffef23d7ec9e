package com.aiinpocket.loyalty.model.enums;

import com.aiinpocket.loyalty.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 積分來源類型（points_history.points_type）。
 */
@Getter
public enum PointsType {

    ORDER("order", "訂單"),
    REVIEW("review", "評價"),
    REFERRAL("referral", "推薦好友"),
    BADGE("badge", "徽章獎勵"),
    CHALLENGE("challenge", "挑戰獎勵"),
    BONUS("bonus", "活動加碼"),
    ADJUSTMENT("adjustment", "人工調整");

    @JsonValue
    private final String code;
    private final String displayName;

    PointsType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonCreator
    public static PointsType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("pointsType 為必填欄位");
        }
        for (PointsType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new ValidationException("無效的積分類型: " + code);
    }
}
