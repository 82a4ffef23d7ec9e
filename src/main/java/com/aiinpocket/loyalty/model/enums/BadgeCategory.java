package com.aiinpocket.loyalty.model.enums;

import com.aiinpocket.loyalty.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum BadgeCategory {

    ORDERS("orders", "訂單相關徽章"),
    REVIEWS("reviews", "評價訂單徽章"),
    REFERRALS("referrals", "推薦好友徽章"),
    SCHEDULE("schedule", "特殊時段徽章"),
    EXPLORATION("exploration", "探索餐廳徽章"),
    SPENDING("spending", "累計消費徽章"),
    OTHER("other", "其他特別徽章");

    @JsonValue
    private final String code;
    private final String description;

    BadgeCategory(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public static BadgeCategory fromCode(String code) {
        for (BadgeCategory category : values()) {
            if (category.code.equalsIgnoreCase(code) || category.name().equalsIgnoreCase(code)) {
                return category;
            }
        }
        throw new ValidationException("無效的徽章分類: " + code);
    }
}
