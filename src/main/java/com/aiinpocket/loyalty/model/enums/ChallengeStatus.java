package com.aiinpocket.loyalty.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * 使用者挑戰狀態。
 * 只有 completed 旗標會寫入資料庫；expired / inactive 於讀取時依時鐘與挑戰設定推導。
 */
public enum ChallengeStatus {

    NOT_STARTED,
    ACTIVE,
    COMPLETED,
    EXPIRED,
    INACTIVE;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    /**
     * 推導狀態。
     *
     * @param hasProgressRow 是否已有 user_challenge_progress 紀錄
     * @param completed      紀錄上的 completed 旗標
     * @param challengeActive 挑戰的 active 旗標
     * @param startDate      挑戰開始時間
     * @param endDate        挑戰結束時間（null 表示無期限）
     * @param now            目前時間
     */
    public static ChallengeStatus derive(boolean hasProgressRow, boolean completed, boolean challengeActive,
                                         Instant startDate, Instant endDate, Instant now) {
        if (completed) {
            return COMPLETED;
        }
        if (endDate != null && now.isAfter(endDate)) {
            return EXPIRED;
        }
        if (!challengeActive || now.isBefore(startDate)) {
            return INACTIVE;
        }
        return hasProgressRow ? ACTIVE : NOT_STARTED;
    }
}
