package com.aiinpocket.loyalty.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * 參與、累加進度與完成挑戰共用的請求。
 *
 * @param amount       累加的進度量（僅累加進度時使用）
 * @param autoComplete 忽略目標值強制完成（僅內部呼叫者可用）
 */
public record ChallengeActionRequest(
        @NotNull @Positive Long userId,
        @NotNull @Positive Long challengeId,
        @Positive Integer amount,
        Boolean autoComplete
) {}
