package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.enums.PointsType;

/**
 * 積分入帳結果。newTotal 與 currentLevel 皆為本次交易提交前重新讀取的值。
 */
public record PointsAwardResult(
        Long userId,
        int pointsAdded,
        PointsType pointsType,
        String description,
        long newTotal,
        int previousLevel,
        int currentLevel,
        String currentLevelName,
        long pointsToNextLevel,
        boolean leveledUp
) {}
