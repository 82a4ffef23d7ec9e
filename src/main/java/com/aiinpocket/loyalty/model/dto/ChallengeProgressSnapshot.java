package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.entity.UserChallengeProgress;
import com.aiinpocket.loyalty.model.enums.ChallengeStatus;

/**
 * 參與挑戰或累加進度後的進度快照。
 */
public record ChallengeProgressSnapshot(
        Long userId,
        Long challengeId,
        int progress,
        int target,
        int percentage,
        boolean newlyStarted,
        boolean canComplete,
        ChallengeStatus status
) {

    public static ChallengeProgressSnapshot of(UserChallengeProgress row, boolean newlyStarted) {
        ChallengeStatus status = row.isCompleted() ? ChallengeStatus.COMPLETED : ChallengeStatus.ACTIVE;
        return new ChallengeProgressSnapshot(
                row.getUserId(),
                row.getChallengeId(),
                row.getProgress(),
                row.getTarget(),
                row.percentage(),
                newlyStarted,
                !row.isCompleted() && row.getProgress() >= row.getTarget(),
                status);
    }
}
