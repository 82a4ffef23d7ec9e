package com.aiinpocket.loyalty.model.enums;

import com.aiinpocket.loyalty.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("挑戰狀態推導與列舉代碼")
class ChallengeStatusTest {

    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2026-03-31T23:59:59Z");

    @Test
    @DisplayName("已完成的挑戰即使過期仍為 completed")
    void completedWins() {
        assertThat(ChallengeStatus.derive(true, true, true, START, END, END.plusSeconds(60)))
                .isEqualTo(ChallengeStatus.COMPLETED);
    }

    @Test
    @DisplayName("超過結束時間為 expired")
    void expiredAfterEnd() {
        assertThat(ChallengeStatus.derive(true, false, true, START, END, END.plusSeconds(1)))
                .isEqualTo(ChallengeStatus.EXPIRED);
    }

    @Test
    @DisplayName("停用或尚未開始為 inactive")
    void inactiveWhenDisabledOrNotStarted() {
        Instant mid = Instant.parse("2026-03-15T12:00:00Z");
        assertThat(ChallengeStatus.derive(true, false, false, START, END, mid)).isEqualTo(ChallengeStatus.INACTIVE);
        assertThat(ChallengeStatus.derive(false, false, true, START, END, START.minusSeconds(1)))
                .isEqualTo(ChallengeStatus.INACTIVE);
    }

    @Test
    @DisplayName("有效期間內依是否參與區分 active / not_started，無期限挑戰不會過期")
    void activeOrNotStarted() {
        Instant mid = Instant.parse("2026-03-15T12:00:00Z");
        assertThat(ChallengeStatus.derive(true, false, true, START, END, mid)).isEqualTo(ChallengeStatus.ACTIVE);
        assertThat(ChallengeStatus.derive(false, false, true, START, END, mid)).isEqualTo(ChallengeStatus.NOT_STARTED);
        assertThat(ChallengeStatus.derive(true, false, true, START, null, Instant.parse("2030-01-01T00:00:00Z")))
                .isEqualTo(ChallengeStatus.ACTIVE);
    }

    @Test
    @DisplayName("列舉代碼解析")
    void codes() {
        assertThat(PointsType.fromCode("order")).isEqualTo(PointsType.ORDER);
        assertThat(PointsType.fromCode("BADGE")).isEqualTo(PointsType.BADGE);
        assertThatThrownBy(() -> PointsType.fromCode("gift")).isInstanceOf(ValidationException.class);
        assertThat(RankingWindow.fromCode(null)).isEqualTo(RankingWindow.ALL_TIME);
        assertThat(RankingWindow.fromCode("weekly")).isEqualTo(RankingWindow.WEEKLY);
        assertThat(RankingSort.fromCode("badges_count")).isEqualTo(RankingSort.BADGE_COUNT);
        assertThatThrownBy(() -> RankingSort.fromCode("name")).isInstanceOf(ValidationException.class);
        assertThat(Rarity.fromTimesEarned(0)).isEqualTo(Rarity.NOT_EARNED);
        assertThat(Rarity.fromTimesEarned(5)).isEqualTo(Rarity.VERY_RARE);
        assertThat(Rarity.fromTimesEarned(21)).isEqualTo(Rarity.COMMON);
        assertThat(Rarity.fromTimesEarned(101)).isEqualTo(Rarity.VERY_COMMON);
    }
}
