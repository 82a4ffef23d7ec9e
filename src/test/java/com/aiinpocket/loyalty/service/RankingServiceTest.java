package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.config.LoyaltyProperties;
import com.aiinpocket.loyalty.model.dto.RankingView;
import com.aiinpocket.loyalty.model.enums.RankingWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("排行榜統計區間")
class RankingServiceTest {

    private static final ZoneId ZONE = ZoneId.of("America/Sao_Paulo");

    // 2026-05-06 (週三) 12:00 當地時間
    private final RankingService rankingService = new RankingService(null, null, null, null, null,
            new LoyaltyProperties("key", null, ZONE.getId(), 3,
                    new LoyaltyProperties.PageLimits(50, 100), new LoyaltyProperties.PageLimits(50, 100), List.of()),
            Clock.fixed(Instant.parse("2026-05-06T15:00:00Z"), ZONE));

    @Test
    @DisplayName("週榜區間為當地時間週一 00:00 到下週一 00:00")
    void weeklyWindowStartsMonday() {
        RankingView.Period period = rankingService.periodOf(RankingWindow.WEEKLY, null);

        assertThat(period.start()).isEqualTo(Instant.parse("2026-05-04T03:00:00Z"));
        assertThat(period.end()).isEqualTo(Instant.parse("2026-05-11T03:00:00Z"));
    }

    @Test
    @DisplayName("週日仍屬於同一週")
    void sundayBelongsToPrecedingMonday() {
        RankingView.Period period = rankingService.periodOf(RankingWindow.WEEKLY, LocalDate.of(2026, 5, 10));

        assertThat(period.start()).isEqualTo(Instant.parse("2026-05-04T03:00:00Z"));
    }

    @Test
    @DisplayName("月榜涵蓋整個日曆月")
    void monthlyWindowCoversCalendarMonth() {
        RankingView.Period period = rankingService.periodOf(RankingWindow.MONTHLY, LocalDate.of(2026, 2, 14));

        assertThat(period.start()).isEqualTo(Instant.parse("2026-02-01T03:00:00Z"));
        assertThat(period.end()).isEqualTo(Instant.parse("2026-03-01T03:00:00Z"));
    }

    @Test
    @DisplayName("全期排行沒有區間")
    void allTimeHasNoPeriod() {
        assertThat(rankingService.periodOf(RankingWindow.ALL_TIME, null)).isNull();
    }
}
