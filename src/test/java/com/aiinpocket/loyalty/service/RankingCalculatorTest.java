package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.model.enums.RankingSort;
import com.aiinpocket.loyalty.service.RankingCalculator.Candidate;
import com.aiinpocket.loyalty.service.RankingCalculator.Ranked;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RankingCalculator 排序")
class RankingCalculatorTest {

    @Test
    @DisplayName("同分時以 userId 遞增決定名次")
    void tieBrokenByUserId() {
        List<Ranked> ranked = RankingCalculator.rank(List.of(
                candidate(5L, 1000, 1000, 3, 0, 0),
                candidate(2L, 1000, 1000, 3, 0, 0)), RankingSort.TOTAL_POINTS);

        assertThat(ranked).extracting(r -> r.candidate().userId()).containsExactly(2L, 5L);
        assertThat(ranked).extracting(Ranked::position).containsExactly(1, 2);
    }

    @Test
    @DisplayName("區間積分相同時以全期總分決定名次")
    void windowTieBrokenByAllTimeTotal() {
        List<Ranked> ranked = RankingCalculator.rank(List.of(
                candidate(1L, 200, 300, 2, 0, 0),
                candidate(2L, 200, 900, 4, 0, 0),
                candidate(3L, 500, 500, 3, 0, 0)), RankingSort.TOTAL_POINTS);

        assertThat(ranked).extracting(r -> r.candidate().userId()).containsExactly(3L, 2L, 1L);
    }

    @Test
    @DisplayName("依徽章數排序")
    void sortByBadgeCount() {
        List<Ranked> ranked = RankingCalculator.rank(List.of(
                candidate(1L, 900, 900, 4, 1, 0),
                candidate(2L, 100, 100, 2, 5, 0),
                candidate(3L, 300, 300, 3, 5, 0)), RankingSort.BADGE_COUNT);

        assertThat(ranked).extracting(r -> r.candidate().userId()).containsExactly(3L, 2L, 1L);
    }

    @Test
    @DisplayName("區間積分為 0 的使用者不列入排行")
    void zeroWindowPointsExcluded() {
        List<Ranked> ranked = RankingCalculator.rank(List.of(
                candidate(1L, 0, 5000, 5, 9, 9),
                candidate(2L, 10, 10, 1, 0, 0)), RankingSort.CHALLENGES_COMPLETED);

        assertThat(ranked).hasSize(1);
        assertThat(ranked.get(0).candidate().userId()).isEqualTo(2L);
        assertThat(ranked.get(0).position()).isEqualTo(1);
    }

    private static Candidate candidate(Long userId, long windowPoints, long total, int level,
                                       long badges, long challenges) {
        return new Candidate(userId, windowPoints, null, total, level, badges, challenges);
    }
}
