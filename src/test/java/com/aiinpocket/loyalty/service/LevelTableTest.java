package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import com.aiinpocket.loyalty.service.LevelTable.LevelDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LevelTable 等級推導")
class LevelTableTest {

    private final LevelTable table = LevelTable.of(List.of(
            level(3, 300),
            level(1, 0),
            level(2, 100)));

    @Test
    @DisplayName("依門檻排序並取不超過總分的最高等級")
    void levelForPicksHighestReachedThreshold() {
        assertThat(table.levels()).extracting(LevelDefinition::levelNumber).containsExactly(1, 2, 3);
        assertThat(table.levelFor(0).levelNumber()).isEqualTo(1);
        assertThat(table.levelFor(99).levelNumber()).isEqualTo(1);
        assertThat(table.levelFor(100).levelNumber()).isEqualTo(2);
        assertThat(table.levelFor(250).levelNumber()).isEqualTo(2);
        assertThat(table.levelFor(10_000).levelNumber()).isEqualTo(3);
    }

    @Test
    @DisplayName("距離下一級的積分與等級內進度")
    void pointsToNextAndProgress() {
        assertThat(table.pointsToNextLevel(250)).isEqualTo(50);
        assertThat(table.progressPercentage(250)).isEqualTo(75);
        assertThat(table.pointsToNextLevel(300)).isZero();
        assertThat(table.progressPercentage(1_000)).isEqualTo(100);
    }

    @Test
    @DisplayName("前一級與下一級")
    void neighbours() {
        LevelDefinition second = table.find(2).orElseThrow();
        assertThat(table.previous(second)).map(LevelDefinition::levelNumber).contains(1);
        assertThat(table.next(second)).map(LevelDefinition::levelNumber).contains(3);
        assertThat(table.next(table.find(3).orElseThrow())).isEmpty();
        assertThat(table.previous(table.find(1).orElseThrow())).isEmpty();
    }

    @Test
    @DisplayName("空的等級表使用預設第一級")
    void emptyTableFallsBack() {
        LevelTable empty = LevelTable.of(List.of());
        assertThat(empty.levels()).hasSize(1);
        assertThat(empty.levelFor(5_000).levelNumber()).isEqualTo(1);
        assertThat(empty.pointsToNextLevel(5_000)).isZero();
    }

    @Test
    @DisplayName("首級門檻不是 0 時拒絕")
    void firstThresholdMustBeZero() {
        assertThatThrownBy(() -> LevelTable.of(List.of(level(1, 10), level(2, 100))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("門檻為 0 的等級編號不是 1 時拒絕")
    void zeroThresholdMustBeLevelOne() {
        assertThatThrownBy(() -> LevelTable.of(List.of(level(2, 0), level(3, 100))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("必須為 1");
    }

    @Test
    @DisplayName("門檻重複或等級編號未遞增時拒絕")
    void thresholdsMustBeStrictlyIncreasing() {
        assertThatThrownBy(() -> LevelTable.of(List.of(level(1, 0), level(2, 100), level(3, 100))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> LevelTable.of(List.of(level(2, 0), level(1, 100))))
                .isInstanceOf(IllegalStateException.class);
    }

    private static LevelDefinition level(int number, long threshold) {
        return new LevelDefinition(number, "Lv." + number, threshold, LevelBenefits.NONE);
    }
}
