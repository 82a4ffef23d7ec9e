package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.model.criteria.LevelBenefits;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 等級表快照（不可變）。
 * 依 pointsRequired 遞增排序，第一級必須是 Lv.1 且 pointsRequired = 0。
 * 所有查詢都是純函式，不存取資料庫。
 */
public final class LevelTable {

    /** levels 表為空時使用的預設等級 */
    static final LevelDefinition FALLBACK_LEVEL = new LevelDefinition(1, "新手", 0L, LevelBenefits.NONE);

    private final List<LevelDefinition> levels;

    private LevelTable(List<LevelDefinition> levels) {
        this.levels = levels;
    }

    /**
     * 建立等級表並檢查一致性：等級編號與門檻必須同時嚴格遞增，首級必須是 Lv.1 且門檻為 0。
     *
     * @throws IllegalStateException 設定不一致
     */
    public static LevelTable of(List<LevelDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            return new LevelTable(List.of(FALLBACK_LEVEL));
        }
        List<LevelDefinition> sorted = definitions.stream()
                .sorted(Comparator.comparingLong(LevelDefinition::pointsRequired))
                .toList();

        if (sorted.get(0).pointsRequired() != 0) {
            throw new IllegalStateException("第一個等級的門檻必須為 0，目前為 " + sorted.get(0).pointsRequired());
        }
        if (sorted.get(0).levelNumber() != 1) {
            throw new IllegalStateException("門檻為 0 的等級編號必須為 1，目前為 " + sorted.get(0).levelNumber());
        }
        for (int i = 1; i < sorted.size(); i++) {
            LevelDefinition prev = sorted.get(i - 1);
            LevelDefinition curr = sorted.get(i);
            if (curr.pointsRequired() == prev.pointsRequired() || curr.levelNumber() <= prev.levelNumber()) {
                throw new IllegalStateException(String.format(
                        "等級設定不一致: Lv.%d (%d) 與 Lv.%d (%d)",
                        prev.levelNumber(), prev.pointsRequired(), curr.levelNumber(), curr.pointsRequired()));
            }
        }
        return new LevelTable(sorted);
    }

    public List<LevelDefinition> levels() {
        return levels;
    }

    /**
     * 找出門檻不超過 totalPoints 的最高等級。
     */
    public LevelDefinition levelFor(long totalPoints) {
        LevelDefinition result = levels.get(0);
        for (LevelDefinition level : levels) {
            if (level.pointsRequired() > totalPoints) {
                break;
            }
            result = level;
        }
        return result;
    }

    public Optional<LevelDefinition> find(int levelNumber) {
        return levels.stream().filter(l -> l.levelNumber() == levelNumber).findFirst();
    }

    public Optional<LevelDefinition> next(LevelDefinition level) {
        int idx = levels.indexOf(level);
        return idx >= 0 && idx + 1 < levels.size() ? Optional.of(levels.get(idx + 1)) : Optional.empty();
    }

    public Optional<LevelDefinition> previous(LevelDefinition level) {
        int idx = levels.indexOf(level);
        return idx > 0 ? Optional.of(levels.get(idx - 1)) : Optional.empty();
    }

    /** 距離下一級還差多少積分，已是最高級時為 0 */
    public long pointsToNextLevel(long totalPoints) {
        return next(levelFor(totalPoints))
                .map(n -> n.pointsRequired() - totalPoints)
                .orElse(0L);
    }

    /** 目前等級內的進度百分比，最高級固定 100 */
    public int progressPercentage(long totalPoints) {
        LevelDefinition current = levelFor(totalPoints);
        return next(current)
                .map(n -> (int) Math.round((totalPoints - current.pointsRequired()) * 100.0
                        / (n.pointsRequired() - current.pointsRequired())))
                .orElse(100);
    }

    public record LevelDefinition(
            int levelNumber,
            String name,
            long pointsRequired,
            LevelBenefits benefits
    ) {}
}
