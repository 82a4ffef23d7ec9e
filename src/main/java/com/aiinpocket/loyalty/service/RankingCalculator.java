package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.model.enums.RankingSort;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 排行榜排序（純函式）。
 *
 * <p>排序鍵：主要鍵遞減 → 全期總分遞減 → userId 遞增。名次為排序後位置 + 1，同分也不會並列。
 * 區間積分為 0 的使用者不列入排行。
 */
public final class RankingCalculator {

    private RankingCalculator() {
    }

    public static Comparator<Candidate> comparator(RankingSort sort) {
        Comparator<Candidate> primary = switch (sort) {
            case TOTAL_POINTS -> Comparator.comparingLong(Candidate::windowPoints);
            case CURRENT_LEVEL -> Comparator.comparingInt(Candidate::currentLevel);
            case BADGE_COUNT -> Comparator.comparingLong(Candidate::badgesCount);
            case CHALLENGES_COMPLETED -> Comparator.comparingLong(Candidate::challengesCompleted);
        };
        return primary.reversed()
                .thenComparing(Comparator.comparingLong(Candidate::totalPoints).reversed())
                .thenComparing(Candidate::userId);
    }

    public static List<Ranked> rank(Collection<Candidate> candidates, RankingSort sort) {
        List<Candidate> sorted = candidates.stream()
                .filter(c -> c.windowPoints() > 0)
                .sorted(comparator(sort))
                .toList();
        List<Ranked> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(new Ranked(i + 1, sorted.get(i)));
        }
        return ranked;
    }

    /**
     * 排行候選人。
     *
     * @param windowPoints       區間內取得的積分（全期排行即總分）
     * @param windowTransactions 區間內的積分筆數，全期排行為 null
     */
    public record Candidate(
            Long userId,
            long windowPoints,
            Long windowTransactions,
            long totalPoints,
            int currentLevel,
            long badgesCount,
            long challengesCompleted
    ) {}

    public record Ranked(int position, Candidate candidate) {}
}
