package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.enums.RankingSort;
import com.aiinpocket.loyalty.model.enums.RankingWindow;

import java.time.Instant;
import java.util.List;

public record RankingView(
        RankingWindow window,
        RankingSort sortBy,
        Period period,
        List<Entry> ranking,
        Entry highlightedUser,
        Statistics statistics
) {

    /** 區間為 [start, end)，全期排行榜為 null */
    public record Period(Instant start, Instant end) {}

    public record Entry(
            int position,
            Long userId,
            String name,
            long windowPoints,
            Long windowTransactions,
            long totalPoints,
            int currentLevel,
            long badgesCount,
            long challengesCompleted
    ) {}

    public record Statistics(
            int rankedUsers,
            long totalPoints,
            long averagePoints,
            long highestPoints
    ) {}
}
