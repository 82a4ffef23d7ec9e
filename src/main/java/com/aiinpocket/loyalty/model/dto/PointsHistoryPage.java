package com.aiinpocket.loyalty.model.dto;

import com.aiinpocket.loyalty.model.enums.PointsType;

import java.time.Instant;
import java.util.List;

public record PointsHistoryPage(
        Long userId,
        List<Entry> history,
        Pagination pagination,
        PointsType pointsTypeFilter,
        Statistics statistics
) {

    public record Entry(
            Long id,
            int pointsEarned,
            PointsType pointsType,
            String description,
            Long orderId,
            Instant earnedAt
    ) {}

    public record Pagination(
            int limit,
            long offset,
            long totalRecords,
            boolean hasMore,
            long currentPage,
            long totalPages
    ) {

        public static Pagination of(int limit, long offset, long totalRecords) {
            return new Pagination(
                    limit,
                    offset,
                    totalRecords,
                    offset + limit < totalRecords,
                    offset / limit + 1,
                    (totalRecords + limit - 1) / limit);
        }
    }

    public record Statistics(
            long totalPointsEarned,
            long totalTransactions,
            long averagePointsPerTransaction,
            List<TypeStat> pointsByType
    ) {}

    public record TypeStat(PointsType type, long totalPoints, long transactionCount) {}
}
