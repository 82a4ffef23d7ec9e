package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.PointsHistory;
import com.aiinpocket.loyalty.model.enums.PointsType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PointsHistoryRepository extends JpaRepository<PointsHistory, Long>,
        JpaSpecificationExecutor<PointsHistory> {

    /**
     * 依 (created_at, id) 順序累加積分，回傳累計首次達到 threshold 的那一筆歷史 id。
     * 累計從未達到時為空。
     */
    @Query(value = """
        SELECT r.id FROM (
            SELECT ph.id, ph.created_at,
                   SUM(ph.points_earned) OVER (
                       ORDER BY ph.created_at, ph.id
                       ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW) AS running_total
            FROM points_history ph
            WHERE ph.user_id = :userId
        ) r
        WHERE r.running_total >= :threshold
        ORDER BY r.created_at, r.id
        LIMIT 1
    """, nativeQuery = true)
    Optional<Long> findFirstIdReaching(@Param("userId") Long userId, @Param("threshold") long threshold);

    /** 使用者各積分類型的統計（依筆數遞減） */
    @Query("""
        SELECT ph.pointsType AS pointsType, SUM(ph.pointsEarned) AS totalPoints, COUNT(ph) AS transactions
        FROM PointsHistory ph WHERE ph.userId = :userId
        GROUP BY ph.pointsType ORDER BY COUNT(ph) DESC
    """)
    List<PointsTypeStat> statsByType(@Param("userId") Long userId);

    /** 區間 [from, to) 內每位使用者取得的積分，只回傳總和大於 0 者 */
    @Query("""
        SELECT ph.userId AS userId, SUM(ph.pointsEarned) AS points, COUNT(ph) AS transactions
        FROM PointsHistory ph
        WHERE ph.createdAt >= :from AND ph.createdAt < :to
        GROUP BY ph.userId
        HAVING SUM(ph.pointsEarned) > 0
    """)
    List<WindowPoints> sumByUserBetween(@Param("from") Instant from, @Param("to") Instant to);

    interface PointsTypeStat {
        PointsType getPointsType();

        Long getTotalPoints();

        Long getTransactions();
    }

    interface WindowPoints {
        Long getUserId();

        Long getPoints();

        Long getTransactions();
    }
}
