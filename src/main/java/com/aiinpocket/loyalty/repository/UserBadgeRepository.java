package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.UserBadge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserBadgeRepository extends JpaRepository<UserBadge, Long> {

    /**
     * 授予徽章；(user_id, badge_id) 已存在時由唯一約束吸收為無操作。
     *
     * @return 1 表示新授予，0 表示先前已授予
     */
    @Modifying
    @Query(value = """
        INSERT INTO user_badges (user_id, badge_id, earned_at)
        VALUES (:userId, :badgeId, :earnedAt)
        ON CONFLICT DO NOTHING
    """, nativeQuery = true)
    int insertIfAbsent(@Param("userId") Long userId, @Param("badgeId") Long badgeId,
                       @Param("earnedAt") Instant earnedAt);

    Optional<UserBadge> findByUserIdAndBadgeId(Long userId, Long badgeId);

    List<UserBadge> findByUserIdOrderByEarnedAtDesc(Long userId);

    /** 每個徽章的授予次數與首次／最近授予時間 */
    @Query("""
        SELECT ub.badgeId AS badgeId, COUNT(ub) AS timesEarned,
               MIN(ub.earnedAt) AS firstEarned, MAX(ub.earnedAt) AS lastEarned
        FROM UserBadge ub GROUP BY ub.badgeId
    """)
    List<BadgeEarnStats> earnStatsByBadge();

    @Query("SELECT ub.userId AS userId, COUNT(ub) AS total FROM UserBadge ub GROUP BY ub.userId")
    List<UserCount> countByUser();

    interface BadgeEarnStats {
        Long getBadgeId();

        Long getTimesEarned();

        Instant getFirstEarned();

        Instant getLastEarned();
    }
}
