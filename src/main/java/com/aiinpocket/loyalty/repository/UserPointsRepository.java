package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.UserPoints;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * user_points 存取。
 * 彙總欄位只透過本介面的 UPDATE 敘述在資料庫端原子地修改。
 */
public interface UserPointsRepository extends JpaRepository<UserPoints, Long> {

    /**
     * 建立使用者的積分彙總列；已存在時什麼也不做（由主鍵約束判斷）。
     *
     * @return 1 表示新建立，0 表示已存在
     */
    @Modifying
    @Query(value = """
        INSERT INTO user_points (user_id, total_points, current_level, created_at, updated_at)
        VALUES (:userId, 0, :level, :now, :now)
        ON CONFLICT DO NOTHING
    """, nativeQuery = true)
    int insertIfAbsent(@Param("userId") Long userId, @Param("level") int level, @Param("now") Instant now);

    /** 資料庫端直接加總，不經過應用層讀取再寫回 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UserPoints p SET p.totalPoints = p.totalPoints + :delta, p.updatedAt = :now WHERE p.userId = :userId")
    int incrementTotal(@Param("userId") Long userId, @Param("delta") long delta, @Param("now") Instant now);

    /** 直接從資料庫讀取目前總分（不經過持久化內容快取） */
    @Query("SELECT p.totalPoints FROM UserPoints p WHERE p.userId = :userId")
    Optional<Long> findTotalPoints(@Param("userId") Long userId);

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE UserPoints p SET p.currentLevel = :level, p.updatedAt = :now
        WHERE p.userId = :userId AND p.currentLevel <> :level
    """)
    int updateLevelIfChanged(@Param("userId") Long userId, @Param("level") int level, @Param("now") Instant now);

    List<UserPoints> findByTotalPointsGreaterThan(long minimum);

    @Query("SELECT p FROM UserPoints p WHERE p.userId IN :userIds")
    List<UserPoints> findByUserIds(@Param("userIds") List<Long> userIds);

    /** 各等級人數與平均積分 */
    @Query("""
        SELECT p.currentLevel AS levelNumber, COUNT(p) AS usersCount, AVG(p.totalPoints) AS averagePoints
        FROM UserPoints p GROUP BY p.currentLevel
    """)
    List<LevelDistributionRow> levelDistribution();

    interface LevelDistributionRow {
        Integer getLevelNumber();

        Long getUsersCount();

        Double getAveragePoints();
    }
}
