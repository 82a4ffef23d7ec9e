package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.UserChallengeProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 挑戰進度存取。completed 只透過 {@link #markCompleted} 由 false 轉為 true。
 */
public interface UserChallengeProgressRepository extends JpaRepository<UserChallengeProgress, Long> {

    @Modifying
    @Query(value = """
        INSERT INTO user_challenge_progress
            (user_id, challenge_id, progress, target, completed, created_at, updated_at)
        VALUES (:userId, :challengeId, 0, :target, false, :now, :now)
        ON CONFLICT DO NOTHING
    """, nativeQuery = true)
    int insertIfAbsent(@Param("userId") Long userId, @Param("challengeId") Long challengeId,
                       @Param("target") int target, @Param("now") Instant now);

    Optional<UserChallengeProgress> findByUserIdAndChallengeId(Long userId, Long challengeId);

    List<UserChallengeProgress> findByUserId(Long userId);

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE UserChallengeProgress p SET p.progress = p.progress + :amount, p.updatedAt = :now
        WHERE p.userId = :userId AND p.challengeId = :challengeId AND p.completed = false
    """)
    int incrementProgress(@Param("userId") Long userId, @Param("challengeId") Long challengeId,
                          @Param("amount") int amount, @Param("now") Instant now);

    /**
     * 完成挑戰。條件式更新保證同一筆進度只會成功轉換一次。
     *
     * @return 1 表示本次完成，0 表示已被完成（或不存在）
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE UserChallengeProgress p SET p.completed = true, p.completedAt = :now, p.updatedAt = :now
        WHERE p.userId = :userId AND p.challengeId = :challengeId AND p.completed = false
    """)
    int markCompleted(@Param("userId") Long userId, @Param("challengeId") Long challengeId,
                      @Param("now") Instant now);

    @Query("""
        SELECT p.userId AS userId, COUNT(p) AS total FROM UserChallengeProgress p
        WHERE p.completed = true GROUP BY p.userId
    """)
    List<UserCount> countCompletedByUser();
}
