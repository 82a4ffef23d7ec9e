package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.Challenge;
import com.aiinpocket.loyalty.model.entity.UserChallengeProgress;
import com.aiinpocket.loyalty.model.enums.ChallengeType;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 挑戰查詢條件。
 *
 * @param openAt       只取在此時間點啟用且位於有效期間內的挑戰（null 不過濾）
 * @param type         挑戰類型（null 不過濾）
 * @param notStartedBy 排除此使用者已參與的挑戰（null 不過濾）
 */
public record ChallengeFilter(
        Instant openAt,
        ChallengeType type,
        Long notStartedBy
) {

    public static ChallengeFilter openAt(Instant now, ChallengeType type) {
        return new ChallengeFilter(now, type, null);
    }

    public static ChallengeFilter notStarted(Instant now, ChallengeType type, Long userId) {
        return new ChallengeFilter(now, type, userId);
    }

    public Specification<Challenge> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (openAt != null) {
                predicates.add(cb.isTrue(root.get("active")));
                predicates.add(cb.lessThanOrEqualTo(root.get("startDate"), openAt));
                predicates.add(cb.or(
                        cb.isNull(root.get("endDate")),
                        cb.greaterThanOrEqualTo(root.get("endDate"), openAt)));
            }
            if (type != null) {
                predicates.add(cb.equal(root.get("challengeType"), type));
            }
            if (notStartedBy != null && query != null) {
                Subquery<Long> started = query.subquery(Long.class);
                Root<UserChallengeProgress> progress = started.from(UserChallengeProgress.class);
                started.select(progress.get("challengeId"))
                        .where(cb.equal(progress.get("userId"), notStartedBy));
                predicates.add(cb.not(root.get("id").in(started)));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
