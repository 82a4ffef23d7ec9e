package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.PointsHistory;
import com.aiinpocket.loyalty.model.enums.PointsType;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 積分歷史查詢條件。null 欄位表示不過濾，所有條件皆以參數綁定組合。
 */
public record PointsHistoryFilter(
        Long userId,
        PointsType pointsType,
        Instant from,
        Instant to
) {

    public static PointsHistoryFilter forUser(Long userId, PointsType pointsType) {
        return new PointsHistoryFilter(userId, pointsType, null, null);
    }

    public Specification<PointsHistory> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (userId != null) {
                predicates.add(cb.equal(root.get("userId"), userId));
            }
            if (pointsType != null) {
                predicates.add(cb.equal(root.get("pointsType"), pointsType));
            }
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThan(root.get("createdAt"), to));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
