package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.Badge;
import com.aiinpocket.loyalty.model.enums.BadgeCategory;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * 徽章列表查詢條件。
 */
public record BadgeFilter(
        boolean activeOnly,
        BadgeCategory category
) {

    public Specification<Badge> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (activeOnly) {
                predicates.add(cb.isTrue(root.get("active")));
            }
            if (category != null) {
                predicates.add(cb.equal(root.get("category"), category));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
