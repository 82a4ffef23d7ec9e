package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.Badge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Collection;
import java.util.List;

public interface BadgeRepository extends JpaRepository<Badge, Long>, JpaSpecificationExecutor<Badge> {

    long countByActiveTrue();

    List<Badge> findByIdIn(Collection<Long> ids);
}
