package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.Challenge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Collection;
import java.util.List;

public interface ChallengeRepository extends JpaRepository<Challenge, Long>, JpaSpecificationExecutor<Challenge> {

    List<Challenge> findByIdIn(Collection<Long> ids);
}
