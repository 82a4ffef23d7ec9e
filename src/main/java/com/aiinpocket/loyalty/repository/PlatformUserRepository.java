package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.PlatformUser;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface PlatformUserRepository extends JpaRepository<PlatformUser, Long> {

    List<PlatformUser> findByIdIn(Collection<Long> ids);
}
