package com.aiinpocket.loyalty.repository;

import com.aiinpocket.loyalty.model.entity.Level;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LevelRepository extends JpaRepository<Level, Integer> {

    List<Level> findAllByOrderByLevelNumberAsc();
}
