package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.config.CacheConfig;
import com.aiinpocket.loyalty.model.entity.Level;
import com.aiinpocket.loyalty.repository.LevelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 等級表的讀取入口。
 * levels 表是靜態設定，讀出後組成 {@link LevelTable} 並放入 Caffeine 快取。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LevelCatalog {

    private final LevelRepository levelRepo;

    @Cacheable(CacheConfig.LEVEL_TABLE_CACHE)
    @Transactional(readOnly = true)
    public LevelTable currentTable() {
        LevelTable table = LevelTable.of(levelRepo.findAllByOrderByLevelNumberAsc().stream()
                .map(Level::toDefinition)
                .toList());
        log.debug("[等級] 載入等級表，共 {} 級", table.levels().size());
        return table;
    }

    @CacheEvict(value = CacheConfig.LEVEL_TABLE_CACHE, allEntries = true)
    public void evict() {
        log.debug("[等級] 清除等級表快取");
    }
}
