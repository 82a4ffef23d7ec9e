package com.aiinpocket.loyalty.config;

import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import com.aiinpocket.loyalty.model.entity.Level;
import com.aiinpocket.loyalty.repository.LevelRepository;
import com.aiinpocket.loyalty.service.LevelCatalog;
import com.aiinpocket.loyalty.service.LevelTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 應用啟動時確保等級表存在且一致。
 * - levels 表為空：寫入 {@code loyalty.levels} 設定的等級
 * - levels 表已有資料：只做一致性檢查，不覆寫
 * 等級設定不一致（首級門檻非 0、門檻重複等）時拋出例外使啟動失敗。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LevelTableInitializer implements ApplicationRunner {

    private final LoyaltyProperties properties;
    private final LevelRepository levelRepo;
    private final LevelCatalog levelCatalog;

    @Override
    public void run(ApplicationArguments args) {
        if (levelRepo.count() == 0 && !properties.levels().isEmpty()) {
            seedLevels();
        }
        levelCatalog.evict();
        LevelTable table = levelCatalog.currentTable();
        log.info("[等級] 等級表就緒，共 {} 級，最高門檻 {} 分",
                table.levels().size(), table.levels().get(table.levels().size() - 1).pointsRequired());
    }

    private void seedLevels() {
        List<LevelTable.LevelDefinition> definitions = properties.levels().stream()
                .map(seed -> new LevelTable.LevelDefinition(seed.levelNumber(), seed.name(), seed.pointsRequired(),
                        seed.benefits() == null ? LevelBenefits.NONE : seed.benefits()))
                .toList();
        // 先驗證再寫入
        LevelTable validated = LevelTable.of(definitions);

        levelRepo.saveAll(validated.levels().stream()
                .map(d -> Level.builder()
                        .levelNumber(d.levelNumber())
                        .name(d.name())
                        .pointsRequired(d.pointsRequired())
                        .benefits(d.benefits())
                        .build())
                .toList());
        log.info("[等級] levels 表為空，已寫入 {} 個預設等級", validated.levels().size());
    }
}
