package com.aiinpocket.loyalty.config;

import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * 忠誠計畫設定（前綴 {@code loyalty}）。
 *
 * @param internalApiKey         內部服務呼叫使用的 API Key（比對 X-Api-Key 標頭）
 * @param jwtSecret              驗證使用者 Bearer JWT 的 HS256 共用金鑰（至少 32 bytes）
 * @param timeZone               週榜、月榜與「本月」統計使用的時區
 * @param unlockedChallengeLimit 授予徽章或完成挑戰後最多推薦的新挑戰數
 * @param history                積分歷史分頁限制
 * @param ranking                排行榜分頁限制
 * @param levels                 等級表初始資料（levels 表為空時寫入）
 */
@ConfigurationProperties(prefix = "loyalty")
public record LoyaltyProperties(
        String internalApiKey,
        String jwtSecret,
        @DefaultValue("America/Sao_Paulo") String timeZone,
        @DefaultValue("3") int unlockedChallengeLimit,
        @DefaultValue PageLimits history,
        @DefaultValue PageLimits ranking,
        List<LevelSeed> levels
) {

    public record PageLimits(
            @DefaultValue("50") int defaultLimit,
            @DefaultValue("100") int maxLimit
    ) {}

    public record LevelSeed(
            int levelNumber,
            String name,
            long pointsRequired,
            LevelBenefits benefits
    ) {}

    public List<LevelSeed> levels() {
        return levels == null ? List.of() : levels;
    }
}
