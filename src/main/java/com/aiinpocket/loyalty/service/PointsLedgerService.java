package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.config.LoyaltyProperties;
import com.aiinpocket.loyalty.exception.NotFoundException;
import com.aiinpocket.loyalty.exception.ValidationException;
import com.aiinpocket.loyalty.model.dto.LevelView;
import com.aiinpocket.loyalty.model.dto.PointsAwardResult;
import com.aiinpocket.loyalty.model.dto.PointsHistoryPage;
import com.aiinpocket.loyalty.model.dto.PointsSummary;
import com.aiinpocket.loyalty.model.entity.PointsHistory;
import com.aiinpocket.loyalty.model.entity.UserPoints;
import com.aiinpocket.loyalty.model.enums.PointsType;
import com.aiinpocket.loyalty.repository.OffsetLimitRequest;
import com.aiinpocket.loyalty.repository.PlatformUserRepository;
import com.aiinpocket.loyalty.repository.PointsHistoryFilter;
import com.aiinpocket.loyalty.repository.PointsHistoryRepository;
import com.aiinpocket.loyalty.repository.UserPointsRepository;
import com.aiinpocket.loyalty.service.LevelTable.LevelDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 積分帳本。
 *
 * <p>每次入帳在同一個交易內完成：寫入 points_history、在資料庫端原子累加 user_points.total_points、
 * 重新讀取總分並推導等級。任何一步失敗整筆回滾，帳本與彙總不會只成功一半。
 * 其他服務（徽章、挑戰）一律透過 {@link #appendPoints} 入帳。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PointsLedgerService {

    private final PlatformUserRepository userRepo;
    private final UserPointsRepository userPointsRepo;
    private final PointsHistoryRepository historyRepo;
    private final LevelCatalog levelCatalog;
    private final LoyaltyProperties properties;
    private final Clock clock;

    /**
     * 入帳積分。呼叫端已在交易中時加入該交易。
     *
     * @param userId      使用者
     * @param delta       積分（必須大於 0）
     * @param type        積分類型
     * @param description 說明，空白時以類型名稱產生
     * @param orderId     關聯訂單（可為 null）
     */
    @Transactional
    public PointsAwardResult appendPoints(Long userId, int delta, PointsType type, String description, Long orderId) {
        if (userId == null) {
            throw new ValidationException("userId 為必填欄位");
        }
        if (delta <= 0) {
            throw new ValidationException("積分必須為正數");
        }
        if (type == null) {
            throw new ValidationException("pointsType 為必填欄位");
        }

        Instant now = clock.instant();
        LevelTable table = levelCatalog.currentTable();
        ensureAccount(userId, table, now);

        String effectiveDescription = description == null || description.isBlank()
                ? type.getDisplayName() + " +" + delta
                : description.trim();
        historyRepo.save(PointsHistory.builder()
                .userId(userId)
                .pointsEarned(delta)
                .pointsType(type)
                .description(effectiveDescription)
                .orderId(orderId)
                .createdAt(now)
                .build());

        int updated = userPointsRepo.incrementTotal(userId, delta, now);
        if (updated != 1) {
            throw new IllegalStateException("積分彙總更新失敗，userId=" + userId + "，影響筆數=" + updated);
        }

        long newTotal = userPointsRepo.findTotalPoints(userId)
                .orElseThrow(() -> new IllegalStateException("積分彙總遺失，userId=" + userId));
        LevelDefinition previousLevel = table.levelFor(newTotal - delta);
        LevelDefinition currentLevel = table.levelFor(newTotal);
        boolean leveledUp = currentLevel.levelNumber() > previousLevel.levelNumber();

        if (userPointsRepo.updateLevelIfChanged(userId, currentLevel.levelNumber(), now) > 0) {
            log.info("[等級] 用戶 {} 等級更新: Lv.{} → Lv.{} (總分: {})",
                    userId, previousLevel.levelNumber(), currentLevel.levelNumber(), newTotal);
        }
        log.info("[積分] 用戶 {} +{} ({})，總分 {}", userId, delta, type.getCode(), newTotal);

        return new PointsAwardResult(
                userId,
                delta,
                type,
                effectiveDescription,
                newTotal,
                previousLevel.levelNumber(),
                currentLevel.levelNumber(),
                currentLevel.name(),
                table.pointsToNextLevel(newTotal),
                leveledUp);
    }

    /**
     * 查詢使用者積分與等級進度。尚未有積分紀錄的使用者視為 0 分、第一級，不會建立資料。
     */
    @Transactional(readOnly = true)
    public PointsSummary getPoints(Long userId) {
        requireUser(userId);
        LevelTable table = levelCatalog.currentTable();
        UserPoints account = userPointsRepo.findById(userId).orElse(null);
        long total = account == null ? 0L : account.getTotalPoints();

        LevelDefinition current = table.levelFor(total);
        LevelDefinition next = table.next(current).orElse(null);
        long toNext = table.pointsToNextLevel(total);

        PointsSummary.Progress progress = new PointsSummary.Progress(
                total - current.pointsRequired(),
                next == null ? 0L : next.pointsRequired() - current.pointsRequired(),
                table.progressPercentage(total));

        return new PointsSummary(
                userId,
                total,
                LevelView.from(current),
                LevelView.from(next),
                toNext,
                progress,
                account == null ? null : account.getUpdatedAt());
    }

    /**
     * 分頁查詢積分歷史（新到舊）。
     *
     * @param typeCode 積分類型代碼，null 表示全部
     * @param limit    每頁筆數，null 使用預設值
     * @param offset   起始位置，null 視為 0
     */
    @Transactional(readOnly = true)
    public PointsHistoryPage getPointsHistory(Long userId, String typeCode, Integer limit, Long offset) {
        requireUser(userId);
        LoyaltyProperties.PageLimits limits = properties.history();
        int effectiveLimit = limit == null ? limits.defaultLimit() : limit;
        long effectiveOffset = offset == null ? 0L : offset;
        if (effectiveLimit < 1 || effectiveLimit > limits.maxLimit()) {
            throw new ValidationException("limit 必須介於 1 到 " + limits.maxLimit() + " 之間");
        }
        if (effectiveOffset < 0) {
            throw new ValidationException("offset 不可為負數");
        }
        PointsType type = typeCode == null || typeCode.isBlank() ? null : PointsType.fromCode(typeCode);

        Page<PointsHistory> page = historyRepo.findAll(
                PointsHistoryFilter.forUser(userId, type).toSpecification(),
                OffsetLimitRequest.of(effectiveOffset, effectiveLimit,
                        Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"))));

        List<PointsHistoryPage.Entry> entries = page.getContent().stream()
                .map(h -> new PointsHistoryPage.Entry(h.getId(), h.getPointsEarned(), h.getPointsType(),
                        h.getDescription(), h.getOrderId(), h.getCreatedAt()))
                .toList();

        return new PointsHistoryPage(
                userId,
                entries,
                PointsHistoryPage.Pagination.of(effectiveLimit, effectiveOffset, page.getTotalElements()),
                type,
                historyStatistics(userId));
    }

    private PointsHistoryPage.Statistics historyStatistics(Long userId) {
        List<PointsHistoryPage.TypeStat> byType = historyRepo.statsByType(userId).stream()
                .map(s -> new PointsHistoryPage.TypeStat(s.getPointsType(), s.getTotalPoints(), s.getTransactions()))
                .toList();
        long totalPoints = byType.stream().mapToLong(PointsHistoryPage.TypeStat::totalPoints).sum();
        long transactions = byType.stream().mapToLong(PointsHistoryPage.TypeStat::transactionCount).sum();
        long average = transactions == 0 ? 0 : Math.round((double) totalPoints / transactions);
        return new PointsHistoryPage.Statistics(totalPoints, transactions, average, byType);
    }

    /**
     * 確保 user_points 彙總列存在。
     * 並發的第一次入帳由主鍵約束決定誰建立，其餘的 INSERT 成為無操作。
     */
    private void ensureAccount(Long userId, LevelTable table, Instant now) {
        if (userPointsRepo.existsById(userId)) {
            return;
        }
        requireUser(userId);
        if (userPointsRepo.insertIfAbsent(userId, table.levelFor(0).levelNumber(), now) == 1) {
            log.info("[積分] 用戶 {} 建立積分帳戶", userId);
        }
    }

    private void requireUser(Long userId) {
        if (userId == null || !userRepo.existsById(userId)) {
            throw NotFoundException.user(userId);
        }
    }
}
