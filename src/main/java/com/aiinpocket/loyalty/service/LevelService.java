package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.exception.NotFoundException;
import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import com.aiinpocket.loyalty.model.dto.LevelListView;
import com.aiinpocket.loyalty.model.dto.LevelView;
import com.aiinpocket.loyalty.model.dto.UserLevelView;
import com.aiinpocket.loyalty.model.entity.PointsHistory;
import com.aiinpocket.loyalty.model.entity.UserPoints;
import com.aiinpocket.loyalty.repository.PlatformUserRepository;
import com.aiinpocket.loyalty.repository.PointsHistoryRepository;
import com.aiinpocket.loyalty.repository.UserPointsRepository;
import com.aiinpocket.loyalty.repository.UserPointsRepository.LevelDistributionRow;
import com.aiinpocket.loyalty.service.LevelTable.LevelDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 等級查詢（唯讀）。
 */
@Service
@RequiredArgsConstructor
public class LevelService {

    private final PlatformUserRepository userRepo;
    private final UserPointsRepository userPointsRepo;
    private final PointsHistoryRepository historyRepo;
    private final LevelCatalog levelCatalog;

    /**
     * 列出所有等級。
     *
     * @param userId       帶入時標示使用者目前所在等級
     * @param includeStats 是否附上各等級人數分佈
     */
    @Transactional(readOnly = true)
    public LevelListView listLevels(Long userId, boolean includeStats) {
        LevelTable table = levelCatalog.currentTable();
        Integer userLevel = null;
        if (userId != null) {
            requireUser(userId);
            userLevel = table.levelFor(totalPoints(userId)).levelNumber();
        }

        List<LevelListView.Entry> entries = new ArrayList<>();
        LevelBenefits previousBenefits = null;
        for (LevelDefinition level : table.levels()) {
            // 由此等級升到下一級所需的積分差，最高級為 0
            long toReach = table.next(level)
                    .map(n -> n.pointsRequired() - level.pointsRequired())
                    .orElse(0L);
            entries.add(new LevelListView.Entry(
                    level.levelNumber(),
                    level.name(),
                    level.pointsRequired(),
                    level.benefits(),
                    userLevel != null && userLevel == level.levelNumber(),
                    toReach,
                    previousBenefits == null ? Map.of() : level.benefits().improvementsOver(previousBenefits)));
            previousBenefits = level.benefits();
        }

        return new LevelListView(entries, entries.size(), userLevel,
                includeStats ? distribution(table) : null);
    }

    /**
     * 查詢使用者等級詳情，含達到目前等級的時間點。
     */
    @Transactional(readOnly = true)
    public UserLevelView getUserLevel(Long userId) {
        requireUser(userId);
        LevelTable table = levelCatalog.currentTable();
        Optional<UserPoints> account = userPointsRepo.findById(userId);
        long total = account.map(UserPoints::getTotalPoints).orElse(0L);

        LevelDefinition current = table.levelFor(total);
        LevelDefinition previous = table.previous(current).orElse(null);
        LevelDefinition next = table.next(current).orElse(null);

        UserLevelView.Progress progress = new UserLevelView.Progress(
                total,
                total - current.pointsRequired(),
                table.pointsToNextLevel(total),
                table.progressPercentage(total),
                next == null);

        Instant achievedAt = current.pointsRequired() == 0
                ? account.map(UserPoints::getCreatedAt).orElse(null)
                : reachedAt(userId, current.pointsRequired());

        return new UserLevelView(
                userId,
                LevelView.from(current),
                achievedAt,
                LevelView.from(previous),
                LevelView.from(next),
                progress,
                next == null ? Map.of() : next.benefits().improvementsOver(current.benefits()));
    }

    /** 累計首次達到 threshold 的事件時間，由資料庫以視窗函式累加 */
    private Instant reachedAt(Long userId, long threshold) {
        return historyRepo.findFirstIdReaching(userId, threshold)
                .flatMap(historyRepo::findById)
                .map(PointsHistory::getCreatedAt)
                .orElse(null);
    }

    private LevelListView.Statistics distribution(LevelTable table) {
        List<LevelDistributionRow> rows = userPointsRepo.levelDistribution();
        long totalUsers = rows.stream().mapToLong(LevelDistributionRow::getUsersCount).sum();

        List<LevelListView.LevelShare> shares = rows.stream()
                .sorted(Comparator.comparing(LevelDistributionRow::getLevelNumber))
                .map(row -> new LevelListView.LevelShare(
                        row.getLevelNumber(),
                        table.find(row.getLevelNumber()).map(LevelDefinition::name).orElse(null),
                        row.getUsersCount(),
                        totalUsers == 0 ? 0 : (int) Math.round(row.getUsersCount() * 100.0 / totalUsers),
                        row.getAveragePoints() == null ? 0 : Math.round(row.getAveragePoints())))
                .toList();

        Integer mostPopular = shares.stream()
                .max(Comparator.comparingLong(LevelListView.LevelShare::usersCount))
                .map(LevelListView.LevelShare::levelNumber)
                .orElse(null);

        return new LevelListView.Statistics(totalUsers, shares, mostPopular);
    }

    private long totalPoints(Long userId) {
        return userPointsRepo.findTotalPoints(userId).orElse(0L);
    }

    private void requireUser(Long userId) {
        if (userId == null || !userRepo.existsById(userId)) {
            throw NotFoundException.user(userId);
        }
    }
}
