package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.config.LoyaltyProperties;
import com.aiinpocket.loyalty.exception.NotFoundException;
import com.aiinpocket.loyalty.model.dto.BadgeCatalogView;
import com.aiinpocket.loyalty.model.dto.BadgeCatalogView.BadgeView;
import com.aiinpocket.loyalty.model.dto.BadgeGrantResult;
import com.aiinpocket.loyalty.model.dto.BadgeGrantResult.UnlockedContent;
import com.aiinpocket.loyalty.model.dto.BadgeSummary;
import com.aiinpocket.loyalty.model.dto.ChallengeSummary;
import com.aiinpocket.loyalty.model.dto.PointsAwardResult;
import com.aiinpocket.loyalty.model.dto.UserBadgesView;
import com.aiinpocket.loyalty.model.dto.UserBadgesView.EarnedBadge;
import com.aiinpocket.loyalty.model.entity.Badge;
import com.aiinpocket.loyalty.model.entity.UserBadge;
import com.aiinpocket.loyalty.model.enums.BadgeCategory;
import com.aiinpocket.loyalty.model.enums.Difficulty;
import com.aiinpocket.loyalty.model.enums.PointsType;
import com.aiinpocket.loyalty.model.enums.Rarity;
import com.aiinpocket.loyalty.repository.BadgeFilter;
import com.aiinpocket.loyalty.repository.BadgeRepository;
import com.aiinpocket.loyalty.repository.ChallengeFilter;
import com.aiinpocket.loyalty.repository.ChallengeRepository;
import com.aiinpocket.loyalty.repository.PlatformUserRepository;
import com.aiinpocket.loyalty.repository.UserBadgeRepository;
import com.aiinpocket.loyalty.repository.UserBadgeRepository.BadgeEarnStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 徽章目錄與授予。
 * 是否已授予完全由 user_badges 的 (user_id, badge_id) 唯一約束決定，同一徽章的積分獎勵最多發放一次。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BadgeService {

    private final PlatformUserRepository userRepo;
    private final BadgeRepository badgeRepo;
    private final UserBadgeRepository userBadgeRepo;
    private final ChallengeRepository challengeRepo;
    private final PointsLedgerService ledger;
    private final LoyaltyProperties properties;
    private final Clock clock;

    /**
     * 授予徽章。
     * 已擁有時回傳 {@code newlyGranted = false}，不重複寫入也不重複發放積分。
     *
     * @throws NotFoundException 使用者不存在，或徽章不存在／已停用
     */
    @Transactional
    public BadgeGrantResult grantBadge(Long userId, Long badgeId, String reason) {
        if (userId == null || !userRepo.existsById(userId)) {
            throw NotFoundException.user(userId);
        }
        Badge badge = badgeRepo.findById(badgeId)
                .filter(Badge::isActive)
                .orElseThrow(() -> new NotFoundException("徽章不存在或已停用: " + badgeId));

        Instant now = clock.instant();
        String effectiveReason = reason == null || reason.isBlank() ? "獲得徽章: " + badge.getName() : reason.trim();

        if (userBadgeRepo.insertIfAbsent(userId, badgeId, now) == 0) {
            Instant earnedAt = userBadgeRepo.findByUserIdAndBadgeId(userId, badgeId)
                    .map(UserBadge::getEarnedAt)
                    .orElse(null);
            log.info("[徽章] 用戶 {} 已擁有徽章 {}，略過重複授予", userId, badgeId);
            return BadgeGrantResult.alreadyGranted(userId, BadgeSummary.from(badge), earnedAt, effectiveReason);
        }

        PointsAwardResult points = null;
        if (badge.getPointsReward() > 0) {
            points = ledger.appendPoints(userId, badge.getPointsReward(), PointsType.BADGE, effectiveReason, null);
        }
        log.info("[徽章] 用戶 {} 獲得徽章 {} ({})，獎勵 {} 分",
                userId, badge.getId(), badge.getName(), badge.getPointsReward());

        UnlockedContent unlocked = new UnlockedContent(
                points != null && points.leveledUp(),
                notStartedChallenges(userId, now),
                badge.getCriteria() == null ? List.of() : badge.getCriteria().specialRewards());

        return new BadgeGrantResult(
                userId,
                BadgeSummary.from(badge),
                true,
                now,
                points == null ? 0 : points.pointsAdded(),
                points == null ? null : points.newTotal(),
                points == null ? null : points.currentLevel(),
                points == null ? null : points.pointsToNextLevel(),
                effectiveReason,
                unlocked);
    }

    /**
     * 目前開放、且使用者尚未參與的挑戰（授予徽章或完成挑戰後推薦）。
     */
    @Transactional(readOnly = true)
    public List<ChallengeSummary> notStartedChallenges(Long userId, Instant now) {
        return challengeRepo.findAll(
                        ChallengeFilter.notStarted(now, null, userId).toSpecification(),
                        PageRequest.of(0, properties.unlockedChallengeLimit(),
                                Sort.by(Sort.Order.desc("pointsReward"), Sort.Order.asc("id"))))
                .map(ChallengeSummary::from)
                .getContent();
    }

    /**
     * 列出啟用中的徽章。
     *
     * @param categoryCode  分類代碼（null 表示全部）
     * @param userId        帶入時標示已獲得的徽章
     * @param includeEarned false 時排除使用者已獲得的徽章
     */
    @Transactional(readOnly = true)
    public BadgeCatalogView listBadges(String categoryCode, Long userId, boolean includeEarned) {
        BadgeCategory category = categoryCode == null || categoryCode.isBlank()
                ? null
                : BadgeCategory.fromCode(categoryCode);
        if (userId != null && !userRepo.existsById(userId)) {
            throw NotFoundException.user(userId);
        }

        List<Badge> badges = badgeRepo.findAll(new BadgeFilter(true, category).toSpecification(),
                Sort.by(Sort.Order.asc("pointsReward"), Sort.Order.asc("name"), Sort.Order.asc("id")));

        Map<Long, Instant> earned = userId == null
                ? Map.of()
                : userBadgeRepo.findByUserIdOrderByEarnedAtDesc(userId).stream()
                        .collect(Collectors.toMap(UserBadge::getBadgeId, UserBadge::getEarnedAt, (a, b) -> a));
        Map<Long, BadgeEarnStats> stats = userBadgeRepo.earnStatsByBadge().stream()
                .collect(Collectors.toMap(BadgeEarnStats::getBadgeId, Function.identity()));

        List<BadgeView> views = badges.stream()
                .filter(b -> includeEarned || !earned.containsKey(b.getId()))
                .map(b -> toView(b, earned.get(b.getId()), stats.get(b.getId())))
                .toList();

        Map<BadgeCategory, Long> byCategory = new EnumMap<>(BadgeCategory.class);
        Map<Difficulty, Long> byDifficulty = new EnumMap<>(Difficulty.class);
        for (BadgeView view : views) {
            byCategory.merge(view.category(), 1L, Long::sum);
            byDifficulty.merge(view.difficulty(), 1L, Long::sum);
        }
        long earnedCount = views.stream().filter(BadgeView::earned).count();
        long pointsAvailable = views.stream()
                .filter(v -> !v.earned())
                .mapToLong(BadgeView::pointsReward)
                .sum();

        BadgeCatalogView.Statistics statistics = new BadgeCatalogView.Statistics(
                views.size(), earnedCount, views.size() - earnedCount, pointsAvailable, byCategory, byDifficulty);
        return new BadgeCatalogView(views, statistics, new BadgeCatalogView.Filters(userId, category, includeEarned));
    }

    /**
     * 使用者已獲得的徽章（新到舊），依分類分組並附上完成度統計。
     */
    @Transactional(readOnly = true)
    public UserBadgesView getUserBadges(Long userId) {
        if (userId == null || !userRepo.existsById(userId)) {
            throw NotFoundException.user(userId);
        }
        List<UserBadge> owned = userBadgeRepo.findByUserIdOrderByEarnedAtDesc(userId);
        Map<Long, Badge> badges = badgeRepo.findByIdIn(owned.stream().map(UserBadge::getBadgeId).toList()).stream()
                .collect(Collectors.toMap(Badge::getId, Function.identity()));

        Instant now = clock.instant();
        List<EarnedBadge> earned = owned.stream()
                .filter(ub -> badges.containsKey(ub.getBadgeId()))
                .map(ub -> {
                    Badge b = badges.get(ub.getBadgeId());
                    return new EarnedBadge(b.getId(), b.getName(), b.getDescription(), b.getIconUrl(),
                            b.getCriteria(), b.getCategory(), b.getPointsReward(), ub.getEarnedAt(),
                            Duration.between(ub.getEarnedAt(), now).toDays());
                })
                .toList();

        Map<BadgeCategory, List<EarnedBadge>> byCategory = earned.stream()
                .collect(Collectors.groupingBy(EarnedBadge::category, LinkedHashMap::new, Collectors.toList()));

        long totalAvailable = badgeRepo.countByActiveTrue();
        ZoneId zone = clock.getZone();
        YearMonth thisMonth = YearMonth.now(clock);
        long thisMonthCount = earned.stream()
                .filter(e -> YearMonth.from(e.earnedAt().atZone(zone)).equals(thisMonth))
                .count();

        UserBadgesView.Statistics statistics = new UserBadgesView.Statistics(
                earned.size(),
                totalAvailable,
                totalAvailable == 0 ? 0 : (int) Math.round(earned.size() * 100.0 / totalAvailable),
                earned.stream().mapToLong(EarnedBadge::pointsReward).sum(),
                thisMonthCount);
        return new UserBadgesView(userId, earned, byCategory, statistics);
    }

    private BadgeView toView(Badge badge, Instant earnedAt, BadgeEarnStats stats) {
        long timesEarned = stats == null ? 0 : stats.getTimesEarned();
        Difficulty difficulty = badge.getCriteria() == null ? Difficulty.EASY : badge.getCriteria().difficulty();
        return new BadgeView(
                badge.getId(),
                badge.getName(),
                badge.getDescription(),
                badge.getIconUrl(),
                badge.getCriteria(),
                badge.getPointsReward(),
                badge.getCategory(),
                difficulty,
                earnedAt != null,
                earnedAt,
                timesEarned,
                stats == null ? null : stats.getFirstEarned(),
                stats == null ? null : stats.getLastEarned(),
                Rarity.fromTimesEarned(timesEarned));
    }
}
