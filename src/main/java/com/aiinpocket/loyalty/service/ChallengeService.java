package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.config.LoyaltyProperties;
import com.aiinpocket.loyalty.exception.ConflictException;
import com.aiinpocket.loyalty.exception.NotFoundException;
import com.aiinpocket.loyalty.exception.ValidationException;
import com.aiinpocket.loyalty.model.dto.ActiveChallengesView;
import com.aiinpocket.loyalty.model.dto.BadgeGrantResult;
import com.aiinpocket.loyalty.model.dto.BadgeSummary;
import com.aiinpocket.loyalty.model.dto.ChallengeCompletionResult;
import com.aiinpocket.loyalty.model.dto.ChallengeProgressSnapshot;
import com.aiinpocket.loyalty.model.dto.ChallengeProgressView;
import com.aiinpocket.loyalty.model.dto.ChallengeSummary;
import com.aiinpocket.loyalty.model.dto.PointsAwardResult;
import com.aiinpocket.loyalty.model.dto.TimeSpan;
import com.aiinpocket.loyalty.model.entity.Badge;
import com.aiinpocket.loyalty.model.entity.Challenge;
import com.aiinpocket.loyalty.model.entity.UserChallengeProgress;
import com.aiinpocket.loyalty.model.enums.ChallengeStatus;
import com.aiinpocket.loyalty.model.enums.ChallengeType;
import com.aiinpocket.loyalty.model.enums.PointsType;
import com.aiinpocket.loyalty.repository.BadgeRepository;
import com.aiinpocket.loyalty.repository.ChallengeFilter;
import com.aiinpocket.loyalty.repository.ChallengeRepository;
import com.aiinpocket.loyalty.repository.PlatformUserRepository;
import com.aiinpocket.loyalty.repository.UserChallengeProgressRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 挑戰參與、進度與完成。
 *
 * <p>挑戰狀態只有 completed 旗標會寫入資料庫，且只能經由條件式 UPDATE 由 false 轉為 true 一次；
 * expired / inactive 於每次讀寫時依 {@link Clock} 推導。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChallengeService {

    /** 進度達到此百分比視為「接近完成」 */
    private static final int NEAR_COMPLETION_PERCENT = 80;

    private static final Comparator<Challenge> LISTING_ORDER = Comparator
            .comparing(Challenge::getChallengeType)
            .thenComparing(Challenge::getEndDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Challenge::getPointsReward, Comparator.reverseOrder())
            .thenComparing(Challenge::getId);

    private final PlatformUserRepository userRepo;
    private final ChallengeRepository challengeRepo;
    private final UserChallengeProgressRepository progressRepo;
    private final BadgeRepository badgeRepo;
    private final PointsLedgerService ledger;
    private final BadgeService badgeService;
    private final TransactionTemplate transactionTemplate;
    private final LoyaltyProperties properties;
    private final Clock clock;

    /**
     * 列出目前開放的挑戰（依類型、結束時間、獎勵排序）。
     *
     * @param typeCode         挑戰類型（null 表示全部）
     * @param userId           帶入時附上該使用者的進度
     * @param includeCompleted false 時排除該使用者已完成的挑戰
     */
    @Transactional(readOnly = true)
    public ActiveChallengesView listActiveChallenges(String typeCode, Long userId, boolean includeCompleted) {
        ChallengeType type = typeCode == null || typeCode.isBlank() ? null : ChallengeType.fromCode(typeCode);
        if (userId != null) {
            requireUser(userId);
        }
        Instant now = clock.instant();

        List<Challenge> challenges = challengeRepo.findAll(ChallengeFilter.openAt(now, type).toSpecification())
                .stream()
                .sorted(LISTING_ORDER)
                .toList();

        Map<Long, UserChallengeProgress> progressByChallenge = userId == null
                ? Map.of()
                : progressRepo.findByUserId(userId).stream()
                        .collect(Collectors.toMap(UserChallengeProgress::getChallengeId, Function.identity()));
        Map<Long, Badge> badgeRewards = badgesById(challenges.stream().map(Challenge::getBadgeRewardId).toList());

        List<ActiveChallengesView.Item> items = challenges.stream()
                .filter(c -> includeCompleted || !isCompleted(progressByChallenge.get(c.getId())))
                .map(c -> toActiveItem(c, progressByChallenge.get(c.getId()), badgeRewards, now))
                .toList();

        Map<ChallengeType, Long> countsByType = new EnumMap<>(ChallengeType.class);
        items.forEach(item -> countsByType.merge(item.type(), 1L, Long::sum));

        return new ActiveChallengesView(items, countsByType,
                new ActiveChallengesView.Filters(type, userId, includeCompleted));
    }

    /**
     * 參與挑戰。重複參與時回傳既有進度（newlyStarted = false）。
     *
     * @throws ConflictException 挑戰已過期、未啟用或尚未開始
     */
    @Transactional
    public ChallengeProgressSnapshot startChallenge(Long userId, Long challengeId) {
        requireUser(userId);
        Challenge challenge = requireChallenge(challengeId);
        Instant now = clock.instant();
        requireOpen(challenge, now);

        int target = Math.max(1, challenge.getCriteria().target());
        boolean created = progressRepo.insertIfAbsent(userId, challengeId, target, now) == 1;
        UserChallengeProgress row = progressRepo.findByUserIdAndChallengeId(userId, challengeId)
                .orElseThrow(() -> new IllegalStateException(
                        "挑戰進度遺失，userId=" + userId + "，challengeId=" + challengeId));
        if (created) {
            log.info("[挑戰] 用戶 {} 參與挑戰 {} ({})，目標 {}", userId, challengeId, challenge.getTitle(), target);
        }
        return ChallengeProgressSnapshot.of(row, created);
    }

    /**
     * 累加挑戰進度（資料庫端原子累加）。
     *
     * @throws NotFoundException 使用者尚未參與此挑戰
     * @throws ConflictException 挑戰已完成、已過期或未啟用
     */
    @Transactional
    public ChallengeProgressSnapshot recordProgress(Long userId, Long challengeId, int amount) {
        if (amount <= 0) {
            throw new ValidationException("進度增量必須為正數");
        }
        requireUser(userId);
        Challenge challenge = requireChallenge(challengeId);
        Instant now = clock.instant();
        requireOpen(challenge, now);

        if (progressRepo.incrementProgress(userId, challengeId, amount, now) == 0) {
            UserChallengeProgress existing = progressRepo.findByUserIdAndChallengeId(userId, challengeId)
                    .orElseThrow(() -> new NotFoundException("使用者尚未參與此挑戰: " + challengeId));
            if (existing.isCompleted()) {
                throw new ConflictException("挑戰已完成，無法再累加進度");
            }
            throw new IllegalStateException("挑戰進度更新失敗，challengeId=" + challengeId);
        }
        UserChallengeProgress row = progressRepo.findByUserIdAndChallengeId(userId, challengeId)
                .orElseThrow(() -> new IllegalStateException("挑戰進度遺失，challengeId=" + challengeId));
        log.debug("[挑戰] 用戶 {} 挑戰 {} 進度 +{} → {}/{}",
                userId, challengeId, amount, row.getProgress(), row.getTarget());
        return ChallengeProgressSnapshot.of(row, false);
    }

    /**
     * 查詢使用者的挑戰進度。
     *
     * @param challengeId 只查單一挑戰（null 表示全部）
     * @param statusCode  {@code active} / {@code completed} / {@code all}（null 視為 all）
     */
    @Transactional(readOnly = true)
    public ChallengeProgressView getChallengeProgress(Long userId, Long challengeId, String statusCode) {
        requireUser(userId);
        String status = statusCode == null || statusCode.isBlank() ? "all" : statusCode.trim().toLowerCase();
        if (!List.of("all", "active", "completed").contains(status)) {
            throw new ValidationException("無效的狀態過濾條件: " + statusCode);
        }

        List<UserChallengeProgress> rows = challengeId == null
                ? progressRepo.findByUserId(userId)
                : progressRepo.findByUserIdAndChallengeId(userId, challengeId).stream().toList();
        Map<Long, Challenge> challenges = challengeRepo.findByIdIn(
                        rows.stream().map(UserChallengeProgress::getChallengeId).toList()).stream()
                .collect(Collectors.toMap(Challenge::getId, Function.identity()));
        Map<Long, Badge> badgeRewards = badgesById(challenges.values().stream()
                .map(Challenge::getBadgeRewardId).toList());

        Instant now = clock.instant();
        List<ChallengeProgressView.Entry> entries = rows.stream()
                .filter(row -> challenges.containsKey(row.getChallengeId()))
                .map(row -> toProgressEntry(row, challenges.get(row.getChallengeId()), badgeRewards, now))
                .filter(e -> switch (status) {
                    case "active" -> e.status() == ChallengeStatus.ACTIVE;
                    case "completed" -> e.status() == ChallengeStatus.COMPLETED;
                    default -> true;
                })
                .sorted(Comparator.comparing(ChallengeProgressView.Entry::completed)
                        .thenComparing(ChallengeProgressView.Entry::endDate,
                                Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(ChallengeProgressView.Entry::lastUpdated, Comparator.reverseOrder()))
                .toList();

        return new ChallengeProgressView(userId, entries, progressStatistics(entries),
                new ChallengeProgressView.Filters(challengeId, status));
    }

    /**
     * 完成挑戰並發放獎勵。
     *
     * <p>標記完成與積分入帳在同一個交易內提交；徽章獎勵於該交易提交後以獨立交易授予，
     * 授予失敗只會記錄在結果的 badgeRewardFailed，已完成的挑戰與積分不會回滾。
     * 因此本方法不可在外層交易中呼叫。
     *
     * @param allowForce 忽略進度目標強制完成（僅限內部呼叫者）
     * @throws NotFoundException 挑戰不存在／已停用，或使用者尚未參與
     * @throws ConflictException 已完成、不在有效期間或進度未達目標
     */
    public ChallengeCompletionResult completeChallenge(Long userId, Long challengeId, boolean allowForce) {
        CompletedChallenge done = Objects.requireNonNull(
                transactionTemplate.execute(status -> markCompletedAndReward(userId, challengeId, allowForce)));

        Challenge challenge = done.challenge();
        BadgeGrantResult badgeGrant = null;
        String badgeError = null;
        if (challenge.getBadgeRewardId() != null) {
            try {
                badgeGrant = badgeService.grantBadge(userId, challenge.getBadgeRewardId(),
                        "完成挑戰獎勵: " + challenge.getTitle());
            } catch (RuntimeException e) {
                badgeError = e.getMessage();
                log.warn("[挑戰] 用戶 {} 完成挑戰 {}，但徽章 {} 獎勵發放失敗: {}",
                        userId, challengeId, challenge.getBadgeRewardId(), e.getMessage());
            }
        }

        PointsAwardResult points = done.points();
        int pointsEarned = points == null ? 0 : points.pointsAdded();
        Long newTotal = points == null ? null : points.newTotal();
        Integer level = points == null ? null : points.currentLevel();
        Long toNext = points == null ? null : points.pointsToNextLevel();
        BadgeSummary badgeEarned = null;
        if (badgeGrant != null && badgeGrant.newlyGranted()) {
            badgeEarned = badgeGrant.badge();
            pointsEarned += badgeGrant.pointsAwarded();
            if (badgeGrant.newTotalPoints() != null) {
                newTotal = badgeGrant.newTotalPoints();
                level = badgeGrant.currentLevel();
                toNext = badgeGrant.pointsToNextLevel();
            }
        }

        UserChallengeProgress row = done.progress();
        List<ChallengeSummary> newChallenges = challengeRepo.findAll(
                        ChallengeFilter.notStarted(clock.instant(), challenge.getChallengeType(), userId)
                                .toSpecification(),
                        PageRequest.of(0, properties.unlockedChallengeLimit(),
                                Sort.by(Sort.Order.desc("pointsReward"), Sort.Order.asc("id"))))
                .map(ChallengeSummary::from)
                .getContent();

        return new ChallengeCompletionResult(
                userId,
                challengeId,
                ChallengeSummary.from(challenge),
                done.completedAt(),
                TimeSpan.of(Duration.between(row.getCreatedAt(), done.completedAt())),
                new ChallengeCompletionResult.FinalProgress(row.getProgress(), row.getTarget(), row.percentage()),
                new ChallengeCompletionResult.Rewards(pointsEarned, badgeEarned, newTotal, level, toNext),
                badgeError != null,
                badgeError,
                newChallenges);
    }

    private CompletedChallenge markCompletedAndReward(Long userId, Long challengeId, boolean allowForce) {
        requireUser(userId);
        Challenge challenge = requireChallenge(challengeId);
        Instant now = clock.instant();
        requireOpen(challenge, now);

        UserChallengeProgress row = progressRepo.findByUserIdAndChallengeId(userId, challengeId)
                .orElseThrow(() -> new NotFoundException("使用者尚未參與此挑戰: " + challengeId));
        if (row.isCompleted()) {
            throw new ConflictException("挑戰已完成");
        }
        if (!allowForce && row.getProgress() < row.getTarget()) {
            throw new ConflictException(String.format("尚未達成挑戰目標，目前進度 %d/%d",
                    row.getProgress(), row.getTarget()));
        }
        if (progressRepo.markCompleted(userId, challengeId, now) == 0) {
            throw new ConflictException("挑戰已完成");
        }

        PointsAwardResult points = null;
        if (challenge.getPointsReward() > 0) {
            points = ledger.appendPoints(userId, challenge.getPointsReward(), PointsType.CHALLENGE,
                    "完成挑戰: " + challenge.getTitle(), null);
        }
        log.info("[挑戰] 用戶 {} 完成挑戰 {} ({})，獎勵 {} 分{}",
                userId, challengeId, challenge.getTitle(), challenge.getPointsReward(), allowForce ? "（強制完成）" : "");
        return new CompletedChallenge(challenge, row, now, points);
    }

    private ActiveChallengesView.Item toActiveItem(Challenge c, UserChallengeProgress row,
                                                   Map<Long, Badge> badgeRewards, Instant now) {
        ActiveChallengesView.UserProgress userProgress = row == null ? null : new ActiveChallengesView.UserProgress(
                row.getProgress(), row.getTarget(), row.percentage(), row.isCompleted(),
                row.getCompletedAt(), row.getCreatedAt());
        return new ActiveChallengesView.Item(
                c.getId(),
                c.getTitle(),
                c.getDescription(),
                c.getChallengeType(),
                c.getCriteria(),
                c.getPointsReward(),
                BadgeSummary.from(badgeRewards.get(c.getBadgeRewardId())),
                c.getStartDate(),
                c.getEndDate(),
                c.getEndDate() == null ? null : TimeSpan.of(Duration.between(now, c.getEndDate())),
                statusOf(c, row, now),
                userProgress);
    }

    private ChallengeProgressView.Entry toProgressEntry(UserChallengeProgress row, Challenge c,
                                                        Map<Long, Badge> badgeRewards, Instant now) {
        ChallengeStatus status = statusOf(c, row, now);
        Instant spentUntil = row.isCompleted() && row.getCompletedAt() != null ? row.getCompletedAt() : now;
        return new ChallengeProgressView.Entry(
                row.getId(),
                c.getId(),
                c.getTitle(),
                c.getDescription(),
                c.getChallengeType(),
                c.getCriteria(),
                c.getPointsReward(),
                BadgeSummary.from(badgeRewards.get(c.getBadgeRewardId())),
                c.getStartDate(),
                c.getEndDate(),
                row.getProgress(),
                row.getTarget(),
                row.percentage(),
                Math.max(0, row.getTarget() - row.getProgress()),
                row.isCompleted(),
                row.getCompletedAt(),
                row.getCreatedAt(),
                row.getUpdatedAt(),
                c.getEndDate() == null || row.isCompleted() ? null : TimeSpan.of(Duration.between(now, c.getEndDate())),
                TimeSpan.of(Duration.between(row.getCreatedAt(), spentUntil)),
                status,
                status == ChallengeStatus.ACTIVE && row.getProgress() >= row.getTarget());
    }

    private ChallengeProgressView.Statistics progressStatistics(List<ChallengeProgressView.Entry> entries) {
        Map<ChallengeStatus, Long> byStatus = entries.stream()
                .collect(Collectors.groupingBy(ChallengeProgressView.Entry::status, Collectors.counting()));
        List<ChallengeProgressView.Entry> completed = entries.stream()
                .filter(ChallengeProgressView.Entry::completed)
                .toList();
        long averageDays = completed.isEmpty() ? 0 : Math.round(completed.stream()
                .mapToLong(e -> e.timeSpent().days())
                .average()
                .orElse(0));

        return new ChallengeProgressView.Statistics(
                entries.size(),
                byStatus.getOrDefault(ChallengeStatus.ACTIVE, 0L),
                byStatus.getOrDefault(ChallengeStatus.COMPLETED, 0L),
                byStatus.getOrDefault(ChallengeStatus.EXPIRED, 0L),
                byStatus.getOrDefault(ChallengeStatus.INACTIVE, 0L),
                completed.stream().mapToLong(ChallengeProgressView.Entry::pointsReward).sum(),
                averageDays,
                entries.isEmpty() ? 0 : (int) Math.round(completed.size() * 100.0 / entries.size()),
                entries.stream()
                        .filter(e -> e.status() == ChallengeStatus.ACTIVE && e.percentage() >= NEAR_COMPLETION_PERCENT)
                        .count(),
                entries.stream().filter(ChallengeProgressView.Entry::canComplete).count());
    }

    private static ChallengeStatus statusOf(Challenge c, UserChallengeProgress row, Instant now) {
        return ChallengeStatus.derive(row != null, isCompleted(row), c.isActive(),
                c.getStartDate(), c.getEndDate(), now);
    }

    private static boolean isCompleted(UserChallengeProgress row) {
        return row != null && row.isCompleted();
    }

    private Map<Long, Badge> badgesById(Collection<Long> ids) {
        List<Long> nonNull = ids.stream().filter(Objects::nonNull).distinct().toList();
        if (nonNull.isEmpty()) {
            return Map.of();
        }
        return badgeRepo.findByIdIn(nonNull).stream()
                .collect(Collectors.toMap(Badge::getId, Function.identity()));
    }

    private Challenge requireChallenge(Long challengeId) {
        return challengeRepo.findById(challengeId)
                .filter(Challenge::isActive)
                .orElseThrow(() -> new NotFoundException("挑戰不存在或已停用: " + challengeId));
    }

    private static void requireOpen(Challenge challenge, Instant now) {
        if (challenge.getEndDate() != null && now.isAfter(challenge.getEndDate())) {
            throw new ConflictException("挑戰已過期");
        }
        if (now.isBefore(challenge.getStartDate())) {
            throw new ConflictException("挑戰尚未開始");
        }
    }

    private void requireUser(Long userId) {
        if (userId == null || !userRepo.existsById(userId)) {
            throw NotFoundException.user(userId);
        }
    }

    private record CompletedChallenge(
            Challenge challenge,
            UserChallengeProgress progress,
            Instant completedAt,
            PointsAwardResult points
    ) {}
}
