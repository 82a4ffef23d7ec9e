package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.config.LoyaltyProperties;
import com.aiinpocket.loyalty.exception.ValidationException;
import com.aiinpocket.loyalty.model.dto.RankingView;
import com.aiinpocket.loyalty.model.entity.PlatformUser;
import com.aiinpocket.loyalty.model.entity.UserPoints;
import com.aiinpocket.loyalty.model.enums.RankingSort;
import com.aiinpocket.loyalty.model.enums.RankingWindow;
import com.aiinpocket.loyalty.repository.PlatformUserRepository;
import com.aiinpocket.loyalty.repository.PointsHistoryRepository;
import com.aiinpocket.loyalty.repository.PointsHistoryRepository.WindowPoints;
import com.aiinpocket.loyalty.repository.UserBadgeRepository;
import com.aiinpocket.loyalty.repository.UserChallengeProgressRepository;
import com.aiinpocket.loyalty.repository.UserCount;
import com.aiinpocket.loyalty.repository.UserPointsRepository;
import com.aiinpocket.loyalty.service.RankingCalculator.Candidate;
import com.aiinpocket.loyalty.service.RankingCalculator.Ranked;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 排行榜。
 *
 * <p>全期排行直接讀取 user_points.total_points；週榜／月榜由 points_history 依區間彙總，
 * 區間為設定時區下的 [週一 00:00, 下週一 00:00) 與 [月初, 下月初)。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingService {

    private final PlatformUserRepository userRepo;
    private final UserPointsRepository userPointsRepo;
    private final PointsHistoryRepository historyRepo;
    private final UserBadgeRepository userBadgeRepo;
    private final UserChallengeProgressRepository progressRepo;
    private final LoyaltyProperties properties;
    private final Clock clock;

    /**
     * 查詢排行榜。
     *
     * @param query 區間、排序、筆數與要標示的使用者
     */
    @Transactional(readOnly = true)
    public RankingView getRanking(RankingQuery query) {
        LoyaltyProperties.PageLimits limits = properties.ranking();
        int limit = query.limit() == null ? limits.defaultLimit() : query.limit();
        if (limit < 1 || limit > limits.maxLimit()) {
            throw new ValidationException("limit 必須介於 1 到 " + limits.maxLimit() + " 之間");
        }
        RankingWindow window = query.window() == null ? RankingWindow.ALL_TIME : query.window();
        RankingSort sort = query.sortBy() == null ? RankingSort.TOTAL_POINTS : query.sortBy();

        RankingView.Period period = periodOf(window, query.referenceDate());
        List<Ranked> ranked = RankingCalculator.rank(candidates(period), sort);

        List<Ranked> top = ranked.subList(0, Math.min(limit, ranked.size()));
        Ranked highlighted = query.highlightUserId() == null ? null : ranked.stream()
                .filter(r -> r.candidate().userId().equals(query.highlightUserId()))
                .findFirst()
                .orElse(null);

        Map<Long, String> names = userRepo.findByIdIn(Stream.concat(top.stream(), Stream.ofNullable(highlighted))
                        .map(r -> r.candidate().userId())
                        .collect(Collectors.toSet()))
                .stream()
                .filter(u -> u.getName() != null)
                .collect(Collectors.toMap(PlatformUser::getId, PlatformUser::getName));

        List<RankingView.Entry> entries = top.stream().map(r -> toEntry(r, names)).toList();
        log.debug("[排行榜] {} / {}，共 {} 名，回傳 {} 筆", window.getCode(), sort.getCode(), ranked.size(), entries.size());

        return new RankingView(
                window,
                sort,
                period,
                entries,
                highlighted == null ? null : toEntry(highlighted, names),
                statistics(ranked));
    }

    /**
     * 計算統計區間；全期排行回傳 null。
     *
     * @param referenceDate 區間內的任一天（null 表示今天）
     */
    RankingView.Period periodOf(RankingWindow window, LocalDate referenceDate) {
        ZoneId zone = clock.getZone();
        LocalDate date = referenceDate == null ? LocalDate.now(clock) : referenceDate;
        return switch (window) {
            case ALL_TIME -> null;
            case WEEKLY -> {
                LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                yield new RankingView.Period(
                        monday.atStartOfDay(zone).toInstant(),
                        monday.plusWeeks(1).atStartOfDay(zone).toInstant());
            }
            case MONTHLY -> {
                YearMonth month = YearMonth.from(date);
                yield new RankingView.Period(
                        month.atDay(1).atStartOfDay(zone).toInstant(),
                        month.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant());
            }
        };
    }

    private List<Candidate> candidates(RankingView.Period period) {
        Map<Long, Long> badges = toCountMap(userBadgeRepo.countByUser());
        Map<Long, Long> challenges = toCountMap(progressRepo.countCompletedByUser());
        List<Candidate> result = new ArrayList<>();

        if (period == null) {
            for (UserPoints account : userPointsRepo.findByTotalPointsGreaterThan(0L)) {
                result.add(new Candidate(
                        account.getUserId(),
                        account.getTotalPoints(),
                        null,
                        account.getTotalPoints(),
                        account.getCurrentLevel(),
                        badges.getOrDefault(account.getUserId(), 0L),
                        challenges.getOrDefault(account.getUserId(), 0L)));
            }
            return result;
        }

        List<WindowPoints> windowRows = historyRepo.sumByUserBetween(period.start(), period.end());
        if (windowRows.isEmpty()) {
            return result;
        }
        Map<Long, UserPoints> accounts = userPointsRepo.findByUserIds(
                        windowRows.stream().map(WindowPoints::getUserId).toList()).stream()
                .collect(Collectors.toMap(UserPoints::getUserId, Function.identity()));
        for (WindowPoints row : windowRows) {
            UserPoints account = accounts.get(row.getUserId());
            result.add(new Candidate(
                    row.getUserId(),
                    row.getPoints(),
                    row.getTransactions(),
                    account == null ? 0L : account.getTotalPoints(),
                    account == null ? 1 : account.getCurrentLevel(),
                    badges.getOrDefault(row.getUserId(), 0L),
                    challenges.getOrDefault(row.getUserId(), 0L)));
        }
        return result;
    }

    private static RankingView.Entry toEntry(Ranked ranked, Map<Long, String> names) {
        Candidate c = ranked.candidate();
        return new RankingView.Entry(
                ranked.position(),
                c.userId(),
                names.getOrDefault(c.userId(), "User" + c.userId()),
                c.windowPoints(),
                c.windowTransactions(),
                c.totalPoints(),
                c.currentLevel(),
                c.badgesCount(),
                c.challengesCompleted());
    }

    private static RankingView.Statistics statistics(List<Ranked> ranked) {
        long total = ranked.stream().mapToLong(r -> r.candidate().windowPoints()).sum();
        long highest = ranked.stream().mapToLong(r -> r.candidate().windowPoints()).max().orElse(0);
        return new RankingView.Statistics(
                ranked.size(),
                total,
                ranked.isEmpty() ? 0 : Math.round((double) total / ranked.size()),
                highest);
    }

    private static Map<Long, Long> toCountMap(List<UserCount> counts) {
        return counts.stream()
                .filter(c -> Objects.nonNull(c.getUserId()))
                .collect(Collectors.toMap(UserCount::getUserId, UserCount::getTotal));
    }

    /**
     * 排行榜查詢條件。
     *
     * @param referenceDate   週榜／月榜的參考日期（null 表示今天）
     * @param highlightUserId 需另外標示名次的使用者（不在前 N 名也會回傳）
     */
    public record RankingQuery(
            RankingWindow window,
            RankingSort sortBy,
            Integer limit,
            LocalDate referenceDate,
            Long highlightUserId
    ) {}
}
