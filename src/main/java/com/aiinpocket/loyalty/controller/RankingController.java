package com.aiinpocket.loyalty.controller;

import com.aiinpocket.loyalty.exception.ValidationException;
import com.aiinpocket.loyalty.model.dto.RankingView;
import com.aiinpocket.loyalty.model.enums.RankingSort;
import com.aiinpocket.loyalty.model.enums.RankingWindow;
import com.aiinpocket.loyalty.security.CallerIdentity;
import com.aiinpocket.loyalty.service.RankingService;
import com.aiinpocket.loyalty.service.RankingService.RankingQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("/api/gamification/rankings")
@RequiredArgsConstructor
public class RankingController {

    private final RankingService rankingService;

    /**
     * 排行榜。
     *
     * @param week  週榜參考日期（yyyy-MM-dd，取該日所在週）
     * @param month 月榜月份（yyyy-MM）
     */
    @GetMapping
    public RankingView getRanking(CallerIdentity caller,
                                  @RequestParam(required = false) String window,
                                  @RequestParam(required = false) String sortBy,
                                  @RequestParam(required = false) Integer limit,
                                  @RequestParam(required = false) Long userId,
                                  @RequestParam(required = false) String week,
                                  @RequestParam(required = false) String month) {
        if (userId != null) {
            caller.requireAccessTo(userId);
        }
        RankingWindow rankingWindow = RankingWindow.fromCode(window);
        LocalDate referenceDate = switch (rankingWindow) {
            case WEEKLY -> parseDate(week);
            case MONTHLY -> parseMonth(month);
            case ALL_TIME -> null;
        };
        return rankingService.getRanking(new RankingQuery(
                rankingWindow, RankingSort.fromCode(sortBy), limit, referenceDate, userId));
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("week 格式必須為 yyyy-MM-dd");
        }
    }

    private static LocalDate parseMonth(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return YearMonth.parse(value.trim()).atDay(1);
        } catch (DateTimeParseException e) {
            throw new ValidationException("month 格式必須為 yyyy-MM");
        }
    }
}
