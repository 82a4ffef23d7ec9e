package com.aiinpocket.loyalty.controller;

import com.aiinpocket.loyalty.model.dto.AddPointsRequest;
import com.aiinpocket.loyalty.model.dto.PointsAwardResult;
import com.aiinpocket.loyalty.model.dto.PointsHistoryPage;
import com.aiinpocket.loyalty.model.dto.PointsSummary;
import com.aiinpocket.loyalty.model.enums.PointsType;
import com.aiinpocket.loyalty.security.CallerIdentity;
import com.aiinpocket.loyalty.service.PointsLedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/gamification/points")
@RequiredArgsConstructor
public class PointsController {

    private final PointsLedgerService ledger;

    /** 入帳積分（僅限內部服務，例如訂單完成後） */
    @PostMapping
    public PointsAwardResult addPoints(CallerIdentity caller, @Valid @RequestBody AddPointsRequest request) {
        caller.requireInternal();
        return ledger.appendPoints(request.userId(), request.points(), PointsType.fromCode(request.pointsType()),
                request.description(), request.orderId());
    }

    @GetMapping("/{userId}")
    public PointsSummary getPoints(CallerIdentity caller, @PathVariable Long userId) {
        caller.requireAccessTo(userId);
        return ledger.getPoints(userId);
    }

    @GetMapping("/{userId}/history")
    public PointsHistoryPage getHistory(CallerIdentity caller,
                                        @PathVariable Long userId,
                                        @RequestParam(required = false) String pointsType,
                                        @RequestParam(required = false) Integer limit,
                                        @RequestParam(required = false) Long offset) {
        caller.requireAccessTo(userId);
        return ledger.getPointsHistory(userId, pointsType, limit, offset);
    }
}
