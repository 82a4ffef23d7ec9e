package com.aiinpocket.loyalty.controller;

import com.aiinpocket.loyalty.exception.ValidationException;
import com.aiinpocket.loyalty.model.dto.ActiveChallengesView;
import com.aiinpocket.loyalty.model.dto.ChallengeActionRequest;
import com.aiinpocket.loyalty.model.dto.ChallengeCompletionResult;
import com.aiinpocket.loyalty.model.dto.ChallengeProgressSnapshot;
import com.aiinpocket.loyalty.model.dto.ChallengeProgressView;
import com.aiinpocket.loyalty.security.CallerIdentity;
import com.aiinpocket.loyalty.service.ChallengeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/gamification/challenges")
@RequiredArgsConstructor
public class ChallengeController {

    private final ChallengeService challengeService;

    @GetMapping("/active")
    public ActiveChallengesView listActive(CallerIdentity caller,
                                           @RequestParam(required = false) String type,
                                           @RequestParam(required = false) Long userId,
                                           @RequestParam(defaultValue = "false") boolean includeCompleted) {
        if (userId != null) {
            caller.requireAccessTo(userId);
        }
        return challengeService.listActiveChallenges(type, userId, includeCompleted);
    }

    @GetMapping("/progress/{userId}")
    public ChallengeProgressView getProgress(CallerIdentity caller,
                                             @PathVariable Long userId,
                                             @RequestParam(required = false) Long challengeId,
                                             @RequestParam(required = false) String status) {
        caller.requireAccessTo(userId);
        return challengeService.getChallengeProgress(userId, challengeId, status);
    }

    @PostMapping("/start")
    public ChallengeProgressSnapshot start(CallerIdentity caller, @Valid @RequestBody ChallengeActionRequest request) {
        caller.requireAccessTo(request.userId());
        return challengeService.startChallenge(request.userId(), request.challengeId());
    }

    /** 累加進度（僅限內部服務，例如訂單或評價事件） */
    @PostMapping("/progress")
    public ChallengeProgressSnapshot recordProgress(CallerIdentity caller,
                                                    @Valid @RequestBody ChallengeActionRequest request) {
        caller.requireInternal();
        if (request.amount() == null) {
            throw new ValidationException("amount 為必填欄位");
        }
        return challengeService.recordProgress(request.userId(), request.challengeId(), request.amount());
    }

    @PostMapping("/complete")
    public ChallengeCompletionResult complete(CallerIdentity caller,
                                              @Valid @RequestBody ChallengeActionRequest request) {
        caller.requireAccessTo(request.userId());
        boolean force = Boolean.TRUE.equals(request.autoComplete());
        if (force) {
            caller.requireInternal();
        }
        return challengeService.completeChallenge(request.userId(), request.challengeId(), force);
    }
}
