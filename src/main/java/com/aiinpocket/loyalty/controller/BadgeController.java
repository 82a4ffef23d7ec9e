package com.aiinpocket.loyalty.controller;

import com.aiinpocket.loyalty.exception.ConflictException;
import com.aiinpocket.loyalty.model.dto.BadgeCatalogView;
import com.aiinpocket.loyalty.model.dto.BadgeGrantResult;
import com.aiinpocket.loyalty.model.dto.GrantBadgeRequest;
import com.aiinpocket.loyalty.model.dto.UserBadgesView;
import com.aiinpocket.loyalty.security.CallerIdentity;
import com.aiinpocket.loyalty.service.BadgeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/gamification/badges")
@RequiredArgsConstructor
public class BadgeController {

    private final BadgeService badgeService;

    @GetMapping
    public BadgeCatalogView listBadges(CallerIdentity caller,
                                       @RequestParam(required = false) String category,
                                       @RequestParam(required = false) Long userId,
                                       @RequestParam(defaultValue = "true") boolean includeEarned) {
        if (userId != null) {
            caller.requireAccessTo(userId);
        }
        return badgeService.listBadges(category, userId, includeEarned);
    }

    @GetMapping("/users/{userId}")
    public UserBadgesView getUserBadges(CallerIdentity caller, @PathVariable Long userId) {
        caller.requireAccessTo(userId);
        return badgeService.getUserBadges(userId);
    }

    /** 授予徽章（僅限內部服務）。已擁有時回應 409，不會重複發放積分。 */
    @PostMapping("/grant")
    public BadgeGrantResult grantBadge(CallerIdentity caller, @Valid @RequestBody GrantBadgeRequest request) {
        caller.requireInternal();
        BadgeGrantResult result = badgeService.grantBadge(request.userId(), request.badgeId(), request.reason());
        if (!result.newlyGranted()) {
            throw new ConflictException("使用者已擁有此徽章");
        }
        return result;
    }
}
