package com.aiinpocket.loyalty.controller;

import com.aiinpocket.loyalty.model.dto.LevelListView;
import com.aiinpocket.loyalty.model.dto.UserLevelView;
import com.aiinpocket.loyalty.security.CallerIdentity;
import com.aiinpocket.loyalty.service.LevelService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/gamification/levels")
@RequiredArgsConstructor
public class LevelController {

    private final LevelService levelService;

    @GetMapping
    public LevelListView listLevels(CallerIdentity caller,
                                    @RequestParam(required = false) Long userId,
                                    @RequestParam(defaultValue = "false") boolean includeStats) {
        if (userId != null) {
            caller.requireAccessTo(userId);
        }
        return levelService.listLevels(userId, includeStats);
    }

    @GetMapping("/{userId}")
    public UserLevelView getUserLevel(CallerIdentity caller, @PathVariable Long userId) {
        caller.requireAccessTo(userId);
        return levelService.getUserLevel(userId);
    }
}
