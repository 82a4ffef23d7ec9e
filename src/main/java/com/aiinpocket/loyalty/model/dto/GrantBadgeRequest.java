package com.aiinpocket.loyalty.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record GrantBadgeRequest(
        @NotNull @Positive Long userId,
        @NotNull @Positive Long badgeId,
        @Size(max = 255) String reason
) {}
