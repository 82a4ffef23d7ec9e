package com.aiinpocket.loyalty.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record AddPointsRequest(
        @NotNull @Positive Long userId,
        @NotNull @Positive Integer points,
        @NotBlank String pointsType,
        @Size(max = 255) String description,
        @Positive Long orderId
) {}
