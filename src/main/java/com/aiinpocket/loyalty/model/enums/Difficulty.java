package com.aiinpocket.loyalty.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Difficulty {

    EASY,
    MEDIUM,
    HARD;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
