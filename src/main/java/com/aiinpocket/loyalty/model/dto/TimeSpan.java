package com.aiinpocket.loyalty.model.dto;

import java.time.Duration;

/**
 * 時間長度的顯示格式（總毫秒 + 天／時／分拆解）。
 */
public record TimeSpan(long milliseconds, long days, long hours, long minutes) {

    public static TimeSpan of(Duration duration) {
        Duration d = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        return new TimeSpan(d.toMillis(), d.toDays(), d.toHoursPart(), d.toMinutesPart());
    }
}
