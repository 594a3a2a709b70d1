package com.scopeguard.api.security.condition;

import java.time.Instant;

/**
 * 时间窗口条件
 * <p>
 * start / end 为 null 表示该侧不设边界。
 * wellFormed 为 false 表示原始值无法解析为时间，求值时直接拒绝。
 * </p>
 */
public record TimeRangeCondition(Instant start, Instant end, boolean wellFormed) implements Condition {

    public static TimeRangeCondition between(Instant start, Instant end) {
        return new TimeRangeCondition(start, end, true);
    }

    public static TimeRangeCondition unbounded() {
        return new TimeRangeCondition(null, null, true);
    }

    public static TimeRangeCondition malformed() {
        return new TimeRangeCondition(null, null, false);
    }

    /**
     * 判断给定时刻是否落在窗口内（含边界）
     */
    public boolean contains(Instant now) {
        if (!wellFormed) {
            return false;
        }
        if (start != null && now.isBefore(start)) {
            return false;
        }
        return end == null || !now.isAfter(end);
    }

    @Override
    public ConditionType type() {
        return ConditionType.TIME_RANGE;
    }
}
