package com.scopeguard.api.security.condition;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 条件解析工具
 * <p>
 * 将调用方提供的原始 Map 形式（如 {@code {owner: true, allowedIps: [...]}}）
 * 一次性解析为强类型条件列表。未识别的键保留为 {@link UnknownCondition}。
 * </p>
 *
 * @author ScopeGuard
 */
public final class Conditions {

    private Conditions() {
    }

    /**
     * 解析条件 Map，保持键的迭代顺序
     *
     * @param raw 原始条件，可为 null
     * @return 不可变条件列表
     */
    public static List<Condition> parse(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }
        List<Condition> conditions = new ArrayList<>(raw.size());
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            conditions.add(parse(entry.getKey(), entry.getValue()));
        }
        return List.copyOf(conditions);
    }

    /**
     * 解析单个条件
     */
    public static Condition parse(String key, Object value) {
        return switch (ConditionType.fromKey(key)) {
            case OWNER -> new OwnerCondition(isTruthy(value));
            case TIME_RANGE -> parseTimeRange(value);
            case IP_ALLOWLIST -> new IpAllowlistCondition(isTruthy(value) ? toStringList(value) : null);
            case ENVIRONMENT -> new EnvironmentCondition(isTruthy(value) ? value : null);
            case UNKNOWN -> new UnknownCondition(key, value);
        };
    }

    /**
     * 真值判定：null、false、0、NaN 与空字符串为假，其余为真
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        return true;
    }

    /**
     * 将时间值解析为 Instant。支持 Instant、Date、毫秒时间戳和 ISO-8601 字符串。
     * 纯日期按 UTC 零点处理，不带偏移的日期时间按系统时区处理。
     */
    public static Optional<Instant> toInstant(Object value) {
        if (value instanceof Instant) {
            return Optional.of((Instant) value);
        }
        if (value instanceof Date) {
            return Optional.of(((Date) value).toInstant());
        }
        if (value instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) value).toInstant());
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochMilli(((Number) value).longValue()));
        }
        if (value instanceof CharSequence) {
            return parseText(value.toString().trim());
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseText(String text) {
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException ignored) {
            // 继续尝试其他格式
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // 继续尝试其他格式
        }
        try {
            return Optional.of(LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant());
        } catch (DateTimeParseException ignored) {
            // 继续尝试其他格式
        }
        try {
            return Optional.of(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static TimeRangeCondition parseTimeRange(Object value) {
        if (!isTruthy(value)) {
            return TimeRangeCondition.unbounded();
        }
        if (!(value instanceof Map)) {
            return TimeRangeCondition.malformed();
        }
        Map<?, ?> range = (Map<?, ?>) value;
        Object rawStart = range.get("start");
        Object rawEnd = range.get("end");

        Instant start = null;
        Instant end = null;
        if (rawStart != null) {
            Optional<Instant> parsed = toInstant(rawStart);
            if (parsed.isEmpty()) {
                return TimeRangeCondition.malformed();
            }
            start = parsed.get();
        }
        if (rawEnd != null) {
            Optional<Instant> parsed = toInstant(rawEnd);
            if (parsed.isEmpty()) {
                return TimeRangeCondition.malformed();
            }
            end = parsed.get();
        }
        return TimeRangeCondition.between(start, end);
    }

    private static List<String> toStringList(Object value) {
        if (value instanceof Collection) {
            List<String> result = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                if (element != null) {
                    result.add(String.valueOf(element));
                }
            }
            return result;
        }
        if (value instanceof Object[]) {
            List<String> result = new ArrayList<>();
            for (Object element : (Object[]) value) {
                if (element != null) {
                    result.add(String.valueOf(element));
                }
            }
            return result;
        }
        // 单值按单元素白名单处理
        return List.of(String.valueOf(value));
    }
}
