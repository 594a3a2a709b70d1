package com.scopeguard.api.security.condition;

/**
 * 未识别的条件，保留原始键值，求值时忽略
 */
public record UnknownCondition(String key, Object value) implements Condition {

    @Override
    public ConditionType type() {
        return ConditionType.UNKNOWN;
    }
}
