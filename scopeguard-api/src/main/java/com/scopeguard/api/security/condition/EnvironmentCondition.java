package com.scopeguard.api.security.condition;

/**
 * 环境条件，null 表示不限制；保留原始值，求值时严格相等比较
 */
public record EnvironmentCondition(Object environment) implements Condition {

    @Override
    public ConditionType type() {
        return ConditionType.ENVIRONMENT;
    }
}
