package com.scopeguard.api.security.condition;

/**
 * 归属条件
 *
 * @param required 为 true 时要求上下文中的 userId 等于主体 ID
 */
public record OwnerCondition(boolean required) implements Condition {

    @Override
    public ConditionType type() {
        return ConditionType.OWNER;
    }
}
