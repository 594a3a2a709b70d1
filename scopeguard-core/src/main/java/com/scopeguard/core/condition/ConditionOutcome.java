package com.scopeguard.core.condition;

import com.scopeguard.api.security.condition.Condition;

/**
 * 条件求值结果
 *
 * @param passed          全部条件是否满足
 * @param failedCondition 第一个不满足的条件，满足时为 null
 */
public record ConditionOutcome(boolean passed, Condition failedCondition) {

    private static final ConditionOutcome SATISFIED = new ConditionOutcome(true, null);

    public static ConditionOutcome satisfied() {
        return SATISFIED;
    }

    public static ConditionOutcome failed(Condition condition) {
        return new ConditionOutcome(false, condition);
    }
}
