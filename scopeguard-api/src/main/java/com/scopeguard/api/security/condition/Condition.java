package com.scopeguard.api.security.condition;

/**
 * 权限条件
 * 附着在 {@link com.scopeguard.api.security.Permission} 上，多个条件之间为 AND 关系。
 *
 * @author ScopeGuard
 */
public interface Condition {

    ConditionType type();

    /**
     * 原始键名
     */
    default String key() {
        return type().getKey();
    }
}
