package com.scopeguard.api.security;

import com.scopeguard.api.exception.InvalidArgumentException;
import com.scopeguard.api.security.condition.Condition;
import com.scopeguard.api.security.condition.Conditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 原子权限：对某资源执行某动作的能力，可附带条件
 * <p>
 * 相等性只由 (resource, action) 精确决定（区分大小写），条件不参与比较。
 * "*" 仅在运行期作为通配符解释，不是独立的存储值。
 * </p>
 *
 * @author ScopeGuard
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Permission {

    /**
     * 通配符
     */
    public static final String WILDCARD = "*";

    @EqualsAndHashCode.Include
    private final String resource;

    @EqualsAndHashCode.Include
    private final String action;

    private final List<Condition> conditions;

    private Permission(String resource, String action, List<Condition> conditions) {
        if (resource == null || resource.isEmpty()) {
            throw new InvalidArgumentException("resource", resource, "Permission resource cannot be empty");
        }
        if (action == null || action.isEmpty()) {
            throw new InvalidArgumentException("action", action, "Permission action cannot be empty");
        }
        this.resource = resource;
        this.action = action;
        this.conditions = conditions == null ? Collections.emptyList() : List.copyOf(conditions);
    }

    public static Permission of(String resource, String action) {
        return new Permission(resource, action, null);
    }

    /**
     * 从原始条件 Map 构建，条件在此处一次性解析
     */
    public static Permission of(String resource, String action, Map<String, ?> conditions) {
        return new Permission(resource, action, Conditions.parse(conditions));
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }

    /**
     * 去重键，同时也是对应的作用域字符串，如 "odata.read"
     */
    public String key() {
        return resource + "." + action;
    }

    @Override
    public String toString() {
        return hasConditions() ? key() + conditions : key();
    }
}
