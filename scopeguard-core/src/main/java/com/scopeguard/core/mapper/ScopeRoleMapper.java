package com.scopeguard.core.mapper;

import com.scopeguard.api.security.Principal;
import com.scopeguard.api.security.Role;
import com.scopeguard.core.registry.BuiltinRoles;
import com.scopeguard.core.spi.RoleRegistry;
import com.scopeguard.core.util.Deduplicator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 将作用域与用户组声明映射为角色
 * <p>
 * 两条路径相互独立：作用域按规则顺序匹配（先命中者生效），用户组按表查找（忽略大小写）。
 * 映射出的角色名若不在注册表中则忽略。
 * </p>
 */
public class ScopeRoleMapper {

    private static final String ADMIN_MARKER = "admin";
    private static final String ODATA_PREFIX = "odata.";
    private static final String MCP_PREFIX = "mcp.";

    private final RoleRegistry registry;
    private final Map<String, String> groupRoleMappings;

    public ScopeRoleMapper(RoleRegistry registry, Map<String, String> groupRoleMappings) {
        this.registry = registry;
        this.groupRoleMappings = Map.copyOf(groupRoleMappings);
    }

    /**
     * 作用域对应的角色名
     */
    public static Optional<String> roleNameForScope(String scope) {
        if (scope.contains(ADMIN_MARKER)) {
            return Optional.of(BuiltinRoles.ADMIN);
        }
        if (scope.startsWith(ODATA_PREFIX)) {
            return Optional.of(BuiltinRoles.ODATA_USER);
        }
        if (scope.startsWith(MCP_PREFIX)) {
            return Optional.of(BuiltinRoles.MCP_USER);
        }
        return Optional.empty();
    }

    public Optional<String> roleNameForGroup(String group) {
        return Optional.ofNullable(groupRoleMappings.get(group.toLowerCase(Locale.ROOT)));
    }

    /**
     * 解析主体角色：作用域路径在前，用户组路径在后，按名称去重
     */
    public List<Role> resolveRoles(Principal principal) {
        List<Role> roles = new ArrayList<>();
        for (String scope : principal.scopes()) {
            roleNameForScope(scope).flatMap(registry::lookup).ifPresent(roles::add);
        }
        for (String group : principal.groups()) {
            roleNameForGroup(group).flatMap(registry::lookup).ifPresent(roles::add);
        }
        return Deduplicator.distinctBy(roles, Role::getName);
    }
}
