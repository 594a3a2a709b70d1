package com.scopeguard.core.registry;

import com.scopeguard.api.security.Permission;
import com.scopeguard.api.security.Role;
import com.scopeguard.core.spi.RoleRegistry;

import java.util.List;

/**
 * 内置角色定义，引擎构造时写入注册表
 */
public final class BuiltinRoles {

    public static final String ADMIN = "admin";
    public static final String ODATA_USER = "odata-user";
    public static final String MCP_USER = "mcp-user";
    public static final String READONLY = "readonly";

    private BuiltinRoles() {
    }

    public static List<Role> defaults() {
        return List.of(
                Role.of(ADMIN, "Administrator with full system access",
                        Permission.of(Permission.WILDCARD, Permission.WILDCARD)),
                Role.of(ODATA_USER, "User with access to OData services",
                        Permission.of("odata", "read"),
                        Permission.of("odata", "discover"),
                        Permission.of("service", "discover")),
                Role.of(MCP_USER, "User with access to MCP tools",
                        Permission.of("mcp", "read"),
                        Permission.of("mcp", "write"),
                        Permission.of("tools", "execute")),
                Role.of(READONLY, "Read-only access to resources",
                        Permission.of(Permission.WILDCARD, "read"),
                        Permission.of(Permission.WILDCARD, "discover")));
    }

    public static void seed(RoleRegistry registry) {
        defaults().forEach(registry::register);
    }
}
