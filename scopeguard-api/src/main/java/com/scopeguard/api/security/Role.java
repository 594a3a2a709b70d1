package com.scopeguard.api.security;

import com.scopeguard.api.exception.InvalidArgumentException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 角色：具名的权限集合
 * <p>
 * 权限按 (resource, action) 去重，先出现者保留。
 * </p>
 *
 * @author ScopeGuard
 */
@Value
public class Role {

    String name;
    String description;
    List<Permission> permissions;

    @Builder
    public Role(String name, String description, @Singular List<Permission> permissions) {
        if (name == null || name.isEmpty()) {
            throw new InvalidArgumentException("name", name, "Role name cannot be empty");
        }
        this.name = name;
        this.description = description == null ? "" : description;
        this.permissions = permissions == null ? List.of() : List.copyOf(new LinkedHashSet<>(permissions));
    }

    public static Role of(String name, String description, Permission... permissions) {
        return new Role(name, description, Arrays.asList(permissions));
    }

    /**
     * 角色是否授予 resource 上的 action。
     * resource 必须精确相等，action 精确相等或为 "*"。
     */
    public boolean grants(String resource, String action) {
        for (Permission permission : permissions) {
            if (permission.getResource().equals(resource)
                    && (permission.getAction().equals(action) || Permission.WILDCARD.equals(permission.getAction()))) {
                return true;
            }
        }
        return false;
    }
}
