package com.scopeguard.core.config;

import com.scopeguard.api.exception.InvalidArgumentException;
import com.scopeguard.api.security.Permission;
import com.scopeguard.api.security.Role;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对应角色定义文件的根节点
 *
 * <pre>
 * roles:
 *   - name: invoice-approver
 *     description: Approves invoices
 *     permissions:
 *       - resource: invoice
 *         action: approve
 *         conditions:
 *           owner: true
 * </pre>
 */
@Getter
@Setter
public class RoleDefinitions {

    private List<RoleDefinition> roles = new ArrayList<>();

    @Getter
    @Setter
    public static class RoleDefinition {
        private String name;
        private String description;
        private List<PermissionDefinition> permissions = new ArrayList<>();

        public Role toRole() {
            List<Permission> converted = new ArrayList<>();
            if (permissions != null) {
                for (PermissionDefinition definition : permissions) {
                    if (definition == null) {
                        throw new InvalidArgumentException("permissions", "Role " + name + " contains an empty permission entry");
                    }
                    converted.add(definition.toPermission());
                }
            }
            return new Role(name, description, converted);
        }
    }

    @Getter
    @Setter
    public static class PermissionDefinition {
        private String resource;
        private String action;
        // 原始条件，构造 Permission 时解析
        private Map<String, Object> conditions = new LinkedHashMap<>();

        public Permission toPermission() {
            return Permission.of(resource, action, conditions);
        }
    }
}
