package com.scopeguard.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 引擎配置
 * <p>
 * 可通过 Builder 编程构建，也可由 {@link ScopeGuardConfigLoader} 从 scopeguard.yml 加载。
 * </p>
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScopeGuardConfig {

    /**
     * 内置的用户组到角色映射（组名小写）
     */
    public static final Map<String, String> DEFAULT_GROUP_ROLE_MAPPINGS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("administrators", "admin");
        defaults.put("odata-users", "odata-user");
        defaults.put("mcp-users", "mcp-user");
        defaults.put("readonly-users", "readonly");
        DEFAULT_GROUP_ROLE_MAPPINGS = Collections.unmodifiableMap(defaults);
    }

    /**
     * 构造时是否写入内置角色 (admin / odata-user / mcp-user / readonly)
     */
    @Builder.Default
    private boolean seedBuiltinRoles = true;

    /**
     * 是否对每次决策记录审计日志
     */
    @Builder.Default
    private boolean auditEnabled = false;

    /**
     * 额外的用户组到角色映射，与内置映射合并，同名时覆盖
     */
    @Builder.Default
    private Map<String, String> groupRoleMappings = new LinkedHashMap<>();

    /**
     * 角色定义文件位置，支持 "classpath:" 前缀或文件路径；为空则不加载
     */
    private String roleDefinitionsLocation;

    public static ScopeGuardConfig defaults() {
        return ScopeGuardConfig.builder().build();
    }

    /**
     * 合并后的用户组映射，键统一转为小写
     */
    public Map<String, String> effectiveGroupRoleMappings() {
        Map<String, String> merged = new LinkedHashMap<>(DEFAULT_GROUP_ROLE_MAPPINGS);
        if (groupRoleMappings != null) {
            groupRoleMappings.forEach((group, role) -> {
                if (group != null && role != null) {
                    merged.put(group.toLowerCase(Locale.ROOT), role);
                }
            });
        }
        return Collections.unmodifiableMap(merged);
    }
}
