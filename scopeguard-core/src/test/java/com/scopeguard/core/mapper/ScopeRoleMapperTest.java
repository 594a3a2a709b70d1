package com.scopeguard.core.mapper;

import com.scopeguard.api.security.Principal;
import com.scopeguard.api.security.Role;
import com.scopeguard.core.config.ScopeGuardConfig;
import com.scopeguard.core.registry.BuiltinRoles;
import com.scopeguard.core.registry.InMemoryRoleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScopeRoleMapper 测试")
class ScopeRoleMapperTest {

    private InMemoryRoleRegistry registry;
    private ScopeRoleMapper mapper;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRoleRegistry();
        BuiltinRoles.seed(registry);
        mapper = new ScopeRoleMapper(registry, ScopeGuardConfig.DEFAULT_GROUP_ROLE_MAPPINGS);
    }

    private List<String> roleNames(Principal principal) {
        return mapper.resolveRoles(principal).stream().map(Role::getName).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("作用域映射")
    class ScopeMappingTests {

        @Test
        @DisplayName("包含 admin 的作用域优先映射为 admin")
        void adminSubstringShouldWinFirst() {
            assertEquals(Optional.of("admin"), ScopeRoleMapper.roleNameForScope("odata.admin"));
            assertEquals(Optional.of("admin"), ScopeRoleMapper.roleNameForScope("sysadmin"));
        }

        @Test
        @DisplayName("odata. 与 mcp. 前缀")
        void servicePrefixes() {
            assertEquals(Optional.of("odata-user"), ScopeRoleMapper.roleNameForScope("odata.read"));
            assertEquals(Optional.of("mcp-user"), ScopeRoleMapper.roleNameForScope("mcp.write"));
            assertEquals(Optional.empty(), ScopeRoleMapper.roleNameForScope("odata"));
            assertEquals(Optional.empty(), ScopeRoleMapper.roleNameForScope("invoice.approve"));
        }
    }

    @Nested
    @DisplayName("用户组映射")
    class GroupMappingTests {

        @Test
        @DisplayName("组名忽略大小写")
        void groupLookupShouldIgnoreCase() {
            assertEquals(Optional.of("admin"), mapper.roleNameForGroup("Administrators"));
            assertEquals(Optional.of("readonly"), mapper.roleNameForGroup("READONLY-USERS"));
            assertEquals(Optional.empty(), mapper.roleNameForGroup("guests"));
        }

        @Test
        @DisplayName("配置的额外映射应合并生效")
        void configuredMappingsShouldMerge() {
            ScopeGuardConfig config = ScopeGuardConfig.builder().build();
            config.getGroupRoleMappings().put("Support", "readonly");
            ScopeRoleMapper custom = new ScopeRoleMapper(registry, config.effectiveGroupRoleMappings());

            assertEquals(Optional.of("readonly"), custom.roleNameForGroup("support"));
            assertEquals(Optional.of("admin"), custom.roleNameForGroup("administrators"));
        }
    }

    @Nested
    @DisplayName("角色解析")
    class ResolveTests {

        @Test
        @DisplayName("作用域角色在前，用户组角色在后，按名称去重")
        void shouldOrderAndDeduplicate() {
            Principal principal = Principal.of("u1",
                    List.of("mcp.read", "odata.read", "mcp.write", "plain"),
                    List.of("ODATA-USERS", "readonly-users", "unknown"));

            assertEquals(List.of("mcp-user", "odata-user", "readonly"), roleNames(principal));
        }

        @Test
        @DisplayName("注册表中不存在的角色被忽略")
        void missingRolesShouldBeSkipped() {
            registry.unregister("mcp-user");

            assertEquals(List.of(), roleNames(Principal.of("u1", List.of("mcp.read"), List.of("mcp-users"))));
        }

        @Test
        @DisplayName("无声明时返回空")
        void emptyClaims() {
            assertTrue(mapper.resolveRoles(new Principal("u1", null, null)).isEmpty());
        }
    }
}
