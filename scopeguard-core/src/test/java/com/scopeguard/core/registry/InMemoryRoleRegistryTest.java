package com.scopeguard.core.registry;

import com.scopeguard.api.security.Permission;
import com.scopeguard.api.security.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryRoleRegistry 测试")
class InMemoryRoleRegistryTest {

    private InMemoryRoleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRoleRegistry();
        BuiltinRoles.seed(registry);
    }

    @Nested
    @DisplayName("内置角色")
    class BuiltinTests {

        @Test
        @DisplayName("应按顺序包含四个内置角色")
        void shouldContainBuiltinRolesInOrder() {
            List<String> names = registry.list().stream().map(Role::getName).collect(Collectors.toList());

            assertEquals(List.of("admin", "odata-user", "mcp-user", "readonly"), names);
        }

        @Test
        @DisplayName("odata-user 应包含三项权限")
        void odataUserShouldHaveThreePermissions() {
            Role role = registry.lookup(BuiltinRoles.ODATA_USER).orElseThrow();

            assertEquals(List.of(Permission.of("odata", "read"), Permission.of("odata", "discover"),
                    Permission.of("service", "discover")), role.getPermissions());
        }
    }

    @Nested
    @DisplayName("注册与移除")
    class MutationTests {

        @Test
        @DisplayName("重复注册应覆盖且保留位置")
        void reRegisterShouldOverwriteInPlace() {
            Role replacement = Role.of("odata-user", "replaced", Permission.of("odata", "write"));
            registry.register(replacement);

            assertEquals(4, registry.size());
            assertSame(replacement, registry.list().get(1));
            assertEquals("replaced", registry.lookup("odata-user").orElseThrow().getDescription());
        }

        @Test
        @DisplayName("移除不存在的角色返回 false 且不改变内容")
        void unregisterUnknownShouldReturnFalse() {
            List<Role> before = registry.list();

            assertFalse(registry.unregister("nonexistent"));
            assertFalse(registry.unregister(null));
            assertEquals(before, registry.list());
        }

        @Test
        @DisplayName("移除存在的角色返回 true")
        void unregisterExistingShouldReturnTrue() {
            assertTrue(registry.unregister("readonly"));
            assertFalse(registry.contains("readonly"));
            assertFalse(registry.unregister("readonly"));
        }

        @Test
        @DisplayName("null 角色被忽略")
        void nullRoleShouldBeIgnored() {
            assertDoesNotThrow(() -> registry.register(null));
            assertEquals(4, registry.size());
        }

        @Test
        @DisplayName("快照不受后续修改影响")
        void snapshotShouldBeImmutable() {
            List<Role> snapshot = registry.list();
            registry.register(Role.of("custom", "custom role"));

            assertEquals(4, snapshot.size());
            assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Role.of("x", "x")));
        }
    }

    @Test
    @DisplayName("并发读写不应抛异常且读方总能看到完整角色")
    void concurrentReadWriteShouldBeSafe() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                final int writer = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        String name = "role-" + writer + "-" + (i % 10);
                        registry.register(Role.of(name, "r", Permission.of("res", "read"), Permission.of("res", "write")));
                        registry.unregister(name);
                    }
                    return null;
                }));
            }
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        for (Role role : registry.list()) {
                            assertNotNull(role.getName());
                            assertFalse(role.getPermissions().isEmpty());
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(4, registry.size());
    }
}
