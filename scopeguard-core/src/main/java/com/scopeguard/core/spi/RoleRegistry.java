package com.scopeguard.core.spi;

import com.scopeguard.api.security.Role;

import java.util.List;
import java.util.Optional;

/**
 * SPI: 角色注册表
 * <p>
 * 维护角色名到权限集合的映射，是引擎中唯一可变的共享状态。
 * 实现必须保证并发读写安全：读方不能观察到部分更新的角色。
 * 变更操作不抛异常，未命中通过返回值表达。
 * </p>
 */
public interface RoleRegistry {

    /**
     * 按名称注册或覆盖角色
     */
    void register(Role role);

    /**
     * @return 确实移除了角色时返回 true
     */
    boolean unregister(String roleName);

    Optional<Role> lookup(String roleName);

    /**
     * 所有角色的不可变快照，按注册顺序
     */
    List<Role> list();

    default boolean contains(String roleName) {
        return lookup(roleName).isPresent();
    }

    default int size() {
        return list().size();
    }
}
