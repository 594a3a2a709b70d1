package com.scopeguard.core.registry;

import com.scopeguard.api.security.Role;
import com.scopeguard.core.spi.RoleRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 基于内存的角色注册表
 * <p>
 * 使用读写锁保护有序 Map：同一时刻只有一个写者，读者总是看到完整一致的快照。
 * 覆盖同名角色时保留其原有位置。
 * </p>
 */
@Slf4j
public class InMemoryRoleRegistry implements RoleRegistry {

    private final Map<String, Role> roles = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void register(Role role) {
        if (role == null) {
            log.warn("[Registry] Ignoring null role registration");
            return;
        }
        lock.writeLock().lock();
        try {
            Role previous = roles.put(role.getName(), role);
            if (previous != null) {
                log.debug("[Registry] Role overwritten: {}", role.getName());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean unregister(String roleName) {
        if (roleName == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            return roles.remove(roleName) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Role> lookup(String roleName) {
        if (roleName == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(roles.get(roleName));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Role> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(roles.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return roles.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
