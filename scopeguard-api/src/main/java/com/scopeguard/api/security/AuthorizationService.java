package com.scopeguard.api.security;

import com.scopeguard.api.exception.PermissionDeniedException;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Core 提供 - 鉴权决策服务
 * <p>
 * 根据主体的作用域与用户组声明判断其能否对资源执行动作。
 * 所有查询方法都是失败即拒绝（fail-closed）：缺少上下文、内部异常一律返回 false / 空集合，从不向调用方抛出。
 * </p>
 *
 * @author ScopeGuard
 */
public interface AuthorizationService {

    /**
     * 检查主体是否有权对资源执行动作。
     *
     * @param principal 主体
     * @param resource  资源，例如 "odata"
     * @param action    动作，例如 "read"
     * @return 允许返回 true，否则（包括内部错误）返回 false
     */
    boolean hasPermission(Principal principal, String resource, String action);

    /**
     * 获取主体的全部权限（作用域直接推导 + 角色授予），按 (resource, action) 去重，保持先后顺序
     */
    List<Permission> getPermissions(Principal principal);

    /**
     * 获取主体的角色，按名称去重
     */
    List<Role> getRoles(Principal principal);

    boolean hasRole(Principal principal, String roleName);

    /**
     * 检查主体是否持有指定作用域。
     * 持有的 "xxx.*" 可覆盖同前缀的作用域；要求方的通配符不会展开。
     */
    boolean hasScope(Principal principal, String scope);

    /**
     * 任一作用域满足即返回 true
     */
    boolean hasScope(Principal principal, Collection<String> scopes);

    /**
     * 评估带条件的权限
     *
     * @param principal  主体
     * @param permission 权限（可带条件）
     * @param context    运行期上下文，如 userId、clientIp、environment；可为 null
     * @return 基础权限成立且全部条件满足时返回 true
     */
    boolean evaluatePermission(Principal principal, Permission permission, Map<String, ?> context);

    default boolean evaluatePermission(Principal principal, Permission permission) {
        return evaluatePermission(principal, permission, null);
    }

    /**
     * 强制校验，不满足时抛出 {@link PermissionDeniedException}
     */
    default void requirePermission(Principal principal, String resource, String action) {
        if (!hasPermission(principal, resource, action)) {
            throw new PermissionDeniedException(principal == null ? null : principal.id(), resource, action);
        }
    }

    /**
     * 注册或覆盖同名角色
     */
    void addRole(Role role);

    /**
     * 移除角色
     *
     * @return 确实移除了角色时返回 true
     */
    boolean removeRole(String roleName);

    List<Role> getAllRoles();
}
