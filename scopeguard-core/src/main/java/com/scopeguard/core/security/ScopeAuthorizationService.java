package com.scopeguard.core.security;

import com.scopeguard.api.security.AuthorizationService;
import com.scopeguard.api.security.Permission;
import com.scopeguard.api.security.Principal;
import com.scopeguard.api.security.Role;
import com.scopeguard.core.audit.DecisionAuditor;
import com.scopeguard.core.condition.ConditionEvaluator;
import com.scopeguard.core.condition.ConditionOutcome;
import com.scopeguard.core.config.RoleDefinitionLoader;
import com.scopeguard.core.config.ScopeGuardConfig;
import com.scopeguard.core.decision.AuthorizationDecision;
import com.scopeguard.core.decision.DecisionReason;
import com.scopeguard.core.mapper.ScopeRoleMapper;
import com.scopeguard.core.registry.BuiltinRoles;
import com.scopeguard.core.registry.InMemoryRoleRegistry;
import com.scopeguard.core.scope.ScopeMatcher;
import com.scopeguard.core.scope.ScopeParser;
import com.scopeguard.core.spi.RoleRegistry;
import com.scopeguard.core.util.Deduplicator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 基于作用域与角色的鉴权服务
 * 职责：组合作用域直配、通配作用域、管理员放行与角色授予四条路径给出决策，
 * 并对带条件的权限做上下文求值。
 * <p>
 * 所有查询失败即拒绝：内部异常被捕获、记录并转为 false / 空集合。
 * </p>
 */
@Slf4j
public class ScopeAuthorizationService implements AuthorizationService {

    // 管理员作用域，持有即放行任意资源与动作
    static final String ADMIN_SCOPE = "admin";
    static final String GLOBAL_ADMIN_SCOPE = "*.admin";

    private final RoleRegistry registry;
    private final ScopeRoleMapper roleMapper;
    private final ConditionEvaluator conditionEvaluator;
    private final DecisionAuditor auditor;

    public ScopeAuthorizationService() {
        this(ScopeGuardConfig.defaults());
    }

    public ScopeAuthorizationService(ScopeGuardConfig config) {
        this(config, new InMemoryRoleRegistry(), Clock.systemUTC());
    }

    public ScopeAuthorizationService(ScopeGuardConfig config, RoleRegistry registry, Clock clock) {
        this.registry = registry;
        this.roleMapper = new ScopeRoleMapper(registry, config.effectiveGroupRoleMappings());
        this.conditionEvaluator = new ConditionEvaluator(clock);
        this.auditor = new DecisionAuditor(config.isAuditEnabled());

        if (config.isSeedBuiltinRoles()) {
            BuiltinRoles.seed(registry);
        }
        if (config.getRoleDefinitionsLocation() != null && !config.getRoleDefinitionsLocation().isBlank()) {
            RoleDefinitionLoader.load(config.getRoleDefinitionsLocation()).forEach(registry::register);
        }
        log.info("ScopeAuthorizationService initialized with {} roles", registry.size());
    }

    @Override
    public boolean hasPermission(Principal principal, String resource, String action) {
        return checkPermission(principal, resource, action).isAllowed();
    }

    /**
     * 与 {@link #hasPermission} 相同的判定，返回带原因的决策
     */
    public AuthorizationDecision checkPermission(Principal principal, String resource, String action) {
        AuthorizationDecision decision = decide(principal, resource, action);
        auditor.record(decision);
        return decision;
    }

    private AuthorizationDecision decide(Principal principal, String resource, String action) {
        if (principal == null) {
            return AuthorizationDecision.deny(DecisionReason.MISSING_PRINCIPAL, null, resource, action);
        }
        try {
            List<String> scopes = principal.scopes();

            String requiredScope = ScopeParser.buildScope(resource, action);
            if (scopes.contains(requiredScope)) {
                return AuthorizationDecision.allow(DecisionReason.DIRECT_SCOPE, principal.id(), resource, action,
                        requiredScope);
            }

            String wildcardScope = ScopeParser.wildcardScope(resource);
            if (scopes.contains(wildcardScope)) {
                return AuthorizationDecision.allow(DecisionReason.WILDCARD_SCOPE, principal.id(), resource, action,
                        wildcardScope);
            }

            if (scopes.contains(ADMIN_SCOPE) || scopes.contains(GLOBAL_ADMIN_SCOPE)) {
                String adminScope = scopes.contains(ADMIN_SCOPE) ? ADMIN_SCOPE : GLOBAL_ADMIN_SCOPE;
                return AuthorizationDecision.allow(DecisionReason.ADMIN_SCOPE, principal.id(), resource, action,
                        adminScope);
            }

            for (Role role : roleMapper.resolveRoles(principal)) {
                if (role.grants(resource, action)) {
                    return AuthorizationDecision.allow(DecisionReason.ROLE_GRANT, principal.id(), resource, action,
                            role.getName());
                }
            }

            log.debug("[Authz] Permission denied for principal {}: {} (scopes: {})",
                    principal.id(), requiredScope, String.join(", ", scopes));
            return AuthorizationDecision.deny(DecisionReason.NO_MATCH, principal.id(), resource, action);
        } catch (RuntimeException e) {
            log.error("[Authz] Error checking permission {}.{} for principal {}", resource, action, principal.id(), e);
            return AuthorizationDecision.deny(DecisionReason.EVALUATION_ERROR, principal.id(), resource, action);
        }
    }

    @Override
    public List<Permission> getPermissions(Principal principal) {
        if (principal == null) {
            return Collections.emptyList();
        }
        try {
            List<Permission> permissions = new ArrayList<>();
            for (String scope : principal.scopes()) {
                ScopeParser.toPermission(scope).ifPresent(permissions::add);
            }
            for (Role role : roleMapper.resolveRoles(principal)) {
                permissions.addAll(role.getPermissions());
            }
            return Deduplicator.distinctBy(permissions, Permission::key);
        } catch (RuntimeException e) {
            log.error("[Authz] Error collecting permissions for principal {}", principal.id(), e);
            return Collections.emptyList();
        }
    }

    @Override
    public List<Role> getRoles(Principal principal) {
        if (principal == null) {
            return Collections.emptyList();
        }
        try {
            return roleMapper.resolveRoles(principal);
        } catch (RuntimeException e) {
            log.error("[Authz] Error resolving roles for principal {}", principal.id(), e);
            return Collections.emptyList();
        }
    }

    @Override
    public boolean hasRole(Principal principal, String roleName) {
        return getRoles(principal).stream().anyMatch(role -> role.getName().equals(roleName));
    }

    @Override
    public boolean hasScope(Principal principal, String scope) {
        return hasScope(principal, Collections.singletonList(scope));
    }

    @Override
    public boolean hasScope(Principal principal, Collection<String> scopes) {
        if (principal == null) {
            return false;
        }
        try {
            return ScopeMatcher.matchesAny(principal.scopes(), scopes);
        } catch (RuntimeException e) {
            log.error("[Authz] Error checking scopes {} for principal {}", scopes, principal.id(), e);
            return false;
        }
    }

    @Override
    public boolean evaluatePermission(Principal principal, Permission permission, Map<String, ?> context) {
        return explainPermission(principal, permission, context).isAllowed();
    }

    /**
     * 与 {@link #evaluatePermission} 相同的判定，返回带原因的决策
     */
    public AuthorizationDecision explainPermission(Principal principal, Permission permission, Map<String, ?> context) {
        if (permission == null) {
            log.warn("[Authz] Cannot evaluate null permission");
            return AuthorizationDecision.deny(DecisionReason.EVALUATION_ERROR,
                    principal == null ? null : principal.id(), null, null);
        }
        AuthorizationDecision decision = decideConditional(principal, permission, context);
        auditor.record(decision);
        return decision;
    }

    private AuthorizationDecision decideConditional(Principal principal, Permission permission, Map<String, ?> context) {
        AuthorizationDecision base = decide(principal, permission.getResource(), permission.getAction());
        if (!base.isAllowed() || !permission.hasConditions()) {
            return base;
        }
        if (context == null) {
            log.debug("[Authz] Conditional permission {} requested without context -> deny", permission.key());
            return base.toBuilder().allowed(false).reason(DecisionReason.MISSING_CONTEXT).build();
        }
        try {
            ConditionOutcome outcome = conditionEvaluator.evaluate(permission.getConditions(), context, principal);
            if (!outcome.passed()) {
                return base.toBuilder()
                        .allowed(false)
                        .reason(DecisionReason.CONDITION_FAILED)
                        .failedCondition(outcome.failedCondition().type())
                        .build();
            }
            return base.toBuilder().reason(DecisionReason.CONDITIONS_SATISFIED).build();
        } catch (RuntimeException e) {
            log.error("[Authz] Error evaluating conditions of {} for principal {}", permission, principal.id(), e);
            return base.toBuilder().allowed(false).reason(DecisionReason.EVALUATION_ERROR).build();
        }
    }

    @Override
    public void addRole(Role role) {
        if (role == null) {
            log.warn("[Authz] Ignoring null role");
            return;
        }
        try {
            registry.register(role);
            log.info("[Authz] Added custom role: {}", role.getName());
        } catch (RuntimeException e) {
            log.error("[Authz] Failed to add role {}", role.getName(), e);
        }
    }

    @Override
    public boolean removeRole(String roleName) {
        try {
            boolean removed = registry.unregister(roleName);
            if (removed) {
                log.info("[Authz] Removed role: {}", roleName);
            }
            return removed;
        } catch (RuntimeException e) {
            log.error("[Authz] Failed to remove role {}", roleName, e);
            return false;
        }
    }

    @Override
    public List<Role> getAllRoles() {
        try {
            return registry.list();
        } catch (RuntimeException e) {
            log.error("[Authz] Failed to list roles", e);
            return Collections.emptyList();
        }
    }
}
