package com.scopeguard.api.exception;

/**
 * 权限拒绝异常
 * 当调用方通过 requirePermission 强制校验且主体不具备所需权限时抛出。
 *
 * @author ScopeGuard
 */
public class PermissionDeniedException extends ScopeGuardException {

    private final String principalId;
    private final String resource;
    private final String action;

    public PermissionDeniedException(String principalId, String resource, String action) {
        super(String.format("Access denied: principal=%s, resource=%s, action=%s",
                principalId, resource, action));
        this.principalId = principalId;
        this.resource = resource;
        this.action = action;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getResource() {
        return resource;
    }

    public String getAction() {
        return action;
    }

    /**
     * 被拒绝的作用域字符串形式，如 "odata.read"
     */
    public String getRequiredScope() {
        return resource + "." + action;
    }
}
