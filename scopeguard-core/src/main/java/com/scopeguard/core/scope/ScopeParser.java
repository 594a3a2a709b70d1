package com.scopeguard.core.scope;

import com.scopeguard.api.security.Permission;

import java.util.Optional;

/**
 * 作用域字符串与权限值之间的转换
 * <p>
 * 作用域以 "." 分层，最后一段为 action，其余部分为 resource，
 * 例如 "odata.entity.read" -> (odata.entity, read)。
 * </p>
 */
public final class ScopeParser {

    public static final char SEPARATOR = '.';
    public static final String WILDCARD_SUFFIX = ".*";

    private ScopeParser() {
    }

    public static String buildScope(String resource, String action) {
        return resource + SEPARATOR + action;
    }

    public static String wildcardScope(String resource) {
        return resource + WILDCARD_SUFFIX;
    }

    /**
     * 将作用域分解为权限。不含 "." 或任一段为空的作用域返回 empty。
     * <p>
     * "odata." 与 ".read" 也被丢弃：{@link Permission} 不接受空的资源或动作。
     * </p>
     */
    public static Optional<Permission> toPermission(String scope) {
        if (scope == null) {
            return Optional.empty();
        }
        int lastDot = scope.lastIndexOf(SEPARATOR);
        if (lastDot <= 0 || lastDot == scope.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(Permission.of(scope.substring(0, lastDot), scope.substring(lastDot + 1)));
    }

    /**
     * 截取到最后一个 "." 为止（含），无 "." 时返回 null
     */
    public static String prefixOf(String scope) {
        int lastDot = scope.lastIndexOf(SEPARATOR);
        return lastDot < 0 ? null : scope.substring(0, lastDot + 1);
    }
}
