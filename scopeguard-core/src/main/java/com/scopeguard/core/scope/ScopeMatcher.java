package com.scopeguard.core.scope;

import java.util.Collection;
import java.util.List;

/**
 * 作用域匹配
 * <p>
 * 规则不对称：只有主体持有的 "xxx.*" 会展开；要求方给出的通配符只做字面匹配。
 * </p>
 */
public final class ScopeMatcher {

    private ScopeMatcher() {
    }

    public static boolean matchesAny(List<String> heldScopes, Collection<String> requiredScopes) {
        if (requiredScopes == null) {
            return false;
        }
        for (String required : requiredScopes) {
            if (matches(heldScopes, required)) {
                return true;
            }
        }
        return false;
    }

    public static boolean matches(List<String> heldScopes, String requiredScope) {
        if (requiredScope == null) {
            return false;
        }
        if (heldScopes.contains(requiredScope)) {
            return true;
        }
        String requiredPrefix = ScopeParser.prefixOf(requiredScope);
        if (requiredPrefix == null) {
            return false;
        }
        for (String held : heldScopes) {
            // "odata.*" -> "odata."
            if (held.endsWith(ScopeParser.WILDCARD_SUFFIX)
                    && requiredPrefix.equals(held.substring(0, held.length() - 1))) {
                return true;
            }
        }
        return false;
    }
}
