package com.scopeguard.api.security.condition;

import java.util.List;

/**
 * IP 白名单条件
 *
 * @param allowedIps 允许的客户端 IP；null 表示不限制，空列表表示拒绝任何已知 IP
 */
public record IpAllowlistCondition(List<String> allowedIps) implements Condition {

    public IpAllowlistCondition {
        allowedIps = allowedIps == null ? null : List.copyOf(allowedIps);
    }

    public boolean isRestricted() {
        return allowedIps != null;
    }

    @Override
    public ConditionType type() {
        return ConditionType.IP_ALLOWLIST;
    }
}
