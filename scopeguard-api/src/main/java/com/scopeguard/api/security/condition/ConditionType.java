package com.scopeguard.api.security.condition;

/**
 * 条件类型枚举
 * <p>
 * 条件集合是封闭的：每个已知键对应一个类型，其余键一律归入 {@link #UNKNOWN}。
 * 新增条件类型时，求值器中的 switch 必须同步覆盖。
 * </p>
 *
 * @author ScopeGuard
 */
public enum ConditionType {

    /**
     * 资源归属：上下文中的 userId 必须与主体一致
     */
    OWNER("owner"),

    /**
     * 生效时间窗口，边界值本身允许
     */
    TIME_RANGE("timeRange"),

    /**
     * 客户端 IP 白名单
     */
    IP_ALLOWLIST("allowedIps"),

    /**
     * 运行环境（区分大小写，不支持通配）
     */
    ENVIRONMENT("environment"),

    /**
     * 未识别的条件键，求值时忽略
     */
    UNKNOWN(null);

    private final String key;

    ConditionType(String key) {
        this.key = key;
    }

    /**
     * 条件在原始 Map 形式中的键名，UNKNOWN 返回 null
     */
    public String getKey() {
        return key;
    }

    public static ConditionType fromKey(String key) {
        for (ConditionType type : values()) {
            if (type.key != null && type.key.equals(key)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
