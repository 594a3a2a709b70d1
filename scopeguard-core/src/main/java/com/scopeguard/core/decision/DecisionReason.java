package com.scopeguard.core.decision;

/**
 * 决策原因
 */
public enum DecisionReason {

    /** 持有精确作用域 resource.action */
    DIRECT_SCOPE,

    /** 持有 resource.* */
    WILDCARD_SCOPE,

    /** 持有 admin 或 *.admin */
    ADMIN_SCOPE,

    /** 某个推导角色授予了该权限 */
    ROLE_GRANT,

    /** 基础权限成立且全部条件满足 */
    CONDITIONS_SATISFIED,

    NO_MATCH,

    /** 主体缺失 */
    MISSING_PRINCIPAL,

    /** 权限带条件但调用方未提供上下文 */
    MISSING_CONTEXT,

    CONDITION_FAILED,

    /** 求值过程中发生内部错误 */
    EVALUATION_ERROR
}
