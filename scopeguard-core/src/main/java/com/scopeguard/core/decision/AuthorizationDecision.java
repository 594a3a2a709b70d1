package com.scopeguard.core.decision;

import com.scopeguard.api.security.condition.ConditionType;
import lombok.Builder;
import lombok.Value;

/**
 * 鉴权决策结果
 * <p>
 * 对外的布尔接口只是它的投影；这里保留命中来源与拒绝原因，便于日志与审计。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class AuthorizationDecision {

    boolean allowed;
    DecisionReason reason;
    String principalId;
    String resource;
    String action;

    /**
     * 命中的作用域或角色名
     */
    String matchedBy;

    /**
     * 第一个不满足的条件类型，仅 CONDITION_FAILED 时有值
     */
    ConditionType failedCondition;

    public static AuthorizationDecision allow(DecisionReason reason, String principalId, String resource,
                                              String action, String matchedBy) {
        return AuthorizationDecision.builder()
                .allowed(true)
                .reason(reason)
                .principalId(principalId)
                .resource(resource)
                .action(action)
                .matchedBy(matchedBy)
                .build();
    }

    public static AuthorizationDecision deny(DecisionReason reason, String principalId, String resource,
                                             String action) {
        return AuthorizationDecision.builder()
                .allowed(false)
                .reason(reason)
                .principalId(principalId)
                .resource(resource)
                .action(action)
                .build();
    }

    public String scope() {
        return resource + "." + action;
    }
}
