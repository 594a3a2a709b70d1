package com.scopeguard.core.audit;

import com.scopeguard.core.decision.AuthorizationDecision;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * 决策审计 (异步非阻塞)
 */
@Slf4j
public class DecisionAuditor {

    private final boolean enabled;

    public DecisionAuditor(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 记录一次决策。关闭时直接返回已完成的 future。
     */
    public CompletableFuture<Void> record(AuthorizationDecision decision) {
        if (!enabled || decision == null) {
            return CompletableFuture.completedFuture(null);
        }
        // 异步写日志，不阻塞决策线程
        return CompletableFuture.runAsync(() -> {
            try {
                log.info("[AUDIT] Principal={}, Scope={}, Result={}, Reason={}, MatchedBy={}, FailedCondition={}",
                        decision.getPrincipalId(), decision.scope(), decision.isAllowed() ? "ALLOWED" : "DENIED",
                        decision.getReason(), decision.getMatchedBy(), decision.getFailedCondition());
            } catch (Exception e) {
                log.warn("Audit log failed", e);
            }
        });
    }
}
