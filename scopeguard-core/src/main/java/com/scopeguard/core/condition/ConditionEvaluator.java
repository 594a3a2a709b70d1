package com.scopeguard.core.condition;

import com.scopeguard.api.security.Principal;
import com.scopeguard.api.security.condition.Condition;
import com.scopeguard.api.security.condition.EnvironmentCondition;
import com.scopeguard.api.security.condition.IpAllowlistCondition;
import com.scopeguard.api.security.condition.OwnerCondition;
import com.scopeguard.api.security.condition.TimeRangeCondition;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.scopeguard.api.security.condition.Conditions.isTruthy;

/**
 * 条件求值器
 * <p>
 * 条件之间为 AND 关系，任一失败即拒绝；未识别的条件忽略。
 * </p>
 */
@Slf4j
public class ConditionEvaluator {

    public static final String CONTEXT_USER_ID = "userId";
    public static final String CONTEXT_CLIENT_IP = "clientIp";
    public static final String CONTEXT_ENVIRONMENT = "environment";

    private final Clock clock;

    public ConditionEvaluator(Clock clock) {
        this.clock = clock;
    }

    public ConditionOutcome evaluate(List<Condition> conditions, Map<String, ?> context, Principal principal) {
        for (Condition condition : conditions) {
            if (!passes(condition, context, principal)) {
                log.debug("[Condition] {} failed for principal {}", condition, principal.id());
                return ConditionOutcome.failed(condition);
            }
        }
        return ConditionOutcome.satisfied();
    }

    private boolean passes(Condition condition, Map<String, ?> context, Principal principal) {
        return switch (condition.type()) {
            case OWNER -> passesOwner((OwnerCondition) condition, context.get(CONTEXT_USER_ID), principal);
            case TIME_RANGE -> ((TimeRangeCondition) condition).contains(clock.instant());
            case IP_ALLOWLIST -> passesIpAllowlist((IpAllowlistCondition) condition, context.get(CONTEXT_CLIENT_IP));
            case ENVIRONMENT -> passesEnvironment((EnvironmentCondition) condition, context.get(CONTEXT_ENVIRONMENT));
            case UNKNOWN -> {
                log.debug("[Condition] Ignoring unrecognized condition: {}", condition.key());
                yield true;
            }
        };
    }

    private boolean passesOwner(OwnerCondition condition, Object userId, Principal principal) {
        if (!condition.required() || !isTruthy(userId)) {
            return true;
        }
        return Objects.equals(userId, principal.id());
    }

    private boolean passesIpAllowlist(IpAllowlistCondition condition, Object clientIp) {
        if (!condition.isRestricted() || !isTruthy(clientIp)) {
            return true;
        }
        return clientIp instanceof String && condition.allowedIps().contains(clientIp);
    }

    private boolean passesEnvironment(EnvironmentCondition condition, Object environment) {
        if (condition.environment() == null || !isTruthy(environment)) {
            return true;
        }
        return Objects.equals(condition.environment(), environment);
    }
}
