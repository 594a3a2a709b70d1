package com.scopeguard.core.audit;

import com.scopeguard.core.decision.AuthorizationDecision;
import com.scopeguard.core.decision.DecisionReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DecisionAuditor 测试")
class DecisionAuditorTest {

    private final AuthorizationDecision decision =
            AuthorizationDecision.deny(DecisionReason.NO_MATCH, "u1", "odata", "write");

    @Test
    @DisplayName("关闭时立即完成")
    void disabledShouldCompleteImmediately() {
        CompletableFuture<Void> future = new DecisionAuditor(false).record(decision);

        assertTrue(future.isDone());
    }

    @Test
    @DisplayName("开启时异步记录且不抛异常")
    void enabledShouldRecordAsynchronously() {
        DecisionAuditor auditor = new DecisionAuditor(true);

        assertTrue(auditor.isEnabled());
        assertDoesNotThrow(() -> auditor.record(decision).get(5, TimeUnit.SECONDS));
        assertDoesNotThrow(() -> auditor.record(null).get(5, TimeUnit.SECONDS));
        assertEquals("odata.write", decision.scope());
    }
}
