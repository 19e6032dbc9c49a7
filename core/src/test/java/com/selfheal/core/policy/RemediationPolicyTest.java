package com.selfheal.core.policy;

import com.selfheal.core.model.RemediationAction;
import com.selfheal.core.model.RemediationDecision;
import com.selfheal.core.model.WorkloadSnapshot;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RemediationPolicyTest {

    private final RemediationPolicy policy = new RemediationPolicy();

    // ========== Memory ==========

    @Test
    void testUnsetLimitStartsFrom256() {
        RemediationDecision decision = policy.incrementMemory(Optional.empty());

        assertEquals(RemediationAction.INCREMENT_MEMORY, decision.getAction());
        assertEquals("256Mi", decision.getPreviousValue());
        assertEquals("320Mi", decision.getNewValue());
        assertEquals(320, decision.getNewMemoryMebibytes());
    }

    @Test
    void testLimitGrowsByQuarterAndKeepsOriginalNotation() {
        RemediationDecision decision = policy.incrementMemory(Optional.of("1Gi"));

        assertEquals("1Gi", decision.getPreviousValue());
        assertEquals("1280Mi", decision.getNewValue());
    }

    @Test
    void testGrowthIsFloored() {
        // 100 * 1.25 = 125, 101 * 1.25 = 126.25
        assertEquals(125, policy.incrementMemory(Optional.of("100Mi")).getNewMemoryMebibytes());
        assertEquals(126, policy.incrementMemory(Optional.of("101Mi")).getNewMemoryMebibytes());
    }

    @Test
    void testUnparseableLimitIsTreatedAs256() {
        RemediationDecision decision = policy.incrementMemory(Optional.of("lots"));

        assertEquals("lots", decision.getPreviousValue());
        assertEquals("320Mi", decision.getNewValue());
    }

    @Test
    void testMemoryAlwaysGrowsStrictly() {
        for (long current : new long[]{0, 1, 2, 3, 4, 7, 256, 1000, 65536}) {
            long next = RemediationPolicy.nextMemoryMebibytes(current);
            long afterThat = RemediationPolicy.nextMemoryMebibytes(next);

            assertTrue(next > current, "expected growth from " + current + ", got " + next);
            assertTrue(afterThat > next, "expected growth from " + next + ", got " + afterThat);
        }
    }

    @Test
    void testSubMebibyteLimitStillGrows() {
        // 512Ki parses to 0Mi
        assertEquals("1Mi", policy.incrementMemory(Optional.of("512Ki")).getNewValue());
    }

    // ========== Replicas ==========

    @Test
    void testScaleOutBoundaries() {
        assertEquals(2, policy.scaleOut(0).getNewReplicas());
        assertEquals(2, policy.scaleOut(1).getNewReplicas());
        assertEquals(3, policy.scaleOut(2).getNewReplicas());
        assertEquals(4, policy.scaleOut(3).getNewReplicas());
        assertEquals(6, policy.scaleOut(5).getNewReplicas());
    }

    @Test
    void testUnsetReplicasCountAsOne() {
        RemediationDecision decision = policy.scaleOut(null);

        assertEquals("1", decision.getPreviousValue());
        assertEquals("2", decision.getNewValue());
        assertEquals(2, decision.getNewReplicas());
    }

    // ========== Dispatch ==========

    @Test
    void testDecideUsesSnapshot() {
        WorkloadSnapshot snapshot = WorkloadSnapshot.builder()
            .namespace("prod")
            .name("api")
            .resourceVersion("7")
            .containerName("api")
            .memoryLimit("512Mi")
            .replicas(4)
            .build();

        assertEquals("640Mi", policy.decide(RemediationAction.INCREMENT_MEMORY, snapshot).getNewValue());
        assertEquals(5, policy.decide(RemediationAction.SCALE_OUT, snapshot).getNewReplicas());
    }

    @Test
    void testSameSnapshotSameDecision() {
        WorkloadSnapshot snapshot = WorkloadSnapshot.builder().name("web").replicas(2).build();

        assertEquals(policy.decide(RemediationAction.SCALE_OUT, snapshot),
            policy.decide(RemediationAction.SCALE_OUT, snapshot));
    }

    @Test
    void testReplicaCountSaturatesAtIntMax() {
        assertEquals(Integer.MAX_VALUE, RemediationPolicy.nextReplicas(Integer.MAX_VALUE));
        assertEquals(Integer.MAX_VALUE, RemediationPolicy.nextReplicas(Integer.MAX_VALUE - 1));
        assertEquals("2147483647", policy.scaleOut(Integer.MAX_VALUE).getNewValue());
    }
}
