package com.ryuqq.fleet.core.outcome;

import com.ryuqq.fleet.core.model.InstanceId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome Sealed Interface 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_CarriesInstanceId() {
        InstanceId instanceId = InstanceId.newId();

        Outcome outcome = Ok.of(instanceId);

        assertTrue(outcome instanceof Ok);
        assertEquals(instanceId, ((Ok) outcome).instanceId());
    }

    @Test
    void retry_CarriesAttemptAndDelay() {
        Outcome outcome = new Retry("exit code 1", 1, 60_000);

        assertTrue(outcome instanceof Retry);
        assertEquals(1, ((Retry) outcome).attemptCount());
        assertEquals(60_000, ((Retry) outcome).nextRetryAfterMillis());
    }

    @Test
    void fail_CarriesErrorCode() {
        Outcome outcome = Fail.of(Fail.EXEC_FAILED, "exit code 2");

        assertTrue(outcome instanceof Fail);
        assertEquals(Fail.EXEC_FAILED, ((Fail) outcome).errorCode());
        assertNull(((Fail) outcome).cause());
    }

    @Test
    void instanceofChain_ExtractsData() {
        // Given
        Outcome outcome = new Retry("exit code 1", 2, 120_000);

        // When
        long delay = outcome instanceof Retry retry ? retry.nextRetryAfterMillis() : -1;

        // Then
        assertEquals(120_000, delay);
    }

    @Test
    void invalidArguments_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new Ok(null, "done"));
        assertThrows(IllegalArgumentException.class, () -> new Retry(" ", 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Retry("timeout", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Retry("timeout", 1, -1));
        assertThrows(IllegalArgumentException.class, () -> Fail.of("", "message"));
        assertThrows(IllegalArgumentException.class, () -> Fail.of(Fail.EXEC_FAILED, null));
    }
}
