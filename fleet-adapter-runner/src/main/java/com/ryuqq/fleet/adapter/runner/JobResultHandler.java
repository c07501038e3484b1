package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.gateway.JobResultReport;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.outcome.Fail;
import com.ryuqq.fleet.core.outcome.Ok;
import com.ryuqq.fleet.core.outcome.Outcome;
import com.ryuqq.fleet.core.outcome.Retry;

import java.time.Instant;

/**
 * Job 결과 보고의 분류와 인스턴스 반영 (재시도 정책).
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>exit code 0 → {@link Ok} → SUCCESS</li>
 *   <li>0이 아니고 attempt &lt; maxAttempts → {@link Retry} → FAILED + nextRetryAt</li>
 *   <li>0이 아니고 시도 소진 → {@link Fail} ({@value Fail#EXEC_FAILED}) → 최종 FAILED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JobResultHandler {

    private final BackoffCalculator backoffCalculator;

    public JobResultHandler(BackoffCalculator backoffCalculator) {
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 보고 분류.
     *
     * @param instance RUNNING 인스턴스
     * @param report 결과 보고
     * @return Ok, Retry, Fail 중 하나
     */
    public Outcome classify(JobInstance instance, JobResultReport report) {
        if (report.isSuccess()) {
            return Ok.of(instance.instanceId());
        }
        String reason = "exit code " + report.exitCode();
        if (instance.attempt() < instance.maxAttempts()) {
            return new Retry(reason, instance.attempt(), backoffCalculator.calculate(instance.attempt()));
        }
        return Fail.of(Fail.EXEC_FAILED, reason,
            "attempt " + instance.attempt() + " of " + instance.maxAttempts());
    }

    /**
     * 분류 결과를 인스턴스 전이로 변환.
     *
     * @param instance RUNNING 인스턴스
     * @param report 결과 보고
     * @param outcome {@link #classify} 결과
     * @param now 보고 시각
     * @return 전이된 인스턴스 (아직 저장 전)
     */
    public JobInstance apply(JobInstance instance, JobResultReport report, Outcome outcome, Instant now) {
        if (outcome instanceof Ok) {
            return instance.succeed(report.exitCode(), report.stdout(), report.stderr(), report.durationMs(), now);
        }
        if (outcome instanceof Retry retry) {
            return instance.fail(report.exitCode(), report.stdout(), report.stderr(), report.durationMs(),
                retry.reason(), now.plusMillis(retry.nextRetryAfterMillis()), now);
        }
        Fail fail = (Fail) outcome;
        return instance.fail(report.exitCode(), report.stdout(), report.stderr(), report.durationMs(),
            fail.errorCode() + ": " + fail.message(), null, now);
    }
}
