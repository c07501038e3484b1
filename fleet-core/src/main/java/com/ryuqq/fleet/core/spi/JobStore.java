package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.model.InstanceId;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobId;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent storage SPI for jobs and their per-node instances.
 *
 * <p>This store is the single serialization point for job execution. Correctness of
 * claiming, retrying and expiry rests on two primitives:</p>
 * <ul>
 *   <li><strong>Unique insert:</strong> {@link #createInstanceIfAbsent(JobInstance)} enforces
 *       at most one instance per (job_id, node_id)</li>
 *   <li><strong>Compare-and-set:</strong> {@link #compareAndSet(JobInstance)} persists a
 *       transition only if nobody else changed the row since it was read</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe and safe for concurrent use from multiple processes</li>
 *   <li>No long-held locks; losers of a race observe an empty result, not an exception</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface JobStore {

    /**
     * Inserts or replaces a job definition.
     *
     * <p>Jobs are immutable after creation except for cancellation, which is idempotent.</p>
     *
     * @param job the job
     * @throws IllegalArgumentException if job is null
     */
    void saveJob(Job job);

    /**
     * @param jobId the job id
     * @return the job, or empty if unknown
     * @throws IllegalArgumentException if jobId is null
     */
    Optional<Job> findJob(JobId jobId);

    /**
     * Inserts the instance unless one already exists for its (job_id, node_id).
     *
     * <pre>
     * INSERT INTO job_instances (...) VALUES (...)
     * ON CONFLICT (job_id, node_id) DO NOTHING;
     * </pre>
     *
     * @param instance the new instance (version 0)
     * @return the stored instance: the inserted one, or the one that already existed
     * @throws IllegalArgumentException if instance is null
     */
    JobInstance createInstanceIfAbsent(JobInstance instance);

    /**
     * @param instanceId the instance id
     * @return the instance, or empty if unknown
     * @throws IllegalArgumentException if instanceId is null
     */
    Optional<JobInstance> findInstance(InstanceId instanceId);

    /**
     * @param jobId the job id
     * @return all instances of the job ordered by node id (may be empty)
     * @throws IllegalArgumentException if jobId is null
     */
    List<JobInstance> findInstancesByJob(JobId jobId);

    /**
     * Finds the instances of one node in the given state.
     *
     * @param nodeId the node id
     * @param state the state to filter on
     * @return matching instances, oldest first (may be empty)
     * @throws IllegalArgumentException if any argument is null
     */
    List<JobInstance> findInstancesByNode(NodeId nodeId, JobInstanceState state);

    /**
     * Scans pending instances whose job may be dispatched now.
     *
     * <p>The job filter is part of the scan so that rows of a job scheduled far in the future
     * never occupy the batch ahead of rows that are due.</p>
     *
     * <pre>
     * SELECT i.* FROM job_instances i
     * JOIN jobs j ON j.job_id = i.job_id
     * WHERE i.status = 'pending'
     *   AND (j.scheduled_at IS NULL OR j.scheduled_at &lt;= ?)
     *   AND j.cancelled_at IS NULL
     *   AND (j.expires_at IS NULL OR j.expires_at &gt;= ?)
     * ORDER BY i.created_at ASC
     * LIMIT ?;
     * </pre>
     *
     * @param now the current time
     * @param batchSize maximum number of instances to return
     * @return dispatchable instances, oldest first (may be empty)
     * @throws IllegalArgumentException if now is null or batchSize is not positive
     */
    List<JobInstance> scanDispatchable(Instant now, int batchSize);

    /**
     * Scans pending or queued instances whose job passed its {@code expiresAt}.
     *
     * <pre>
     * SELECT i.* FROM job_instances i
     * JOIN jobs j ON j.job_id = i.job_id
     * WHERE i.status IN ('pending', 'queued')
     *   AND j.expires_at &lt; ?
     * ORDER BY i.created_at ASC
     * LIMIT ?;
     * </pre>
     *
     * @param now the current time
     * @param batchSize maximum number of instances to return
     * @return instances that never started in time, oldest first (may be empty)
     * @throws IllegalArgumentException if now is null or batchSize is not positive
     */
    List<JobInstance> scanExpirable(Instant now, int batchSize);

    /**
     * Scans running instances that reported nothing within the job timeout plus a grace period.
     *
     * <pre>
     * SELECT i.* FROM job_instances i
     * JOIN jobs j ON j.job_id = i.job_id
     * WHERE i.status = 'running'
     *   AND i.started_at + (j.timeout_seconds * interval '1 second') + ? &lt; ?
     * ORDER BY i.started_at ASC
     * LIMIT ?;
     * </pre>
     *
     * @param now the current time
     * @param graceMs extra time allowed after the timeout (milliseconds, non-negative)
     * @param batchSize maximum number of instances to return
     * @return timed-out instances, earliest start first (may be empty)
     * @throws IllegalArgumentException if now is null, graceMs is negative or batchSize is not positive
     */
    List<JobInstance> scanRunningTimedOut(Instant now, long graceMs, int batchSize);

    /**
     * Scans failed instances whose scheduled retry is due.
     *
     * <pre>
     * SELECT * FROM job_instances
     * WHERE status = 'failed' AND next_retry_at &lt;= ?
     * ORDER BY next_retry_at ASC
     * LIMIT ?;
     * </pre>
     *
     * @param now the current time
     * @param batchSize maximum number of instances to return
     * @return due retries, earliest first (may be empty)
     * @throws IllegalArgumentException if now is null or batchSize is not positive
     */
    List<JobInstance> scanRetryDue(Instant now, int batchSize);

    /**
     * Persists {@code updated} if the stored version equals {@code updated.version()}.
     *
     * <pre>
     * UPDATE job_instances SET ..., version = version + 1
     * WHERE instance_id = ? AND version = ?;
     * </pre>
     *
     * @param updated the new state carrying the version it was derived from
     * @return the stored instance with its incremented version, or empty if the version did not match
     * @throws IllegalArgumentException if updated is null
     * @throws IllegalStateException if the instance does not exist
     */
    Optional<JobInstance> compareAndSet(JobInstance updated);
}
