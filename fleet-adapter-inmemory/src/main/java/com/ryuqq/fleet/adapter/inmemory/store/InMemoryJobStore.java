package com.ryuqq.fleet.adapter.inmemory.store;

import com.ryuqq.fleet.core.model.InstanceId;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobId;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.spi.JobStore;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link JobStore} for tests and single-process use.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>jobs:</strong> ConcurrentHashMap&lt;JobId, Job&gt;</li>
 *   <li><strong>instances:</strong> ConcurrentHashMap&lt;InstanceId, JobInstance&gt;</li>
 *   <li><strong>uniqueIndex:</strong> ConcurrentHashMap&lt;(JobId, NodeId), InstanceId&gt; - the
 *       (job_id, node_id) unique constraint</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> the unique insert uses {@code computeIfAbsent} on the index and
 * compare-and-set uses {@code computeIfPresent} on the instance map, both of which are atomic
 * per key.</p>
 *
 * <p><strong>Scans:</strong> the job-dependent scans look the job up per instance, the way the
 * SQL variant joins on job_id. Scans are linear and data is lost on restart.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<JobId, Job> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<InstanceId, JobInstance> instances = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UniqueKey, InstanceId> uniqueIndex = new ConcurrentHashMap<>();

    @Override
    public void saveJob(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        jobs.put(job.jobId(), job);
    }

    @Override
    public Optional<Job> findJob(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public JobInstance createInstanceIfAbsent(JobInstance instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        InstanceId storedId = uniqueIndex.computeIfAbsent(
            new UniqueKey(instance.jobId(), instance.nodeId()),
            key -> {
                instances.put(instance.instanceId(), instance);
                return instance.instanceId();
            }
        );
        return instances.get(storedId);
    }

    @Override
    public Optional<JobInstance> findInstance(InstanceId instanceId) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public List<JobInstance> findInstancesByJob(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        return instances.values().stream()
            .filter(instance -> instance.jobId().equals(jobId))
            .sorted(Comparator.comparing(JobInstance::nodeId))
            .collect(Collectors.toList());
    }

    @Override
    public List<JobInstance> findInstancesByNode(NodeId nodeId, JobInstanceState state) {
        if (nodeId == null || state == null) {
            throw new IllegalArgumentException("nodeId and state cannot be null");
        }
        return instances.values().stream()
            .filter(instance -> instance.nodeId().equals(nodeId) && instance.state() == state)
            .sorted(Comparator.comparing(JobInstance::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<JobInstance> scanDispatchable(Instant now, int batchSize) {
        requireNow(now);
        requirePositive(batchSize);
        return instances.values().stream()
            .filter(instance -> instance.state() == JobInstanceState.PENDING)
            .filter(instance -> jobMatches(instance, job -> job.isDue(now) && !job.isCancelled() && !job.isExpired(now)))
            .sorted(Comparator.comparing(JobInstance::createdAt))
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    @Override
    public List<JobInstance> scanExpirable(Instant now, int batchSize) {
        requireNow(now);
        requirePositive(batchSize);
        return instances.values().stream()
            .filter(instance -> instance.state() == JobInstanceState.PENDING || instance.state() == JobInstanceState.QUEUED)
            .filter(instance -> jobMatches(instance, job -> job.isExpired(now)))
            .sorted(Comparator.comparing(JobInstance::createdAt))
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    @Override
    public List<JobInstance> scanRunningTimedOut(Instant now, long graceMs, int batchSize) {
        requireNow(now);
        if (graceMs < 0) {
            throw new IllegalArgumentException("graceMs must be non-negative (current: " + graceMs + ")");
        }
        requirePositive(batchSize);
        return instances.values().stream()
            .filter(instance -> instance.state() == JobInstanceState.RUNNING && instance.startedAt() != null)
            .filter(instance -> jobMatches(instance, job -> now.isAfter(
                instance.startedAt().plusSeconds(job.timeoutSeconds()).plusMillis(graceMs))))
            .sorted(Comparator.comparing(JobInstance::startedAt))
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    @Override
    public List<JobInstance> scanRetryDue(Instant now, int batchSize) {
        requireNow(now);
        requirePositive(batchSize);
        return instances.values().stream()
            .filter(instance -> instance.isRetryDue(now))
            .sorted(Comparator.comparing(JobInstance::nextRetryAt))
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<JobInstance> compareAndSet(JobInstance updated) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        AtomicReference<JobInstance> written = new AtomicReference<>();
        JobInstance result = instances.computeIfPresent(updated.instanceId(), (id, current) -> {
            if (current.version() != updated.version()) {
                return current;
            }
            JobInstance next = updated.withVersion(current.version() + 1);
            written.set(next);
            return next;
        });
        if (result == null) {
            throw new IllegalStateException("Job instance not found: " + updated.instanceId());
        }
        return Optional.ofNullable(written.get());
    }

    private boolean jobMatches(JobInstance instance, Predicate<Job> condition) {
        Job job = jobs.get(instance.jobId());
        return job != null && condition.test(job);
    }

    private static void requireNow(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
    }

    private static void requirePositive(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
    }

    private record UniqueKey(JobId jobId, NodeId nodeId) {
    }
}
