package com.ryuqq.fleet.testkit;

import com.ryuqq.fleet.core.model.CommandPayload;
import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentMode;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.model.PackageReference;
import com.ryuqq.fleet.core.model.RolloutStrategy;
import com.ryuqq.fleet.core.model.StrategyConfig;
import com.ryuqq.fleet.core.model.TargetSelector;

import java.time.Instant;
import java.util.Map;

/**
 * Shared test data builders.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Fixtures {

    private Fixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static NodeId nodeId(String value) {
        return NodeId.of(value);
    }

    /**
     * Freshly registered, online node with a Windows inventory.
     */
    public static Node node(String id, Instant now) {
        return Node.register(NodeId.of(id), id + ".corp.local", Map.of(
            "os_name", "Windows 11 Pro",
            "os_version", "10.0.22631",
            "agent_version", "2.4.0",
            "domain", "corp.local"
        ), now);
    }

    public static CommandPayload shell(String script) {
        return CommandPayload.of("shell", "{\"script\":\"" + script + "\"}");
    }

    /**
     * Immediate job with default priority, timeout and a single attempt.
     */
    public static Job job(TargetSelector target, Instant now) {
        return Job.create("collect-inventory", target, shell("Get-ComputerInfo"), now);
    }

    public static PackageReference packageRef() {
        return new PackageReference("7zip", "23.01", "msi", "https://repo.corp.local/7zip-23.01.msi",
            "/qn", "/x /qn", "a1b2c3");
    }

    public static Deployment deployment(TargetSelector target, RolloutStrategy strategy, StrategyConfig config, Instant now) {
        return Deployment.create("7zip rollout", packageRef(), target, DeploymentMode.REQUIRED, strategy, config, now);
    }

    public static Deployment immediateDeployment(TargetSelector target, Instant now) {
        return deployment(target, RolloutStrategy.IMMEDIATE, null, now);
    }
}
