/**
 * Intent to work items.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fleet.application.dispatch.TargetResolver} - selector to node set</li>
 *   <li>{@link com.ryuqq.fleet.application.dispatch.WorkItemFactory} - one row per (parent, node)</li>
 *   <li>{@link com.ryuqq.fleet.application.dispatch.JobService} - submit and cancel jobs</li>
 *   <li>{@link com.ryuqq.fleet.application.dispatch.DeploymentService} - create, cancel, pause, resume deployments</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.application.dispatch;
