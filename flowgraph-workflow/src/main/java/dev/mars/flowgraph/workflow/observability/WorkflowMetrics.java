/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowgraph.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry instruments for workflow runs and their nodes.
 * <ul>
 *   <li>{@code flowgraph.runs.active} (gauge): runs started and not yet finished or detached</li>
 *   <li>{@code flowgraph.runs.started}, {@code .succeeded}, {@code .failed}, {@code .cancelled} (counters,
 *       by workflow id; failures also by error kind)</li>
 *   <li>{@code flowgraph.run.duration} (histogram, seconds): finished runs</li>
 *   <li>{@code flowgraph.nodes.dispatched}, {@code .failed}, {@code .retried} (counters, by node kind)</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "flowgraph-workflow";

    private static final AttributeKey<String> WORKFLOW_ID = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> NODE_KIND = AttributeKey.stringKey("node.kind");
    private static final AttributeKey<String> ERROR_KIND = AttributeKey.stringKey("error.kind");

    private static WorkflowMetrics global;

    private final LongCounter runsStarted;
    private final LongCounter runsSucceeded;
    private final LongCounter runsFailed;
    private final LongCounter runsCancelled;
    private final DoubleHistogram runDuration;
    private final LongCounter nodesDispatched;
    private final LongCounter nodesFailed;
    private final LongCounter nodesRetried;
    private final AtomicLong activeRuns = new AtomicLong();

    public WorkflowMetrics(Meter meter) {
        runsStarted = counter(meter, "flowgraph.runs.started", "Workflow runs started");
        runsSucceeded = counter(meter, "flowgraph.runs.succeeded", "Workflow runs that reached an END node");
        runsFailed = counter(meter, "flowgraph.runs.failed", "Workflow runs that failed");
        runsCancelled = counter(meter, "flowgraph.runs.cancelled", "Workflow runs cancelled by a caller");
        nodesDispatched = counter(meter, "flowgraph.nodes.dispatched", "Node attempts dispatched");
        nodesFailed = counter(meter, "flowgraph.nodes.failed", "Node attempts that failed");
        nodesRetried = counter(meter, "flowgraph.nodes.retried", "Node retries scheduled after a failed attempt");
        runDuration = meter.histogramBuilder("flowgraph.run.duration")
                .setDescription("Wall-clock time from start to the terminal status of a run")
                .setUnit("s")
                .build();
        meter.gaugeBuilder("flowgraph.runs.active")
                .setDescription("Workflow runs currently in progress on this engine")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));
    }

    /**
     * Instruments registered on the global OpenTelemetry meter provider, shared by every engine.
     */
    public static synchronized WorkflowMetrics global() {
        if (global == null) {
            global = new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
            logger.info("Workflow metrics registered on meter " + METER_NAME);
        }
        return global;
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name).setDescription(description).setUnit("1").build();
    }

    public void recordRunStarted(String workflowId) {
        activeRuns.incrementAndGet();
        runsStarted.add(1, Attributes.of(WORKFLOW_ID, workflowId));
    }

    public void recordRunSucceeded(String workflowId, double durationSeconds) {
        activeRuns.decrementAndGet();
        Attributes workflow = Attributes.of(WORKFLOW_ID, workflowId);
        runsSucceeded.add(1, workflow);
        runDuration.record(durationSeconds, workflow);
    }

    public void recordRunFailed(String workflowId, String errorKind, double durationSeconds) {
        activeRuns.decrementAndGet();
        runsFailed.add(1, Attributes.of(WORKFLOW_ID, workflowId, ERROR_KIND, orUnknown(errorKind)));
        runDuration.record(durationSeconds, Attributes.of(WORKFLOW_ID, workflowId));
    }

    public void recordRunCancelled(String workflowId) {
        activeRuns.decrementAndGet();
        runsCancelled.add(1, Attributes.of(WORKFLOW_ID, workflowId));
    }

    /**
     * A run left unfinished at engine shutdown leaves the gauge without counting an outcome.
     */
    public void recordRunDetached(String workflowId) {
        activeRuns.decrementAndGet();
        logger.fine("Run of workflow " + workflowId + " detached at shutdown");
    }

    public void recordNodeDispatched(String workflowId, String nodeKind) {
        nodesDispatched.add(1, Attributes.of(WORKFLOW_ID, workflowId, NODE_KIND, nodeKind));
    }

    public void recordNodeFailed(String workflowId, String nodeKind, String errorKind) {
        nodesFailed.add(1, Attributes.of(WORKFLOW_ID, workflowId, NODE_KIND, nodeKind, ERROR_KIND, orUnknown(errorKind)));
    }

    public void recordNodeRetried(String workflowId, String nodeKind) {
        nodesRetried.add(1, Attributes.of(WORKFLOW_ID, workflowId, NODE_KIND, nodeKind));
    }

    public long getActiveRuns() {
        return activeRuns.get();
    }

    private static String orUnknown(String errorKind) {
        return errorKind != null ? errorKind : "unknown";
    }
}
