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

package dev.mars.flowgraph.workflow.engine;

import dev.mars.flowgraph.config.FlowgraphConfiguration;
import dev.mars.flowgraph.core.ErrorKind;
import dev.mars.flowgraph.workflow.BackoffShape;
import dev.mars.flowgraph.workflow.BranchFailurePolicy;
import dev.mars.flowgraph.workflow.InvalidDefinitionException;
import dev.mars.flowgraph.workflow.NodeKind;
import dev.mars.flowgraph.workflow.RetryPolicy;
import dev.mars.flowgraph.workflow.TransformOperation;
import dev.mars.flowgraph.workflow.WorkflowBuilder;
import dev.mars.flowgraph.workflow.WorkflowDefinition;
import dev.mars.flowgraph.workflow.WorkflowNode;
import dev.mars.flowgraph.workflow.observability.NodeTransitionEvent;
import dev.mars.flowgraph.workflow.store.InMemoryExecutionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for GraphWorkflowEngine, with the task executor and external service mocked.
 */
class GraphWorkflowEngineTest {

    @Mock
    private TaskExecutor taskExecutor;

    @Mock
    private ExternalService externalService;

    private FlowgraphConfiguration configuration;
    private InMemoryExecutionStore store;
    private GraphWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Properties properties = new Properties();
        properties.setProperty(FlowgraphConfiguration.METRICS_ENABLED, "false");
        properties.setProperty(FlowgraphConfiguration.SERVICE_TIMEOUT_MS, "5000");
        configuration = new FlowgraphConfiguration(properties);
        store = new InMemoryExecutionStore(configuration);
        engine = newEngine();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void testLinearWorkflowStoresOutput() throws Exception {
        when(taskExecutor.execute(any())).thenReturn("Hello Ada");
        WorkflowDefinition definition = WorkflowBuilder.create("greeting", "Greeting")
                .start("start")
                .agentExecute("greet", "Say hello to {{name}}")
                .end("end")
                .connect("start", "greet")
                .connect("greet", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-1", Map.of("name", "Ada"))));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("Hello Ada", execution.getVariable("greet_output"));
        assertEquals("end", execution.getCompletedBy().orElseThrow());
        assertTrue(execution.getFailures().isEmpty());
        assertTrue(execution.getEndTime().isPresent());

        ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
        verify(taskExecutor).execute(captor.capture());
        TaskRequest request = captor.getValue();
        assertEquals("Say hello to Ada", request.getConfigString("task"));
        assertEquals("run-1", request.getExecutionId());
        assertEquals(1, request.getAttempt());

        assertEquals(ExecutionStatus.SUCCEEDED, engine.getStatus("run-1"));
        assertEquals(execution, engine.getExecution("run-1").orElseThrow());
        assertNull(engine.getStatus("unknown"));
    }

    @Test
    void testConditionTakesFirstMatchingEdge() throws Exception {
        when(taskExecutor.execute(any())).thenReturn(Map.of("score", 9));

        WorkflowExecution execution = await(engine.execute(scoringWorkflow(), context("run-high", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(9, execution.getVariable("quality"));
        assertEquals("publish", execution.getCompletedBy().orElseThrow());
        assertEquals(NodeStatus.SKIPPED, execution.getNodeState("rework").getStatus());
        assertEquals("publish", execution.getNodeState("check").getOutput());
    }

    @Test
    void testConditionFallsBackToDefaultEdge() throws Exception {
        when(taskExecutor.execute(any())).thenReturn(Map.of("score", 3));

        WorkflowExecution execution = await(engine.execute(scoringWorkflow(), context("run-low", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("rework", execution.getCompletedBy().orElseThrow());
        assertEquals(NodeStatus.SKIPPED, execution.getNodeState("publish").getStatus());
    }

    @Test
    void testConditionWithoutMatchOrDefaultFails() throws Exception {
        WorkflowDefinition definition = WorkflowBuilder.create("strict", "Strict")
                .start("start")
                .condition("check")
                .end("end")
                .connect("start", "check")
                .connect("check", "end", "ready == true")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-nomatch", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals(ErrorKind.NO_MATCHING_BRANCH, execution.getFailures().get(0).getErrorKind());
        assertEquals("check", execution.getFailures().get(0).getNodeId());
    }

    @Test
    void testNoEndReached() throws Exception {
        when(taskExecutor.execute(any())).thenReturn("done");
        WorkflowDefinition definition = WorkflowBuilder.create("dead-end", "Dead end")
                .start("start")
                .agentExecute("work", "Do work")
                .end("end")
                .connect("start", "work")
                .connect("work", "end", "publish == true")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-dead-end", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals(ErrorKind.NO_END_REACHED, execution.getFailures().get(0).getErrorKind());
        assertEquals(NodeStatus.SKIPPED, execution.getNodeState("end").getStatus());
    }

    @Test
    void testLoopStopsAtMaxIterations() throws Exception {
        when(taskExecutor.execute(any())).thenReturn("again");
        WorkflowDefinition definition = WorkflowBuilder.create("forever", "Forever")
                .start("start")
                .loop("repeat", "work", "true", 3)
                .agentExecute("work", "Do work")
                .end("end")
                .connect("start", "repeat")
                .connect("repeat", "work")
                .loopBack("work", "repeat")
                .connect("repeat", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-forever", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        NodeFailure failure = execution.getFailures().get(0);
        assertEquals(ErrorKind.LOOP_BOUND_EXCEEDED, failure.getErrorKind());
        assertEquals("repeat", failure.getNodeId());
        verify(taskExecutor, times(3)).execute(any());
    }

    @Test
    void testLoopConditionEndsLoop() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        when(taskExecutor.execute(any())).thenAnswer(invocation -> Map.of("score", 5 + calls.incrementAndGet() * 2));
        WorkflowDefinition definition = WorkflowBuilder.create("refine", "Refine")
                .start("start")
                .loop("refine", "improve", "quality < 10", 5)
                .node(WorkflowNode.builder("improve", NodeKind.AGENT_EXECUTE)
                        .config("task", "Improve")
                        .config("outputMapping", Map.of("score", "quality"))
                        .build())
                .end("end")
                .connect("start", "refine")
                .connect("refine", "improve")
                .loopBack("improve", "refine")
                .connect("refine", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-refine", Map.of("quality", 0))));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(11, execution.getVariable("quality"));
        assertEquals(3, execution.getNodeState("refine").getOutput());
        assertEquals(3, execution.getLoopIterations().get("refine"));
    }

    @Test
    void testForEachLoopBindsItems() throws Exception {
        List<String> tasks = new CopyOnWriteArrayList<>();
        when(taskExecutor.execute(any())).thenAnswer(invocation -> {
            TaskRequest request = invocation.getArgument(0);
            tasks.add(request.getConfigString("task"));
            return "processed";
        });
        WorkflowDefinition definition = WorkflowBuilder.create("each", "Each")
                .start("start")
                .addNode("each", NodeKind.LOOP, Map.of(
                        "body", "process",
                        "forEach", "files",
                        "itemVariable", "file",
                        "maxIterations", 10))
                .agentExecute("process", "Process {{file}}")
                .end("end")
                .connect("start", "each")
                .connect("each", "process")
                .loopBack("process", "each")
                .connect("each", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition,
                context("run-each", Map.of("files", List.of("a.csv", "b.csv", "c.csv")))));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(List.of("Process a.csv", "Process b.csv", "Process c.csv"), tasks);
        assertEquals(2, execution.getVariable("each_iteration"));
        assertEquals("c.csv", execution.getVariable("file"));
    }

    @Test
    void testForEachOverMissingVariableRunsNoIterations() throws Exception {
        WorkflowDefinition definition = WorkflowBuilder.create("each", "Each")
                .start("start")
                .addNode("each", NodeKind.LOOP, Map.of("body", "process", "forEach", "files", "maxIterations", 10))
                .agentExecute("process", "Process {{each_item}}")
                .end("end")
                .connect("start", "each")
                .connect("each", "process")
                .loopBack("process", "each")
                .connect("each", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-none", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(NodeStatus.SKIPPED, execution.getNodeState("process").getStatus());
        verifyNoInteractions(taskExecutor);
    }

    @Test
    void testRetrySucceedsOnThirdAttempt() throws Exception {
        when(taskExecutor.execute(any()))
                .thenThrow(new IllegalStateException("first"))
                .thenThrow(new IllegalStateException("second"))
                .thenReturn("third time lucky");
        WorkflowDefinition definition = singleNodeWorkflow(WorkflowNode.builder("flaky", NodeKind.AGENT_EXECUTE)
                .config("task", "Try")
                .retryPolicy(RetryPolicy.builder().maxAttempts(3).backoff(BackoffShape.NONE).build())
                .build());

        WorkflowExecution execution = await(engine.execute(definition, context("run-retry", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(3, execution.getNodeState("flaky").getAttempts());
        assertEquals("third time lucky", execution.getVariable("flaky_output"));
        verify(taskExecutor, times(3)).execute(any());
    }

    @Test
    void testRetriesExhausted() throws Exception {
        when(taskExecutor.execute(any())).thenThrow(new IllegalStateException("always"));
        WorkflowDefinition definition = singleNodeWorkflow(WorkflowNode.builder("flaky", NodeKind.AGENT_EXECUTE)
                .config("task", "Try")
                .retryPolicy(RetryPolicy.builder()
                        .maxAttempts(2)
                        .backoff(BackoffShape.FIXED)
                        .initialDelay(Duration.ofMillis(20))
                        .build())
                .build());

        WorkflowExecution execution = await(engine.execute(definition, context("run-exhausted", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        NodeFailure failure = execution.getFailures().get(0);
        assertEquals(ErrorKind.EXECUTOR_FAILURE, failure.getErrorKind());
        assertEquals("always", failure.getMessage());
        assertEquals(2, execution.getNodeState("flaky").getAttempts());
        assertEquals(NodeStatus.FAILED, execution.getNodeState("flaky").getStatus());
    }

    @Test
    void testTimeoutIsRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        when(taskExecutor.execute(any())).thenAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                Thread.sleep(10_000);
            }
            return "fast enough";
        });
        WorkflowDefinition definition = singleNodeWorkflow(WorkflowNode.builder("slow", NodeKind.AGENT_EXECUTE)
                .config("task", "Hurry")
                .timeout(Duration.ofMillis(200))
                .retryPolicy(RetryPolicy.builder().maxAttempts(2).backoff(BackoffShape.NONE).build())
                .build());

        WorkflowExecution execution = await(engine.execute(definition, context("run-timeout", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("fast enough", execution.getVariable("slow_output"));
        assertEquals(2, execution.getNodeState("slow").getAttempts());
        verify(taskExecutor, atLeastOnce()).cancel("run-timeout", "slow");
    }

    @Test
    void testTimeoutWithoutRetryFailsRun() throws Exception {
        when(taskExecutor.execute(any())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return "too late";
        });
        WorkflowDefinition definition = singleNodeWorkflow(WorkflowNode.builder("slow", NodeKind.AGENT_EXECUTE)
                .config("task", "Hurry")
                .timeout(Duration.ofMillis(100))
                .build());

        WorkflowExecution execution = await(engine.execute(definition, context("run-timeout-fail", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals(ErrorKind.TIMEOUT_EXCEEDED, execution.getFailures().get(0).getErrorKind());
    }

    @Test
    void testFailFastJoinFailsOnOptionalBranchFailure() throws Exception {
        when(taskExecutor.execute(any())).thenAnswer(invocation -> branchResult(invocation.getArgument(0)));

        WorkflowExecution execution = await(engine.execute(forkWorkflow(BranchFailurePolicy.FAIL_FAST),
                context("run-fail-fast", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        NodeFailure failure = execution.getFailures().get(0);
        assertEquals(ErrorKind.JOINED_BRANCH_FAILED, failure.getErrorKind());
        assertEquals("merge", failure.getNodeId());
        assertEquals(NodeStatus.FAILED, execution.getNodeState("broken").getStatus());
    }

    @Test
    void testTolerantJoinContinues() throws Exception {
        when(taskExecutor.execute(any())).thenAnswer(invocation -> branchResult(invocation.getArgument(0)));

        WorkflowExecution execution = await(engine.execute(forkWorkflow(BranchFailurePolicy.TOLERATE_PARTIAL),
                context("run-tolerant", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(Map.of("branches", 2, "failedBranches", 1), execution.getNodeState("merge").getOutput());
        assertEquals("healthy-done", execution.getVariable("healthy_output"));
        assertEquals("broken failed", execution.getVariable("broken_error"));
        assertTrue(execution.getFailures().isEmpty());
    }

    @Test
    void testNonOptionalBranchFailureCancelsSiblings() throws Exception {
        when(taskExecutor.execute(any())).thenAnswer(invocation -> {
            TaskRequest request = invocation.getArgument(0);
            if ("broken".equals(request.getNodeId())) {
                throw new IllegalStateException("broken failed");
            }
            Thread.sleep(10_000);
            return "never";
        });
        WorkflowDefinition definition = WorkflowBuilder.create("fork", "Fork")
                .start("start")
                .parallel("fork")
                .agentExecute("broken", "Break")
                .agentExecute("healthy", "Work slowly")
                .join("merge", "fork", BranchFailurePolicy.FAIL_FAST)
                .end("end")
                .connect("start", "fork")
                .connect("fork", "broken")
                .connect("fork", "healthy")
                .connect("broken", "merge")
                .connect("healthy", "merge")
                .connect("merge", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-cancel-siblings", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals("broken", execution.getFailures().get(0).getNodeId());
        assertEquals(NodeStatus.CANCELLED, execution.getNodeState("healthy").getStatus());
    }

    @Test
    void testOptionalFailureRoutesToFallback() throws Exception {
        when(taskExecutor.execute(any())).thenAnswer(invocation -> {
            TaskRequest request = invocation.getArgument(0);
            if ("risky".equals(request.getNodeId())) {
                throw new IllegalStateException("risky broke");
            }
            return "fallback-done";
        });
        WorkflowDefinition definition = WorkflowBuilder.create("fallback", "Fallback")
                .start("start")
                .node(WorkflowNode.builder("risky", NodeKind.AGENT_EXECUTE)
                        .config("task", "Try the risky thing")
                        .optional(true)
                        .build())
                .condition("check")
                .agentExecute("fallback", "Do the safe thing")
                .end("recovered")
                .end("done")
                .connect("start", "risky")
                .connect("risky", "check")
                .connect("check", "fallback", "risky_error exists")
                .connect("check", "done")
                .connect("fallback", "recovered")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-fallback", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("recovered", execution.getCompletedBy().orElseThrow());
        assertEquals("risky broke", execution.getVariable("risky_error"));
        assertEquals(NodeStatus.FAILED, execution.getNodeState("risky").getStatus());
        assertEquals("fallback-done", execution.getVariable("fallback_output"));
    }

    @Test
    void testDelayDoesNotBlockSiblingBranch() throws Exception {
        when(taskExecutor.execute(any())).thenReturn("quick");
        List<NodeTransitionEvent> events = new CopyOnWriteArrayList<>();
        engine.addTransitionListener(events::add);
        WorkflowDefinition definition = WorkflowBuilder.create("delay", "Delay")
                .start("start")
                .parallel("fork")
                .delay("wait", "300ms")
                .agentExecute("quick", "Be quick")
                .join("merge", "fork", BranchFailurePolicy.FAIL_FAST)
                .end("end")
                .connect("start", "fork")
                .connect("fork", "wait")
                .connect("fork", "quick")
                .connect("wait", "merge")
                .connect("quick", "merge")
                .connect("merge", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-delay", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        int quickDone = indexOf(events, "quick", NodeStatus.SUCCEEDED);
        int waitDone = indexOf(events, "wait", NodeStatus.SUCCEEDED);
        assertTrue(quickDone >= 0 && waitDone > quickDone, "quick should finish while wait is still delaying");
        assertTrue(execution.getDuration().orElseThrow().toMillis() >= 300);
    }

    @Test
    void testApprovalApproved() throws Exception {
        CompletableFuture<WorkflowExecution> future = engine.execute(approvalWorkflow(null, null),
                context("run-approve", Map.of()));

        assertEquals(NodeStatus.AWAITING_APPROVAL,
                engine.getExecution("run-approve").orElseThrow().getNodeState("signoff").getStatus());
        assertFalse(engine.approve("run-approve", "start"));
        assertTrue(engine.approve("run-approve", "signoff"));

        WorkflowExecution execution = await(future);
        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(true, execution.getVariable("signoff_approved"));
        assertFalse(engine.approve("run-approve", "signoff"));
    }

    @Test
    void testApprovalRejected() throws Exception {
        CompletableFuture<WorkflowExecution> future = engine.execute(approvalWorkflow(null, null),
                context("run-reject", Map.of()));

        assertTrue(engine.reject("run-reject", "signoff", "Not this quarter"));

        WorkflowExecution execution = await(future);
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        NodeFailure failure = execution.getFailures().get(0);
        assertEquals(ErrorKind.APPROVAL_REJECTED, failure.getErrorKind());
        assertEquals("Not this quarter", failure.getMessage());
        assertEquals(false, execution.getVariable("signoff_approved"));
    }

    @Test
    void testApprovalTimeoutAppliesDefaultAction() throws Exception {
        WorkflowExecution approved = await(engine.execute(approvalWorkflow(Duration.ofMillis(100), "approve"),
                context("run-timeout-approve", Map.of())));
        WorkflowExecution rejected = await(engine.execute(approvalWorkflow(Duration.ofMillis(100), null),
                context("run-timeout-reject", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, approved.getStatus());
        assertEquals(ExecutionStatus.FAILED, rejected.getStatus());
        assertEquals(ErrorKind.APPROVAL_REJECTED, rejected.getFailures().get(0).getErrorKind());
    }

    @Test
    void testCancelWhileAwaitingApproval() throws Exception {
        CompletableFuture<WorkflowExecution> future = engine.execute(approvalWorkflow(null, null),
                context("run-cancel", Map.of()));

        assertTrue(engine.cancel("run-cancel"));

        WorkflowExecution execution = await(future);
        assertEquals(ExecutionStatus.CANCELLED, execution.getStatus());
        assertEquals(NodeStatus.CANCELLED, execution.getNodeState("signoff").getStatus());
        assertEquals(ErrorKind.RUN_CANCELLED, execution.getNodeState("signoff").getErrorKind());
        assertTrue(execution.getFailures().isEmpty());
        assertFalse(engine.cancel("run-cancel"));
        assertFalse(engine.approve("run-cancel", "signoff"));
        assertEquals(ExecutionStatus.CANCELLED, engine.getStatus("run-cancel"));
    }

    @Test
    void testResumeAfterShutdown() throws Exception {
        WorkflowDefinition definition = approvalWorkflow(null, null);
        CompletableFuture<WorkflowExecution> first = engine.execute(definition, context("run-resume", Map.of()));

        engine.shutdown();

        ExecutionException detached = assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, detached.getCause());
        assertEquals(ExecutionStatus.RUNNING, store.get("run-resume").orElseThrow().getStatus());

        engine = newEngine();
        CompletableFuture<WorkflowExecution> resumed = engine.resume("run-resume", definition);
        assertTrue(engine.approve("run-resume", "signoff"));

        WorkflowExecution execution = await(resumed);
        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("end", execution.getCompletedBy().orElseThrow());
    }

    @Test
    void testResumeRedispatchesInterruptedWork() throws Exception {
        when(taskExecutor.execute(any())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return "never";
        });
        WorkflowDefinition definition = singleNodeWorkflow(WorkflowNode.builder("work", NodeKind.AGENT_EXECUTE)
                .config("task", "Work")
                .build());
        engine.execute(definition, context("run-redispatch", Map.of()));
        engine.shutdown();

        TaskExecutor secondExecutor = mock(TaskExecutor.class);
        when(secondExecutor.execute(any())).thenReturn("finished");
        engine = GraphWorkflowEngine.builder()
                .taskExecutor(secondExecutor)
                .executionStore(store)
                .configuration(configuration)
                .build();

        WorkflowExecution execution = await(engine.resume("run-redispatch", definition));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("finished", execution.getVariable("work_output"));
        assertEquals(2, execution.getNodeState("work").getAttempts());
    }

    @Test
    void testResumeRejectsUnknownOrMismatchedExecution() throws Exception {
        WorkflowDefinition definition = approvalWorkflow(null, null);
        engine.execute(definition, context("run-mismatch", Map.of()));

        ExecutionException unknown = assertThrows(ExecutionException.class,
                () -> engine.resume("nope", definition).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, unknown.getCause());

        ExecutionException running = assertThrows(ExecutionException.class,
                () -> engine.resume("run-mismatch", definition).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, running.getCause());

        ExecutionException mismatch = assertThrows(ExecutionException.class,
                () -> engine.resume("run-mismatch", approvalWorkflow(Duration.ofHours(1), null)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, mismatch.getCause());
    }

    @Test
    void testResumeOfFinishedExecutionReturnsSnapshot() throws Exception {
        when(taskExecutor.execute(any())).thenReturn("done");
        WorkflowDefinition definition = singleNodeWorkflow(WorkflowNode.builder("work", NodeKind.AGENT_EXECUTE)
                .config("task", "Work")
                .build());
        WorkflowExecution finished = await(engine.execute(definition, context("run-finished", Map.of())));

        assertEquals(finished, await(engine.resume("run-finished", definition)));
        verify(taskExecutor, times(1)).execute(any());
    }

    @Test
    void testInvalidDefinitionIsRejectedBeforeRunning() {
        WorkflowDefinition definition = WorkflowBuilder.create("broken", "Broken")
                .start("start")
                .agentExecute("work", "Do work")
                .connect("start", "work")
                .buildUnvalidated();

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> engine.execute(definition, context("run-invalid", Map.of())).get(5, TimeUnit.SECONDS));

        InvalidDefinitionException cause = assertInstanceOf(InvalidDefinitionException.class, exception.getCause());
        assertFalse(cause.getViolations().isEmpty());
        assertTrue(store.list().isEmpty());
        verifyNoInteractions(taskExecutor);
    }

    @Test
    void testDuplicateExecutionIdIsRejected() {
        engine.execute(approvalWorkflow(null, null), context("run-dup", Map.of()));

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> engine.execute(approvalWorkflow(null, null), context("run-dup", Map.of())).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, exception.getCause());
    }

    @Test
    void testServiceCalls() throws Exception {
        when(externalService.call(any())).thenAnswer(invocation -> {
            ServiceRequest request = invocation.getArgument(0);
            return request.getKind() == NodeKind.MCP_CALL ? List.of("a.txt") : Map.of("status", 202);
        });
        WorkflowDefinition definition = WorkflowBuilder.create("services", "Services")
                .start("start")
                .mcpCall("list", "files", "list_directory", Map.of("path", "{{dir}}"))
                .webhook("notify", "https://hooks.example.com/{{team}}", null, Map.of("count", "{{list_response}}"))
                .end("end")
                .connect("start", "list")
                .connect("list", "notify")
                .connect("notify", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition,
                context("run-services", Map.of("dir", "/data", "team", "ops"))));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(List.of("a.txt"), execution.getVariable("list_response"));
        assertEquals(Map.of("status", 202), execution.getVariable("notify_response"));

        ArgumentCaptor<ServiceRequest> captor = ArgumentCaptor.forClass(ServiceRequest.class);
        verify(externalService, times(2)).call(captor.capture());
        ServiceRequest mcp = captor.getAllValues().get(0);
        assertEquals("files/list_directory", mcp.getTarget());
        assertEquals("/data", mcp.getPayload().get("path"));
        assertEquals(Duration.ofMillis(5000), mcp.getTimeout());
        ServiceRequest webhook = captor.getAllValues().get(1);
        assertEquals("https://hooks.example.com/ops", webhook.getTarget());
        assertEquals("POST", webhook.getMethod());
        assertEquals("[a.txt]", webhook.getPayload().get("count"));
    }

    @Test
    void testMissingVariableFailsNode() throws Exception {
        WorkflowDefinition definition = singleNodeWorkflow(WorkflowNode.builder("greet", NodeKind.AGENT_EXECUTE)
                .config("task", "Say hello to {{name}}")
                .build());

        WorkflowExecution execution = await(engine.execute(definition, context("run-missing", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals(ErrorKind.EXECUTOR_FAILURE, execution.getFailures().get(0).getErrorKind());
        assertTrue(execution.getFailures().get(0).getMessage().contains("name"));
        verifyNoInteractions(taskExecutor);
    }

    @Test
    void testDataTransformWritesOutput() throws Exception {
        WorkflowDefinition definition = WorkflowBuilder.create("transform", "Transform")
                .start("start")
                .dataTransform("total", TransformOperation.SUM, List.of("a", "b"), "sum")
                .end("end")
                .connect("start", "total")
                .connect("total", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-sum", Map.of("a", 2, "b", 40))));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(42L, execution.getVariable("sum"));
    }

    @Test
    void testTransitionEventsInOrder() throws Exception {
        when(taskExecutor.execute(any())).thenReturn("done");
        List<NodeTransitionEvent> events = new CopyOnWriteArrayList<>();
        engine.addTransitionListener(event -> {
            throw new IllegalStateException("listener failure is ignored");
        });
        engine.addTransitionListener(events::add);
        WorkflowDefinition definition = singleNodeWorkflow(WorkflowNode.builder("work", NodeKind.AGENT_EXECUTE)
                .config("task", "Work")
                .build());

        WorkflowExecution execution = await(engine.execute(definition, context("run-events", Map.of())));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        List<NodeStatus> workStatuses = events.stream()
                .filter(event -> event.getNodeId().equals("work"))
                .map(NodeTransitionEvent::getNewStatus)
                .toList();
        assertEquals(List.of(NodeStatus.READY, NodeStatus.RUNNING, NodeStatus.SUCCEEDED), workStatuses);
        assertTrue(indexOf(events, "start", NodeStatus.SUCCEEDED) < indexOf(events, "work", NodeStatus.READY));
        NodeTransitionEvent last = events.get(events.size() - 1);
        assertEquals("end", last.getNodeId());
        assertEquals(NodeStatus.SUCCEEDED, last.getNewStatus());
        assertTrue(events.stream().allMatch(event -> event.getExecutionId().equals("run-events")));
    }

    @Test
    void testDefinitionVariablesSeedRunWithoutOverridingContext() throws Exception {
        when(taskExecutor.execute(any())).thenReturn("greeted");
        WorkflowDefinition definition = WorkflowBuilder.create("seeded", "Seeded")
                .variable("greeting", "Hello")
                .variable("name", "World")
                .start("start")
                .agentExecute("greet", "{{greeting}} {{name}}")
                .end("end")
                .connect("start", "greet")
                .connect("greet", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-seeded", Map.of("name", "Ada"))));

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("Hello", execution.getVariable("greeting"));
        assertEquals("Ada", execution.getVariable("name"));
        ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
        verify(taskExecutor).execute(captor.capture());
        assertEquals("Hello Ada", captor.getValue().getConfigString("task"));
    }

    @Test
    void testWorkflowTimeoutFailsRunAndCancelsWork() throws Exception {
        when(taskExecutor.execute(any())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return "too late";
        });
        WorkflowDefinition definition = WorkflowBuilder.create("bounded", "Bounded")
                .timeout(Duration.ofMillis(200))
                .start("start")
                .agentExecute("work", "Take forever")
                .end("end")
                .connect("start", "work")
                .connect("work", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-bounded", Map.of())));

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        NodeFailure failure = execution.getFailures().get(0);
        assertEquals(ErrorKind.TIMEOUT_EXCEEDED, failure.getErrorKind());
        assertNull(failure.getNodeId());
        assertEquals(NodeStatus.CANCELLED, execution.getNodeState("work").getStatus());
        assertTrue(execution.getDuration().orElseThrow().toMillis() >= 200);
        verify(taskExecutor).cancel("run-bounded", "work");
    }

    @Test
    void testWorkflowTimeoutDoesNotAffectFastRun() throws Exception {
        when(taskExecutor.execute(any())).thenReturn("quick");
        WorkflowDefinition definition = WorkflowBuilder.create("bounded", "Bounded")
                .timeout(Duration.ofMillis(200))
                .start("start")
                .agentExecute("work", "Be quick")
                .end("end")
                .connect("start", "work")
                .connect("work", "end")
                .build();

        WorkflowExecution execution = await(engine.execute(definition, context("run-fast", Map.of())));
        Thread.sleep(300);

        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(ExecutionStatus.SUCCEEDED, engine.getStatus("run-fast"));
    }

    @Test
    void testPauseLetsRunningWorkFinishButDispatchesNothingNew() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        when(taskExecutor.execute(any())).thenAnswer(invocation -> {
            TaskRequest request = invocation.getArgument(0);
            if ("first".equals(request.getNodeId())) {
                firstStarted.countDown();
                assertTrue(releaseFirst.await(5, TimeUnit.SECONDS));
                return "one";
            }
            return "two";
        });
        WorkflowDefinition definition = WorkflowBuilder.create("pausable", "Pausable")
                .start("start")
                .agentExecute("first", "Step one")
                .agentExecute("second", "Step two")
                .end("end")
                .connect("start", "first")
                .connect("first", "second")
                .connect("second", "end")
                .build();

        CompletableFuture<WorkflowExecution> future = engine.execute(definition, context("run-pause", Map.of()));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

        assertTrue(engine.pause("run-pause"));
        assertFalse(engine.pause("run-pause"));
        assertEquals(ExecutionStatus.PAUSED, engine.getStatus("run-pause"));

        releaseFirst.countDown();
        waitUntil(() -> engine.getExecution("run-pause").orElseThrow()
                .getNodeState("first").getStatus() == NodeStatus.SUCCEEDED);
        Thread.sleep(100);

        WorkflowExecution paused = engine.getExecution("run-pause").orElseThrow();
        assertEquals(ExecutionStatus.PAUSED, paused.getStatus());
        assertEquals("one", paused.getVariable("first_output"));
        assertEquals(NodeStatus.READY, paused.getNodeState("second").getStatus());
        assertFalse(future.isDone());
        verify(taskExecutor, times(1)).execute(any());

        assertTrue(engine.resume("run-pause"));
        assertFalse(engine.resume("run-pause"));

        WorkflowExecution execution = await(future);
        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("two", execution.getVariable("second_output"));
        assertFalse(engine.pause("run-pause"));
        assertFalse(engine.pause("unknown"));
        assertFalse(engine.resume("unknown"));
    }

    @Test
    void testPausedRunStaysPausedWhenResumedFromStore() throws Exception {
        WorkflowDefinition definition = approvalWorkflow(null, null);
        engine.execute(definition, context("run-paused-store", Map.of()));
        assertTrue(engine.pause("run-paused-store"));
        engine.shutdown();
        assertEquals(ExecutionStatus.PAUSED, store.get("run-paused-store").orElseThrow().getStatus());

        engine = newEngine();
        CompletableFuture<WorkflowExecution> resumed = engine.resume("run-paused-store", definition);

        assertTrue(engine.approve("run-paused-store", "signoff"));
        WorkflowExecution paused = engine.getExecution("run-paused-store").orElseThrow();
        assertEquals(ExecutionStatus.PAUSED, paused.getStatus());
        assertEquals(NodeStatus.SUCCEEDED, paused.getNodeState("signoff").getStatus());
        assertEquals(NodeStatus.READY, paused.getNodeState("end").getStatus());
        assertFalse(resumed.isDone());

        assertTrue(engine.resume("run-paused-store"));

        WorkflowExecution execution = await(resumed);
        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals("end", execution.getCompletedBy().orElseThrow());
    }

    @Test
    void testCancelPausedRun() throws Exception {
        CompletableFuture<WorkflowExecution> future = engine.execute(approvalWorkflow(null, null),
                context("run-cancel-paused", Map.of()));
        assertTrue(engine.pause("run-cancel-paused"));

        assertTrue(engine.cancel("run-cancel-paused"));

        assertEquals(ExecutionStatus.CANCELLED, await(future).getStatus());
        assertFalse(engine.resume("run-cancel-paused"));
    }

    @Test
    void testFinishedExecutionsArePurgedFromStore() throws Exception {
        engine.shutdown();
        Properties properties = new Properties();
        properties.setProperty(FlowgraphConfiguration.METRICS_ENABLED, "false");
        properties.setProperty(FlowgraphConfiguration.STORE_MAX_AGE_MS, "1");
        properties.setProperty(FlowgraphConfiguration.STORE_PURGE_INTERVAL_MS, "50");
        configuration = new FlowgraphConfiguration(properties);
        store = new InMemoryExecutionStore(configuration);
        engine = newEngine();
        WorkflowDefinition definition = WorkflowBuilder.create("empty", "Empty")
                .start("start")
                .end("end")
                .connect("start", "end")
                .build();

        for (int i = 0; i < 50; i++) {
            assertEquals(ExecutionStatus.SUCCEEDED,
                    await(engine.execute(definition, context("run-purge-" + i, Map.of()))).getStatus());
        }
        engine.execute(approvalWorkflow(null, null), context("run-still-waiting", Map.of()));

        waitUntil(() -> store.size() == 1);
        assertTrue(store.get("run-still-waiting").isPresent());
        assertTrue(store.get("run-purge-0").isEmpty());
    }

    @Test
    void testExecuteAfterShutdownFails() {
        engine.shutdown();

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> engine.execute(approvalWorkflow(null, null), context("run-late", Map.of())).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, exception.getCause());
    }

    private GraphWorkflowEngine newEngine() {
        return GraphWorkflowEngine.builder()
                .taskExecutor(taskExecutor)
                .externalService(externalService)
                .executionStore(store)
                .configuration(configuration)
                .build();
    }

    private static ExecutionContext context(String executionId, Map<String, Object> variables) {
        return ExecutionContext.builder()
                .executionId(executionId)
                .variables(variables)
                .build();
    }

    private static WorkflowExecution await(CompletableFuture<WorkflowExecution> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            assertTrue(System.currentTimeMillis() < deadline, "condition not reached within 5s");
            Thread.sleep(10);
        }
    }

    private static int indexOf(List<NodeTransitionEvent> events, String nodeId, NodeStatus status) {
        for (int i = 0; i < events.size(); i++) {
            NodeTransitionEvent event = events.get(i);
            if (event.getNodeId().equals(nodeId) && event.getNewStatus() == status) {
                return i;
            }
        }
        return -1;
    }

    private static Object branchResult(TaskRequest request) {
        if ("broken".equals(request.getNodeId())) {
            throw new IllegalStateException("broken failed");
        }
        return request.getNodeId() + "-done";
    }

    private static WorkflowDefinition singleNodeWorkflow(WorkflowNode node) throws InvalidDefinitionException {
        return WorkflowBuilder.create("single", "Single")
                .start("start")
                .node(node)
                .end("end")
                .connect("start", node.getId())
                .connect(node.getId(), "end")
                .build();
    }

    private static WorkflowDefinition scoringWorkflow() throws InvalidDefinitionException {
        return WorkflowBuilder.create("scoring", "Scoring")
                .start("start")
                .node(WorkflowNode.builder("score", NodeKind.AGENT_EXECUTE)
                        .config("task", "Score the draft")
                        .config("outputMapping", Map.of("score", "quality"))
                        .build())
                .condition("check")
                .end("publish")
                .end("rework")
                .connect("start", "score")
                .connect("score", "check")
                .connect("check", "publish", "quality >= 8")
                .connect("check", "rework")
                .build();
    }

    private static WorkflowDefinition forkWorkflow(BranchFailurePolicy policy) throws InvalidDefinitionException {
        return WorkflowBuilder.create("fork", "Fork")
                .start("start")
                .parallel("fork")
                .node(WorkflowNode.builder("broken", NodeKind.AGENT_EXECUTE)
                        .config("task", "Break")
                        .optional(true)
                        .build())
                .agentExecute("healthy", "Work")
                .join("merge", "fork", policy)
                .end("end")
                .connect("start", "fork")
                .connect("fork", "broken")
                .connect("fork", "healthy")
                .connect("broken", "merge")
                .connect("healthy", "merge")
                .connect("merge", "end")
                .build();
    }

    private static WorkflowDefinition approvalWorkflow(Duration timeout, String defaultAction) {
        WorkflowNode.Builder approval = WorkflowNode.builder("signoff", NodeKind.HUMAN_APPROVAL)
                .config("message", "Ship it?")
                .timeout(timeout);
        if (defaultAction != null) {
            approval.config("defaultAction", defaultAction);
        }
        return WorkflowBuilder.create("approval", "Approval")
                .start("start")
                .node(approval.build())
                .end("end")
                .connect("start", "signoff")
                .connect("signoff", "end")
                .buildUnvalidated();
    }
}
