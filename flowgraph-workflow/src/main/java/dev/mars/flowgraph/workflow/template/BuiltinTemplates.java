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

package dev.mars.flowgraph.workflow.template;

import dev.mars.flowgraph.workflow.BackoffShape;
import dev.mars.flowgraph.workflow.BranchFailurePolicy;
import dev.mars.flowgraph.workflow.NodeKind;
import dev.mars.flowgraph.workflow.RetryPolicy;
import dev.mars.flowgraph.workflow.TransformOperation;
import dev.mars.flowgraph.workflow.WorkflowBuilder;
import dev.mars.flowgraph.workflow.WorkflowNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Templates registered in every {@link TemplateLibrary}.
 */
final class BuiltinTemplates {

    private static final List<String> DOC_SECTIONS = List.of("overview", "authentication", "endpoints", "examples", "errors");

    private BuiltinTemplates() {
    }

    static List<WorkflowTemplate> all() {
        return List.of(
                sequentialTasks(),
                parallelProcessing(),
                approvalWorkflow(),
                iterativeRefinement(),
                softwareDevelopment(),
                researchAnalysis(),
                apiDocumentation(),
                dataProcessingPipeline());
    }

    static WorkflowTemplate sequentialTasks() {
        return WorkflowTemplate.builder("sequential_tasks")
                .name("Sequential Tasks")
                .description("Runs a list of agent tasks one after another")
                .category("general")
                .parameter(TemplateParameter.required("tasks", "Task descriptions, in execution order"))
                .factory((builder, params) -> {
                    builder.start("start").end("end");
                    String previous = "start";
                    List<String> tasks = params.getStringList("tasks");
                    for (int i = 0; i < tasks.size(); i++) {
                        String nodeId = "task_" + i;
                        builder.agentExecute(nodeId, tasks.get(i)).connect(previous, nodeId);
                        previous = nodeId;
                    }
                    builder.connect(previous, "end");
                })
                .build();
    }

    static WorkflowTemplate parallelProcessing() {
        return WorkflowTemplate.builder("parallel_processing")
                .name("Parallel Processing")
                .description("Fans tasks out to parallel branches and collects their results")
                .category("general")
                .parameter(TemplateParameter.required("tasks", "Task descriptions, one branch each"))
                .parameter(TemplateParameter.optional("aggregationMethod", "collect or merge", "collect"))
                .parameter(TemplateParameter.optional("failureTolerance", "none or partial", "partial"))
                .factory((builder, params) -> {
                    boolean tolerant = !"none".equalsIgnoreCase(params.getString("failureTolerance"));
                    TransformOperation aggregation = "merge".equalsIgnoreCase(params.getString("aggregationMethod"))
                            ? TransformOperation.MERGE : TransformOperation.COLLECT;

                    builder.start("start")
                            .parallel("fan_out")
                            .join("fan_in", "fan_out", tolerant ? BranchFailurePolicy.TOLERATE_PARTIAL : BranchFailurePolicy.FAIL_FAST)
                            .end("end")
                            .connect("start", "fan_out");
                    List<String> tasks = params.getStringList("tasks");
                    List<String> outputs = new ArrayList<>();
                    for (int i = 0; i < tasks.size(); i++) {
                        String nodeId = "task_" + i;
                        builder.node(WorkflowNode.builder(nodeId, NodeKind.AGENT_EXECUTE)
                                        .config("task", tasks.get(i))
                                        .optional(tolerant)
                                        .build())
                                .connect("fan_out", nodeId)
                                .connect(nodeId, "fan_in");
                        outputs.add(nodeId + "_output");
                    }
                    if (outputs.isEmpty()) {
                        builder.connect("fan_out", "fan_in");
                    }
                    builder.dataTransform("aggregate", aggregation, outputs, "results")
                            .connect("fan_in", "aggregate")
                            .connect("aggregate", "end");
                })
                .build();
    }

    static WorkflowTemplate approvalWorkflow() {
        return WorkflowTemplate.builder("approval_workflow")
                .name("Approval Workflow")
                .description("Prepares an item and routes it through approval stages in order")
                .category("process")
                .parameter(TemplateParameter.required("approvalItem", "Item requiring approval"))
                .parameter(TemplateParameter.optional("approvalStages", "Approval stages, in order",
                        List.of("manager", "director", "executive")))
                .parameter(TemplateParameter.optional("timeoutHours", "Timeout for each stage; rejects when it expires", 24))
                .factory((builder, params) -> {
                    String item = params.getString("approvalItem");
                    Duration timeout = Duration.ofHours(params.getInt("timeoutHours", 24));
                    builder.start("start")
                            .agentExecute("prepare", "Prepare " + item + " for approval", "Approval request")
                            .end("end")
                            .connect("start", "prepare");
                    String previous = "prepare";
                    List<String> stages = params.getStringList("approvalStages");
                    for (int i = 0; i < stages.size(); i++) {
                        String nodeId = "approval_" + i;
                        builder.node(WorkflowNode.builder(nodeId, NodeKind.HUMAN_APPROVAL)
                                        .label(stages.get(i) + " approval")
                                        .config("message", "Approve " + item + " (" + stages.get(i) + ")")
                                        .config("defaultAction", "reject")
                                        .timeout(timeout)
                                        .build())
                                .connect(previous, nodeId);
                        previous = nodeId;
                    }
                    builder.connect(previous, "end");
                })
                .build();
    }

    static WorkflowTemplate iterativeRefinement() {
        return WorkflowTemplate.builder("iterative_refinement")
                .name("Iterative Refinement")
                .description("Drafts a result and improves it until its score reaches a threshold")
                .category("process")
                .parameter(TemplateParameter.required("task", "What to produce"))
                .parameter(TemplateParameter.optional("maxIterations", "Upper bound on improvement rounds", 3))
                .parameter(TemplateParameter.optional("qualityThreshold", "Score that ends the refinement", 8))
                .factory((builder, params) -> {
                    Map<String, Object> scoreMapping = Map.of("score", "quality_score");
                    builder.start("start")
                            .node(WorkflowNode.builder("draft", NodeKind.AGENT_EXECUTE)
                                    .config("task", params.getString("task"))
                                    .config("outputMapping", scoreMapping)
                                    .build())
                            .loop("refine", "improve", "quality_score < " + params.getInt("qualityThreshold", 8),
                                    params.getInt("maxIterations", 3))
                            .node(WorkflowNode.builder("improve", NodeKind.AGENT_EXECUTE)
                                    .config("task", "Improve the previous result of: " + params.getString("task"))
                                    .config("outputMapping", scoreMapping)
                                    .build())
                            .end("end")
                            .connect("start", "draft")
                            .connect("draft", "refine")
                            .connect("refine", "improve")
                            .loopBack("improve", "refine")
                            .connect("refine", "end");
                })
                .build();
    }

    static WorkflowTemplate softwareDevelopment() {
        return WorkflowTemplate.builder("software_development")
                .name("Software Development")
                .description("Specification, implementation, testing, documentation and approved deployment")
                .category("development")
                .parameter(TemplateParameter.required("projectName", "Name of the project"))
                .parameter(TemplateParameter.required("requirements", "Project requirements"))
                .parameter(TemplateParameter.optional("targetLanguage", "Programming language", "python"))
                .parameter(TemplateParameter.optional("includeTests", "Include a testing phase", true))
                .parameter(TemplateParameter.optional("includeDocs", "Include a documentation phase", true))
                .factory((builder, params) -> {
                    String project = params.getString("projectName");
                    builder.variable("project_name", project)
                            .variable("requirements", params.getString("requirements"))
                            .variable("target_language", params.getString("targetLanguage"))
                            .variable("include_tests", params.getBoolean("includeTests"))
                            .variable("include_docs", params.getBoolean("includeDocs"))
                            .start("start")
                            .agentSpawn("spawn_architect", "architect", "Software Architect",
                                    "Create technical specification for: {{requirements}}")
                            .agentExecute("planning_phase", "Create detailed technical specification and architecture design",
                                    "Technical specification document with architecture decisions")
                            .agentSpawn("spawn_developer", "developer", "Software Developer",
                                    "Implement {{project_name}} using {{target_language}}")
                            .agentExecute("implementation_phase", "Implement core functionality based on technical specification",
                                    "Working code implementation")
                            .connect("start", "spawn_architect")
                            .connect("spawn_architect", "planning_phase")
                            .connect("planning_phase", "spawn_developer")
                            .connect("spawn_developer", "implementation_phase");
                    String previous = "implementation_phase";
                    if (params.getBoolean("includeTests")) {
                        builder.agentSpawn("spawn_qa", "qa_engineer", "QA Engineer",
                                        "Create comprehensive test suite and validate functionality")
                                .agentExecute("testing_phase", "Create and execute test suite", "Test results and coverage report")
                                .connect(previous, "spawn_qa")
                                .connect("spawn_qa", "testing_phase");
                        previous = "testing_phase";
                    }
                    if (params.getBoolean("includeDocs")) {
                        builder.agentSpawn("spawn_writer", "technical_writer", "Technical Writer",
                                        "Create comprehensive documentation for the project")
                                .agentExecute("documentation_phase", "Generate user documentation and API references",
                                        "Complete project documentation")
                                .connect(previous, "spawn_writer")
                                .connect("spawn_writer", "documentation_phase");
                        previous = "documentation_phase";
                    }
                    builder.agentExecute("deployment_prep", "Prepare deployment artifacts and configuration", "Deployment-ready package")
                            .humanApproval("deployment_approval", "Ready to deploy " + project + ". Please review and approve.")
                            .end("end")
                            .connect(previous, "deployment_prep")
                            .connect("deployment_prep", "deployment_approval")
                            .connect("deployment_approval", "end");
                })
                .build();
    }

    static WorkflowTemplate researchAnalysis() {
        return WorkflowTemplate.builder("research_analysis")
                .name("Research Analysis")
                .description("Plans research, collects data from each source in parallel and synthesises the findings")
                .category("research")
                .parameter(TemplateParameter.required("researchTopic", "Main research topic"))
                .parameter(TemplateParameter.required("researchQuestions", "Research questions to answer"))
                .parameter(TemplateParameter.optional("dataSources", "Data sources, one collection branch each",
                        List.of("web", "academic", "reports")))
                .factory((builder, params) -> {
                    builder.variable("research_topic", params.getString("researchTopic"))
                            .variable("research_questions", params.getStringList("researchQuestions"))
                            .variable("data_sources", params.getStringList("dataSources"))
                            .start("start")
                            .agentSpawn("spawn_coordinator", "research_coordinator", "Research Coordinator",
                                    "Plan comprehensive research strategy for: {{research_topic}}")
                            .agentExecute("research_planning", "Create a research plan answering: "
                                    + String.join("; ", params.getStringList("researchQuestions")),
                                    "Research plan with data collection strategy")
                            .parallel("parallel_collection")
                            .join("collection_join", "parallel_collection", BranchFailurePolicy.FAIL_FAST)
                            .connect("start", "spawn_coordinator")
                            .connect("spawn_coordinator", "research_planning")
                            .connect("research_planning", "parallel_collection");
                    List<String> sources = params.getStringList("dataSources");
                    for (int i = 0; i < sources.size(); i++) {
                        String source = sources.get(i);
                        builder.agentSpawn("spawn_collector_" + i, "data_collector", "Data Collector - " + source,
                                        "Collect data from " + source + " sources for research topic")
                                .agentExecute("data_collection_" + i, "Collect and curate data from " + source + " sources",
                                        "Curated data from " + source)
                                .connect("parallel_collection", "spawn_collector_" + i)
                                .connect("spawn_collector_" + i, "data_collection_" + i)
                                .connect("data_collection_" + i, "collection_join");
                    }
                    if (sources.isEmpty()) {
                        builder.connect("parallel_collection", "collection_join");
                    }
                    builder.agentSpawn("spawn_analyst", "research_analyst", "Research Analyst",
                                    "Synthesize collected data and answer research questions")
                            .agentExecute("data_synthesis", "Analyze collected data and synthesize findings",
                                    "Research findings and analysis report")
                            .humanApproval("quality_review", "Research analysis complete. Please review findings and approve.")
                            .end("end")
                            .connect("collection_join", "spawn_analyst")
                            .connect("spawn_analyst", "data_synthesis")
                            .connect("data_synthesis", "quality_review")
                            .connect("quality_review", "end");
                })
                .build();
    }

    static WorkflowTemplate apiDocumentation() {
        return WorkflowTemplate.builder("api_documentation")
                .name("API Documentation")
                .description("Parses an API specification and writes each documentation section in parallel")
                .category("documentation")
                .parameter(TemplateParameter.required("apiName", "API name"))
                .parameter(TemplateParameter.required("endpointsFile", "File containing endpoint definitions"))
                .parameter(TemplateParameter.optional("apiVersion", "API version", "1.0"))
                .parameter(TemplateParameter.optional("outputFormat", "openapi, markdown or html", "openapi"))
                .factory((builder, params) -> {
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("documentPath", "{{endpoints_file}}");
                    payload.put("analysisType", "api_specification");
                    builder.variable("api_name", params.getString("apiName"))
                            .variable("api_version", params.getString("apiVersion"))
                            .variable("endpoints_file", params.getString("endpointsFile"))
                            .start("start")
                            .mcpCall("parse_api_spec", "analysis", "analyze_document", payload)
                            .parallel("parallel_documentation")
                            .join("documentation_join", "parallel_documentation", BranchFailurePolicy.FAIL_FAST)
                            .connect("start", "parse_api_spec")
                            .connect("parse_api_spec", "parallel_documentation");
                    for (String section : DOC_SECTIONS) {
                        builder.agentSpawn("spawn_writer_" + section, "technical_writer", "Technical Writer - " + section,
                                        "Write " + section + " section for the documentation of {{api_name}} {{api_version}}")
                                .agentExecute("write_" + section, "Generate " + section + " documentation section",
                                        "Complete " + section + " documentation")
                                .connect("parallel_documentation", "spawn_writer_" + section)
                                .connect("spawn_writer_" + section, "write_" + section)
                                .connect("write_" + section, "documentation_join");
                    }
                    builder.agentSpawn("spawn_compiler", "doc_compiler", "Documentation Compiler",
                                    "Compile all sections into final API documentation")
                            .agentExecute("compile_docs", "Compile the documentation as " + params.getString("outputFormat"),
                                    "Complete API documentation package")
                            .humanApproval("doc_review", "API documentation complete. Please review and approve.")
                            .end("end")
                            .connect("documentation_join", "spawn_compiler")
                            .connect("spawn_compiler", "compile_docs")
                            .connect("compile_docs", "doc_review")
                            .connect("doc_review", "end");
                })
                .build();
    }

    static WorkflowTemplate dataProcessingPipeline() {
        return WorkflowTemplate.builder("data_processing_pipeline")
                .name("Data Processing Pipeline")
                .description("Loads data, applies processing steps in order and writes the result")
                .category("data")
                .parameter(TemplateParameter.required("dataSource", "Data source location or type"))
                .parameter(TemplateParameter.required("processingSteps", "Processing steps, in order"))
                .parameter(TemplateParameter.optional("outputFormat", "Output data format", "json"))
                .parameter(TemplateParameter.optional("errorHandling", "skip, retry or fail", "skip"))
                .factory((builder, params) -> {
                    String errorHandling = params.getString("errorHandling");
                    RetryPolicy retry = "retry".equalsIgnoreCase(errorHandling)
                            ? RetryPolicy.builder()
                                    .maxAttempts(3)
                                    .backoff(BackoffShape.EXPONENTIAL)
                                    .initialDelay(Duration.ofSeconds(1))
                                    .maxDelay(Duration.ofSeconds(30))
                                    .multiplier(2.0)
                                    .build()
                            : null;
                    boolean skip = "skip".equalsIgnoreCase(errorHandling);

                    builder.start("start")
                            .agentExecute("load", "Load data from " + params.getString("dataSource"), "Loaded dataset")
                            .connect("start", "load");
                    String previous = "load";
                    List<String> steps = params.getStringList("processingSteps");
                    for (int i = 0; i < steps.size(); i++) {
                        String nodeId = "step_" + i;
                        builder.node(WorkflowNode.builder(nodeId, NodeKind.AGENT_EXECUTE)
                                        .label(steps.get(i))
                                        .config("task", steps.get(i))
                                        .retryPolicy(retry)
                                        .optional(skip)
                                        .build())
                                .connect(previous, nodeId);
                        previous = nodeId;
                    }
                    builder.agentExecute("export", "Write the processed data as " + params.getString("outputFormat"), "Exported dataset")
                            .end("end")
                            .connect(previous, "export")
                            .connect("export", "end");
                })
                .build();
    }
}
