package com.agentrooms.orchestrator;

import com.agentrooms.shared.config.OrchestratorConfig;
import com.agentrooms.shared.model.AgentDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * The {@code orchestrate_execution} tool and the Messages API request that
 * forces the model to call it.
 */
public final class OrchestrationTool {

    public static final String NAME = "orchestrate_execution";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OrchestrationTool() {}

    public static ObjectNode definition(List<AgentDescriptor> workers) {
        var tool = MAPPER.createObjectNode();
        tool.put("name", NAME);
        tool.put("description", "Create a step-by-step execution plan where each agent writes its "
                + "results to a file that later steps read from");

        var step = MAPPER.createObjectNode();
        step.put("type", "object");
        var props = step.putObject("properties");
        props.putObject("id").put("type", "string").put("description", "Unique step identifier");
        var agent = props.putObject("agent");
        agent.put("type", "string").put("description", "Id of the agent that runs this step");
        var ids = agent.putArray("enum");
        workers.forEach(w -> ids.add(w.id()));
        props.putObject("message").put("type", "string")
                .put("description", "Instructions for the agent, including which files to read");
        props.putObject("output_file").put("type", "string")
                .put("description", "Path of the plain text file the agent saves its results to");
        var deps = props.putObject("dependencies");
        deps.put("type", "array").put("description", "Ids of steps that must finish first");
        deps.putObject("items").put("type", "string");
        var stepRequired = step.putArray("required");
        stepRequired.add("id").add("agent").add("message").add("output_file");

        var schema = tool.putObject("input_schema");
        schema.put("type", "object");
        var steps = schema.putObject("properties").putObject("steps");
        steps.put("type", "array");
        steps.set("items", step);
        schema.putArray("required").add("steps");
        return tool;
    }

    public static String systemPrompt(List<AgentDescriptor> workers) {
        var sb = new StringBuilder();
        sb.append("You are the Orchestrator agent. Break user requests into steps where each agent ")
          .append("saves results to a plain text file, and the next agent reads from that file.\n\n")
          .append("Rules:\n")
          .append("1. Each agent saves results to the specified output_file path\n")
          .append("2. Tell subsequent agents exactly which file to read from\n")
          .append("3. Use simple paths like \"/tmp/step1_results.txt\"\n\n")
          .append("Available Agents:\n");
        for (var worker : workers) {
            sb.append("- ").append(worker.id()).append(": ")
              .append(worker.description() != null ? worker.description() : "").append('\n');
        }
        sb.append("\nAlways use ").append(NAME).append(" tool to create step-by-step plans.");
        return sb.toString();
    }

    public static ObjectNode requestBody(OrchestratorConfig config, String message, List<AgentDescriptor> workers) {
        var body = MAPPER.createObjectNode();
        body.put("model", config.model());
        body.put("max_tokens", config.maxTokens());
        body.put("stream", true);
        body.put("system", systemPrompt(workers));
        var msg = body.putArray("messages").addObject();
        msg.put("role", "user");
        msg.put("content", message);
        body.putArray("tools").add(definition(workers));
        var choice = body.putObject("tool_choice");
        choice.put("type", "tool");
        choice.put("name", NAME);
        return body;
    }
}
