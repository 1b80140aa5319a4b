/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import io.logpare.mcp.tasks.TextContent;
import io.logpare.mcp.util.Utils;
import reactor.core.publisher.Mono;

/**
 * Reusable prompts that guide a model through the analysis of compressed log output.
 */
public class DiagnosticPrompts {

	public static final List<Prompt> PROMPTS = List.of(
			new Prompt("diagnose_errors", "Error Diagnosis", "Systematic analysis of error patterns in compressed logs",
					List.of(new PromptArgument("compressed_output", "Output from compress_logs tool", true),
							new PromptArgument("focus_area", "Specific error type to focus on (optional)", false))),
			new Prompt("find_root_cause", "Root Cause Analysis",
					"Correlate error templates with stack traces to identify root causes",
					List.of(new PromptArgument("templates", "Error templates from compression", true),
							new PromptArgument("stack_traces", "Related stack trace patterns", true))),
			new Prompt("performance_analysis", "Performance Analysis",
					"Analyze performance violation patterns from compressed logs",
					List.of(new PromptArgument("performance_patterns",
							"Performance-related templates from compression", true))),
			new Prompt("summarize_logs", "Log Summary",
					"Generate a comprehensive summary and insights from compressed logs",
					List.of(new PromptArgument("compressed_output", "Output from compress_logs tool", true))));

	private static final Map<String, Function<Map<String, String>, String>> RENDERERS = Map.of(
			"diagnose_errors", DiagnosticPrompts::diagnoseErrors, "find_root_cause", DiagnosticPrompts::findRootCause,
			"performance_analysis", DiagnosticPrompts::performanceAnalysis, "summarize_logs",
			DiagnosticPrompts::summarizeLogs);

	/**
	 * Renders a prompt with the given arguments.
	 * @param name the prompt name
	 * @param arguments the prompt arguments, may be {@code null} when the prompt has no
	 * required argument
	 * @return a Mono emitting a single user message, or failing with
	 * {@link ErrorCodes#INVALID_PARAMS} for an unknown prompt or a missing required
	 * argument
	 */
	public Mono<GetPromptResult> getPrompt(String name, Map<String, String> arguments) {
		return Mono.defer(() -> {
			Prompt prompt = PROMPTS.stream().filter(p -> p.name().equals(name)).findFirst().orElse(null);
			if (prompt == null) {
				return Mono.error(invalidParams("Unknown prompt: " + name));
			}
			Map<String, String> args = arguments != null ? arguments : Map.of();
			for (PromptArgument argument : prompt.arguments()) {
				if (argument.required() && !Utils.hasText(args.get(argument.name()))) {
					return Mono.error(invalidParams("Missing required argument: " + argument.name()));
				}
			}
			String text = RENDERERS.get(name).apply(args);
			return Mono.just(new GetPromptResult(prompt.description(),
					List.of(new PromptMessage("user", new TextContent(text)))));
		});
	}

	private static String diagnoseErrors(Map<String, String> args) {
		String focusArea = args.get("focus_area");
		return "Analyze these compressed logs for errors:\n\n" + args.get("compressed_output") + "\n\n"
				+ (Utils.hasText(focusArea) ? "Focus specifically on: " + focusArea + "\n\n" : "")
				+ "Provide a structured analysis:\n"
				+ "1. Error severity ranking (which errors are most critical)\n"
				+ "2. Root cause hypotheses (what might be causing these errors)\n"
				+ "3. Correlation patterns (are errors related to each other)\n"
				+ "4. Recommended investigation steps";
	}

	private static String findRootCause(Map<String, String> args) {
		return "Correlate these error templates with stack traces to find root causes:\n\n"
				+ "## Error Templates\n" + args.get("templates") + "\n\n"
				+ "## Stack Trace Patterns\n" + args.get("stack_traces") + "\n\n"
				+ "Provide:\n"
				+ "1. Template-to-trace mapping (which templates correspond to which stack traces)\n"
				+ "2. Root cause identification (the underlying issues)\n"
				+ "3. Fix recommendations (how to resolve each root cause)\n"
				+ "4. Priority order (which fixes should be addressed first)";
	}

	private static String performanceAnalysis(Map<String, String> args) {
		return "Analyze these performance patterns from compressed logs:\n\n" + args.get("performance_patterns")
				+ "\n\n"
				+ "Provide:\n"
				+ "1. Slowest operations (identify the biggest performance bottlenecks)\n"
				+ "2. Pattern trends (are there timing patterns or degradation over time)\n"
				+ "3. Resource correlations (what resources might be constrained)\n"
				+ "4. Optimization recommendations (specific improvements to make)";
	}

	private static String summarizeLogs(Map<String, String> args) {
		return "Summarize these compressed logs and provide insights:\n\n" + args.get("compressed_output") + "\n\n"
				+ "Provide:\n"
				+ "1. Executive summary (2-3 sentences on overall system health)\n"
				+ "2. Key findings (most important patterns discovered)\n"
				+ "3. Anomalies (anything unusual or unexpected)\n"
				+ "4. Recommended actions (what should be done based on these logs)";
	}

	private static McpError invalidParams(String message) {
		return McpError.builder(ErrorCodes.INVALID_PARAMS).message(message).build();
	}

	public record Prompt( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("title") String title,
		@JsonProperty("description") String description,
		@JsonProperty("arguments") List<PromptArgument> arguments) { // @formatter:on
	}

	public record PromptArgument( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("description") String description,
		@JsonProperty("required") boolean required) { // @formatter:on
	}

	public record PromptMessage( // @formatter:off
		@JsonProperty("role") String role,
		@JsonProperty("content") TextContent content) { // @formatter:on
	}

	public record GetPromptResult( // @formatter:off
		@JsonProperty("description") String description,
		@JsonProperty("messages") List<PromptMessage> messages) { // @formatter:on
	}

}
