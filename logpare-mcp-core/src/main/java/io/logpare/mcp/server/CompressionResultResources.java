/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import io.logpare.mcp.tasks.Task;
import io.logpare.mcp.tasks.TaskStatus;
import io.logpare.mcp.tasks.TaskStore;
import io.logpare.mcp.util.Assert;
import io.logpare.mcp.util.Utils;
import reactor.core.publisher.Mono;

/**
 * Read-only resources exposing the full output of completed compression tasks, so tool
 * replies can stay small while the complete data stays retrievable:
 * <ul>
 * <li>{@code logpare://results/{taskId}}: the whole report</li>
 * <li>{@code logpare://templates/{taskId}}: only the templates</li>
 * <li>{@code logpare://stats/{taskId}}: everything except the templates</li>
 * </ul>
 * Reading a task that is unknown or expired fails with
 * {@link ErrorCodes#RESOURCE_NOT_FOUND}; reading one that has not completed fails with
 * {@link ErrorCodes#INVALID_PARAMS}.
 */
public class CompressionResultResources {

	public static final String RESULTS_PREFIX = "logpare://results/";

	public static final String TEMPLATES_PREFIX = "logpare://templates/";

	public static final String STATS_PREFIX = "logpare://stats/";

	public static final String MIME_TYPE = "application/json";

	/**
	 * The resource templates served by this class.
	 */
	public static final List<ResourceTemplate> RESOURCE_TEMPLATES = List.of(
			new ResourceTemplate(RESULTS_PREFIX + "{taskId}", "compression-result", "Compression Result",
					"Full compression output for a completed task"),
			new ResourceTemplate(TEMPLATES_PREFIX + "{taskId}", "templates", "Template List",
					"Extracted templates from a completed compression task"),
			new ResourceTemplate(STATS_PREFIX + "{taskId}", "stats", "Compression Statistics",
					"Statistics from a completed compression task"));

	private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final TaskStore taskStore;

	private final ObjectMapper objectMapper;

	public CompressionResultResources(TaskStore taskStore, ObjectMapper objectMapper) {
		Assert.notNull(taskStore, "taskStore must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.taskStore = taskStore;
		this.objectMapper = objectMapper;
	}

	/**
	 * Reads a resource by URI.
	 * @param uri one of the URIs listed in {@link #RESOURCE_TEMPLATES}
	 * @return a Mono emitting the resource contents
	 */
	public Mono<ResourceContents> read(String uri) {
		if (uri != null && uri.startsWith(RESULTS_PREFIX)) {
			return readResult(uri.substring(RESULTS_PREFIX.length()));
		}
		if (uri != null && uri.startsWith(TEMPLATES_PREFIX)) {
			return readTemplates(uri.substring(TEMPLATES_PREFIX.length()));
		}
		if (uri != null && uri.startsWith(STATS_PREFIX)) {
			return readStats(uri.substring(STATS_PREFIX.length()));
		}
		return Mono.error(
				McpError.builder(ErrorCodes.RESOURCE_NOT_FOUND).message("Resource not found: " + uri).build());
	}

	public Mono<ResourceContents> readResult(String taskId) {
		return completedTask(taskId).map(task -> {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("taskId", taskId);
			body.put("status", task.status());
			body.put("createdAt", task.createdAt());
			body.put("completedAt", task.lastUpdatedAt());
			body.putAll(report(task));
			return contents(RESULTS_PREFIX + taskId, body);
		});
	}

	public Mono<ResourceContents> readTemplates(String taskId) {
		return completedTask(taskId).map(task -> {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("taskId", taskId);
			body.put("templateCount", task.result().structuredContent().templates().size());
			body.put("templates", task.result().structuredContent().templates());
			return contents(TEMPLATES_PREFIX + taskId, body);
		});
	}

	public Mono<ResourceContents> readStats(String taskId) {
		return completedTask(taskId).map(task -> {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("taskId", taskId);
			body.put("createdAt", task.createdAt());
			body.put("completedAt", task.lastUpdatedAt());
			Map<String, Object> stats = report(task);
			stats.remove("templates");
			body.putAll(stats);
			return contents(STATS_PREFIX + taskId, body);
		});
	}

	private Mono<Task> completedTask(String taskId) {
		if (!Utils.hasText(taskId)) {
			return Mono.error(TaskQueryHandler.notFound(taskId));
		}
		return this.taskStore.getTask(taskId)
			.switchIfEmpty(Mono.error(() -> TaskQueryHandler.notFound(taskId)))
			.flatMap(task -> {
				if (task.status() != TaskStatus.COMPLETED) {
					String message = "Task " + taskId + " is not completed (status: " + task.status().value() + ")";
					return Mono.<Task>error(McpError.builder(ErrorCodes.INVALID_PARAMS).message(message).build());
				}
				if (task.result() == null || task.result().structuredContent() == null) {
					return Mono.<Task>error(McpError.builder(ErrorCodes.INTERNAL_ERROR)
						.message("Task " + taskId + " has no result")
						.build());
				}
				return Mono.just(task);
			});
	}

	private Map<String, Object> report(Task task) {
		return this.objectMapper.convertValue(task.result().structuredContent(), MAP_TYPE);
	}

	private ResourceContents contents(String uri, Map<String, Object> body) {
		try {
			return new ResourceContents(uri, MIME_TYPE,
					this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(body));
		}
		catch (JsonProcessingException e) {
			throw McpError.builder(ErrorCodes.INTERNAL_ERROR)
				.message("Failed to serialize " + uri + ": " + e.getOriginalMessage())
				.build();
		}
	}

	/**
	 * Descriptor of one resource template.
	 *
	 * @param uriTemplate the URI template
	 * @param name the resource name
	 * @param title a human-readable title
	 * @param description what the resource holds
	 */
	public record ResourceTemplate(String uriTemplate, String name, String title, String description) {

		public String mimeType() {
			return MIME_TYPE;
		}

	}

}
