/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import io.logpare.mcp.tasks.Task;
import io.logpare.mcp.tasks.TaskStore;
import io.logpare.mcp.util.Assert;
import io.logpare.mcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Answers client polls and cancellation requests for background compression tasks.
 */
public class TaskQueryHandler {

	private static final Logger logger = LoggerFactory.getLogger(TaskQueryHandler.class);

	private final TaskStore taskStore;

	public TaskQueryHandler(TaskStore taskStore) {
		Assert.notNull(taskStore, "taskStore must not be null");
		this.taskStore = taskStore;
	}

	/**
	 * Returns the current state of a task.
	 * @param taskId the task id
	 * @return a Mono emitting the task, or failing with
	 * {@link ErrorCodes#RESOURCE_NOT_FOUND} if it does not exist or has expired and with
	 * {@link ErrorCodes#INVALID_PARAMS} if the id is blank
	 */
	public Mono<Task> getTask(String taskId) {
		if (!Utils.hasText(taskId)) {
			return Mono.error(missingTaskId());
		}
		return this.taskStore.getTask(taskId).switchIfEmpty(Mono.error(() -> notFound(taskId)));
	}

	/**
	 * Cancels a working task.
	 * @param taskId the task id
	 * @return a Mono emitting the cancelled task; fails with
	 * {@link ErrorCodes#RESOURCE_NOT_FOUND} for an unknown task and with
	 * {@link ErrorCodes#INVALID_PARAMS} for a blank id or a task that has already finished
	 */
	public Mono<Task> cancelTask(String taskId) {
		if (!Utils.hasText(taskId)) {
			return Mono.error(missingTaskId());
		}
		return this.taskStore.cancelTask(taskId).flatMap(cancelled -> {
			if (cancelled) {
				logger.info("Task {} cancelled by client", taskId);
				return getTask(taskId);
			}
			return getTask(taskId).flatMap(task -> Mono.<Task>error(McpError.builder(ErrorCodes.INVALID_PARAMS)
				.message("Task " + taskId + " is not cancellable (status: " + task.status().value() + ")")
				.build()));
		});
	}

	static McpError missingTaskId() {
		return McpError.builder(ErrorCodes.INVALID_PARAMS).message("Task ID must not be null or empty").build();
	}

	static McpError notFound(String taskId) {
		return McpError.builder(ErrorCodes.RESOURCE_NOT_FOUND).message("Task " + taskId + " not found").build();
	}

}
