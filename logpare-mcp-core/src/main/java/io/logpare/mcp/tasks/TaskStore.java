/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import reactor.core.publisher.Mono;

/**
 * Stores the state of asynchronous compression tasks.
 *
 * <p>
 * Progress, completion, failure and cancellation are reported from independent
 * contexts without a shared lock: the job runner on a scheduler thread, cancellation on
 * the request path. Implementations must therefore tolerate any interleaving of these
 * operations on one task id. The contract is:
 * <ul>
 * <li>{@link #getTask}, {@link #isCancelled}: pure lookups; an unknown id yields an
 * empty Mono or {@code false}</li>
 * <li>{@link #updateProgress}, {@link #completeTask}, {@link #failTask}: complete
 * silently without changing anything when the task is missing or already
 * terminal</li>
 * <li>{@link #cancelTask}: emits {@code false} and changes nothing when the task is
 * missing or already terminal; cancellation is never retroactive</li>
 * </ul>
 *
 * <p>
 * Tasks are deleted once their TTL, counted from creation, has elapsed, whether or not
 * they have finished. A deleted task is reported as not found.
 *
 * <p>
 * Stores are not durable; their contents are lost on restart.
 */
public interface TaskStore {

	/**
	 * Creates a new {@link TaskStatus#WORKING} task without progress.
	 * @param options the task creation options
	 * @return a Mono emitting the created task
	 */
	Mono<Task> createTask(CreateTaskOptions options);

	/**
	 * Retrieves a task by its id.
	 * @param taskId the task identifier
	 * @return a Mono emitting the task, or empty if not found
	 */
	Mono<Task> getTask(String taskId);

	/**
	 * Records progress of a working task.
	 * @param taskId the task identifier
	 * @param progress the progress snapshot
	 * @return a Mono completing once the progress is recorded or ignored
	 */
	Mono<Void> updateProgress(String taskId, TaskProgress progress);

	/**
	 * Moves a working task to {@link TaskStatus#COMPLETED}.
	 * @param taskId the task identifier
	 * @param result the task result
	 * @return a Mono completing once the result is stored or ignored
	 */
	Mono<Void> completeTask(String taskId, TaskResult result);

	/**
	 * Moves a working task to {@link TaskStatus#FAILED}.
	 * @param taskId the task identifier
	 * @param error the failure
	 * @return a Mono completing once the failure is stored or ignored
	 */
	Mono<Void> failTask(String taskId, TaskError error);

	/**
	 * Moves a working task to {@link TaskStatus#CANCELLED} with a
	 * {@link TaskErrorCodes#CANCELLED} error.
	 * @param taskId the task identifier
	 * @return a Mono emitting {@code true} if the task was cancelled, {@code false} if it
	 * does not exist or had already finished
	 */
	Mono<Boolean> cancelTask(String taskId);

	/**
	 * Checks whether a task has been cancelled. Used by running jobs as a cooperative
	 * checkpoint.
	 * @param taskId the task identifier
	 * @return a Mono emitting {@code true} if the task exists and is cancelled
	 */
	Mono<Boolean> isCancelled(String taskId);

	/**
	 * Deletes a task. Deletion is final.
	 * @param taskId the task identifier
	 * @return a Mono emitting {@code true} if a task was removed
	 */
	Mono<Boolean> deleteTask(String taskId);

	/**
	 * Returns the number of tasks currently held.
	 * @return the task count
	 */
	int size();

	/**
	 * Stops background work and releases all tasks.
	 * @return a Mono completing when the store is shut down
	 */
	Mono<Void> shutdown();

}
