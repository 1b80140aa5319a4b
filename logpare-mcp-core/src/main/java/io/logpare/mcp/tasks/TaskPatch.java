/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import io.logpare.mcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * A change to apply to a {@link Task}. Instances are created through the static
 * factories, one per permitted transition.
 *
 * @param status the status after the change
 * @param progress new progress, only for {@link TaskStatus#WORKING}
 * @param result the result, only for {@link TaskStatus#COMPLETED}
 * @param error the error, only for {@link TaskStatus#FAILED} and
 * {@link TaskStatus#CANCELLED}
 * @see Task#apply(TaskPatch, java.time.Instant)
 */
public record TaskPatch(TaskStatus status, @Nullable TaskProgress progress, @Nullable TaskResult result,
		@Nullable TaskError error) {

	public static TaskPatch progress(TaskProgress progress) {
		Assert.notNull(progress, "progress must not be null");
		return new TaskPatch(TaskStatus.WORKING, progress, null, null);
	}

	public static TaskPatch completed(TaskResult result) {
		Assert.notNull(result, "result must not be null");
		return new TaskPatch(TaskStatus.COMPLETED, null, result, null);
	}

	public static TaskPatch failed(TaskError error) {
		Assert.notNull(error, "error must not be null");
		return new TaskPatch(TaskStatus.FAILED, null, null, error);
	}

	public static TaskPatch cancelled() {
		return new TaskPatch(TaskStatus.CANCELLED, null, null, TaskError.CANCELLED_BY_USER);
	}

}
