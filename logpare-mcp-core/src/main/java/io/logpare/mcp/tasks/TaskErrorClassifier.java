/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

/**
 * Maps a compression failure to the {@link TaskError} stored on the failed task.
 */
public final class TaskErrorClassifier {

	static final String UNKNOWN_ERROR = "Unknown error";

	private TaskErrorClassifier() {
	}

	/**
	 * Classifies a failure by its message:
	 * <ul>
	 * <li>containing {@code empty} or {@code invalid}: {@link TaskErrorCodes#INVALID_INPUT}</li>
	 * <li>containing {@code memory} or {@code heap}, or an {@link OutOfMemoryError} or
	 * {@link StackOverflowError}: {@link TaskErrorCodes#INPUT_TOO_LARGE}</li>
	 * <li>anything else: {@link TaskErrorCodes#COMPRESSION_FAILED}</li>
	 * </ul>
	 * Matching is case-sensitive.
	 * @param error the failure
	 * @return the task error, carrying the failure message
	 */
	public static TaskError classify(Throwable error) {
		String message = error.getMessage() != null ? error.getMessage() : UNKNOWN_ERROR;
		String code;
		if (message.contains("empty") || message.contains("invalid")) {
			code = TaskErrorCodes.INVALID_INPUT;
		}
		else if (error instanceof OutOfMemoryError || error instanceof StackOverflowError || message.contains("memory")
				|| message.contains("heap")) {
			code = TaskErrorCodes.INPUT_TOO_LARGE;
		}
		else {
			code = TaskErrorCodes.COMPRESSION_FAILED;
		}
		return new TaskError(code, message);
	}

}
