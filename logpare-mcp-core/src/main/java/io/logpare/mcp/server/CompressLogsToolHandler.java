/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import io.logpare.mcp.compressor.CompressLogsRequest;
import io.logpare.mcp.compressor.CompressionResult;
import io.logpare.mcp.compressor.LogCompressor;
import io.logpare.mcp.compressor.ProgressListener;
import io.logpare.mcp.compressor.ResultFormatter;
import io.logpare.mcp.report.CompressionReport;
import io.logpare.mcp.tasks.CompressionTaskRunner;
import io.logpare.mcp.tasks.CreateTaskOptions;
import io.logpare.mcp.tasks.TaskStore;
import io.logpare.mcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Handles the {@code compress_logs} tool.
 *
 * <p>
 * Inputs of at least the async threshold in UTF-8 bytes, or requests with
 * {@code use_task} set, are compressed by a background task and answered at once with
 * the task id. Everything else is compressed inline and leaves no task behind.
 */
public class CompressLogsToolHandler {

	private static final Logger logger = LoggerFactory.getLogger(CompressLogsToolHandler.class);

	public static final String NAME = "compress_logs";

	private final LogCompressor compressor;

	private final ResultFormatter resultFormatter;

	private final TaskStore taskStore;

	private final CompressionTaskRunner taskRunner;

	private final int asyncThresholdBytes;

	public CompressLogsToolHandler(LogCompressor compressor, ResultFormatter resultFormatter, TaskStore taskStore,
			CompressionTaskRunner taskRunner, int asyncThresholdBytes) {
		Assert.notNull(compressor, "compressor must not be null");
		Assert.notNull(resultFormatter, "resultFormatter must not be null");
		Assert.notNull(taskStore, "taskStore must not be null");
		Assert.notNull(taskRunner, "taskRunner must not be null");
		Assert.isTrue(asyncThresholdBytes > 0, "asyncThresholdBytes must be positive");
		this.compressor = compressor;
		this.resultFormatter = resultFormatter;
		this.taskStore = taskStore;
		this.taskRunner = taskRunner;
		this.asyncThresholdBytes = asyncThresholdBytes;
	}

	/**
	 * Handles one call.
	 * @param request the tool arguments
	 * @return a Mono emitting the tool result; fails with an
	 * {@link io.logpare.mcp.spec.McpError McpError} for out-of-range arguments
	 */
	public Mono<ToolResult> handle(CompressLogsRequest request) {
		return Mono.defer(() -> {
			request.validate();
			if (isAsync(request)) {
				return startTask(request);
			}
			return Mono.fromCallable(() -> compressInline(request));
		});
	}

	boolean isAsync(CompressLogsRequest request) {
		return Boolean.TRUE.equals(request.useTask()) || request.byteLength() >= this.asyncThresholdBytes;
	}

	private ToolResult compressInline(CompressLogsRequest request) {
		try {
			CompressionResult result = this.compressor.compress(request.logs(),
					request.toOptions(ProgressListener.NOOP));
			String text = this.resultFormatter.format(result, request.effectiveFormat());
			return ToolResult.of(text, CompressionReport.of(result, request.effectiveMaxTemplates(), null));
		}
		catch (RuntimeException e) {
			logger.debug("Inline compression failed", e);
			return ToolResult.error("Error compressing logs: " + messageOf(e));
		}
	}

	private Mono<ToolResult> startTask(CompressLogsRequest request) {
		return this.taskStore.createTask(CreateTaskOptions.defaults()).map(task -> {
			this.taskRunner.schedule(task.taskId(), request);
			logger.debug("Compression of {} bytes handed to task {}", request.byteLength(), task.taskId());
			String text = "Compression task started. Task ID: " + task.taskId()
					+ "\n\nPoll for status using the task ID. Estimated completion: a few seconds.";
			return ToolResult.of(text,
					new AsyncTaskStarted(task.taskId(), task.status(), task.createdAt(), task.pollInterval()));
		});
	}

	static String messageOf(Throwable error) {
		return error.getMessage() != null ? error.getMessage() : "Unknown error";
	}

}
