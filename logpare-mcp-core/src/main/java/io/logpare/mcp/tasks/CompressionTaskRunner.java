/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import java.util.concurrent.TimeUnit;

import io.logpare.mcp.compressor.CompressLogsRequest;
import io.logpare.mcp.compressor.CompressionResult;
import io.logpare.mcp.compressor.LogCompressor;
import io.logpare.mcp.compressor.ResultFormatter;
import io.logpare.mcp.report.CompressionReport;
import io.logpare.mcp.report.SmartResultFormatter;
import io.logpare.mcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs compression jobs in the background and reports their outcome to a
 * {@link TaskStore}.
 *
 * <p>
 * {@link #schedule(String, CompressLogsRequest)} returns as soon as the job is handed to
 * the scheduler. The only way to learn the outcome is to read the task from the store.
 * Cancellation is cooperative: it is checked before the job starts, on every progress
 * event and once the compressor returns. A compressor that reports no progress can
 * therefore not be stopped, but its result is discarded.
 */
public class CompressionTaskRunner {

	private static final Logger logger = LoggerFactory.getLogger(CompressionTaskRunner.class);

	private final TaskStore taskStore;

	private final LogCompressor compressor;

	private final ResultFormatter resultFormatter;

	private final Scheduler scheduler;

	public CompressionTaskRunner(TaskStore taskStore, LogCompressor compressor) {
		this(taskStore, compressor, new SmartResultFormatter(), Schedulers.boundedElastic());
	}

	public CompressionTaskRunner(TaskStore taskStore, LogCompressor compressor, ResultFormatter resultFormatter,
			Scheduler scheduler) {
		Assert.notNull(taskStore, "taskStore must not be null");
		Assert.notNull(compressor, "compressor must not be null");
		Assert.notNull(resultFormatter, "resultFormatter must not be null");
		Assert.notNull(scheduler, "scheduler must not be null");
		this.taskStore = taskStore;
		this.compressor = compressor;
		this.resultFormatter = resultFormatter;
		this.scheduler = scheduler;
	}

	/**
	 * Schedules compression of the request's logs for an existing working task.
	 * @param taskId the task to report to
	 * @param request the validated tool arguments
	 * @return a handle on the scheduled job; disposing it before it starts prevents
	 * the run
	 */
	public Disposable schedule(String taskId, CompressLogsRequest request) {
		Assert.hasText(taskId, "taskId must not be empty");
		Assert.notNull(request, "request must not be null");
		return Mono.fromRunnable(() -> run(taskId, request))
			.subscribeOn(this.scheduler)
			.subscribe(null, error -> logger.error("Unexpected error in compression task {}", taskId, error));
	}

	void run(String taskId, CompressLogsRequest request) {
		TaskProgressChannel channel = new TaskProgressChannel(taskId, this.taskStore);
		if (channel.checkCancelled()) {
			logger.debug("Task {} was cancelled before it started", taskId);
			return;
		}
		long start = System.nanoTime();
		try {
			CompressionResult result = this.compressor.compress(request.logs(), request.toOptions(channel));
			String text = this.resultFormatter.format(result, request.effectiveFormat());
			long processingTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
			if (channel.checkCancelled()) {
				logger.debug("Discarding result of cancelled task {}", taskId);
				return;
			}
			CompressionReport report = CompressionReport.of(result, request.effectiveMaxTemplates(), processingTimeMs);
			this.taskStore.completeTask(taskId, new TaskResult(text, report)).block();
			logger.debug("Task {} completed in {}ms", taskId, processingTimeMs);
		}
		catch (Exception | OutOfMemoryError | StackOverflowError ex) {
			if (channel.checkCancelled()) {
				logger.debug("Discarding failure of cancelled task {}", taskId, ex);
				return;
			}
			TaskError error = TaskErrorClassifier.classify(ex);
			logger.debug("Task {} failed with {}: {}", taskId, error.code(), error.message());
			this.taskStore.failTask(taskId, error).block();
		}
	}

}
