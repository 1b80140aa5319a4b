/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

import io.logpare.mcp.compressor.ProgressEvent;
import io.logpare.mcp.compressor.ProgressListener;
import io.logpare.mcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries progress of one running job into the {@link TaskStore}.
 *
 * <p>
 * Every progress event is a cancellation checkpoint. Once the channel has seen the task
 * cancelled it stays closed: the event and every later report are dropped. The
 * compressor itself keeps running, since it cannot be interrupted.
 *
 * <p>
 * Store calls block the calling thread, so the channel must only be used from the
 * job's scheduler thread.
 */
public final class TaskProgressChannel implements ProgressListener {

	private static final Logger logger = LoggerFactory.getLogger(TaskProgressChannel.class);

	private final String taskId;

	private final TaskStore taskStore;

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public TaskProgressChannel(String taskId, TaskStore taskStore) {
		Assert.hasText(taskId, "taskId must not be empty");
		Assert.notNull(taskStore, "taskStore must not be null");
		this.taskId = taskId;
		this.taskStore = taskStore;
	}

	@Override
	public void onProgress(ProgressEvent event) {
		if (checkCancelled()) {
			return;
		}
		this.taskStore.updateProgress(this.taskId, toTaskProgress(event)).block();
	}

	/**
	 * Checks the store for cancellation of the task. The answer is remembered once
	 * positive.
	 * @return true if the task has been cancelled
	 */
	public boolean checkCancelled() {
		if (this.cancelled.get()) {
			return true;
		}
		if (Boolean.TRUE.equals(this.taskStore.isCancelled(this.taskId).block())) {
			if (this.cancelled.compareAndSet(false, true)) {
				logger.debug("Task {} cancelled, dropping further reports", this.taskId);
			}
			return true;
		}
		return false;
	}

	public String taskId() {
		return this.taskId;
	}

	/**
	 * Maps a compressor progress event to a task progress snapshot. The percentage is
	 * taken from the event when present, otherwise derived from the line counts.
	 * @param event the compressor event
	 * @return the progress snapshot
	 */
	static TaskProgress toTaskProgress(ProgressEvent event) {
		int total = event.totalLines() != null ? event.totalLines() : 0;
		int processed = event.processedLines();
		int percent;
		if (event.percentComplete() != null) {
			percent = event.percentComplete();
		}
		else if (total > 0) {
			percent = (int) Math.round(processed * 100.0 / total);
		}
		else {
			percent = 0;
		}
		String message = "Processing " + String.format(Locale.ROOT, "%,d", processed)
				+ (total > 0 ? " / " + String.format(Locale.ROOT, "%,d", total) : "") + " lines";
		return new TaskProgress(percent, message, TaskPhase.of(event.currentPhase()), processed,
				total > 0 ? total : null);
	}

}
