/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Immutable state of one asynchronous compression job.
 *
 * <p>
 * A task is created {@link TaskStatus#WORKING} and reaches exactly one terminal status.
 * Changes are expressed as a {@link TaskPatch} and applied with
 * {@link #apply(TaskPatch, Instant)}, which returns a new instance. The outcome fields
 * follow the status:
 * <ul>
 * <li>{@link #progress()} is only present while working</li>
 * <li>{@link #result()} is only present when completed</li>
 * <li>{@link #error()} is only present when failed or cancelled</li>
 * </ul>
 *
 * <p>
 * Use {@link #builder()} to create instances.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Task {

	private final String taskId;

	private final TaskStatus status;

	private final String createdAt;

	private final String lastUpdatedAt;

	private final long ttl;

	private final long pollInterval;

	private final TaskProgress progress;

	private final TaskResult result;

	private final TaskError error;

	@JsonCreator
	private Task( // @formatter:off
			@JsonProperty("taskId") String taskId,
			@JsonProperty("status") TaskStatus status,
			@JsonProperty("createdAt") String createdAt,
			@JsonProperty("lastUpdatedAt") String lastUpdatedAt,
			@JsonProperty("ttl") long ttl,
			@JsonProperty("pollInterval") long pollInterval,
			@JsonProperty("progress") @Nullable TaskProgress progress,
			@JsonProperty("result") @Nullable TaskResult result,
			@JsonProperty("error") @Nullable TaskError error) { // @formatter:on
		Assert.hasText(taskId, "taskId must not be empty");
		Assert.notNull(status, "status must not be null");
		Assert.hasText(createdAt, "createdAt must not be empty");
		Assert.hasText(lastUpdatedAt, "lastUpdatedAt must not be empty");
		Assert.isTrue(result == null || error == null, "result and error are mutually exclusive");
		this.taskId = taskId;
		this.status = status;
		this.createdAt = createdAt;
		this.lastUpdatedAt = lastUpdatedAt;
		this.ttl = ttl;
		this.pollInterval = pollInterval;
		this.progress = progress;
		this.result = result;
		this.error = error;
	}

	@JsonProperty("taskId")
	public String taskId() {
		return this.taskId;
	}

	@JsonProperty("status")
	public TaskStatus status() {
		return this.status;
	}

	/**
	 * Returns the creation timestamp.
	 * @return the ISO 8601 creation timestamp
	 */
	@JsonProperty("createdAt")
	public String createdAt() {
		return this.createdAt;
	}

	/**
	 * Returns the timestamp of the last applied change.
	 * @return the ISO 8601 last updated timestamp, never before {@link #createdAt()}
	 */
	@JsonProperty("lastUpdatedAt")
	public String lastUpdatedAt() {
		return this.lastUpdatedAt;
	}

	/**
	 * Returns the time-to-live in milliseconds, counted from {@link #createdAt()}.
	 * @return the TTL
	 */
	@JsonProperty("ttl")
	public long ttl() {
		return this.ttl;
	}

	/**
	 * Returns the suggested polling interval in milliseconds.
	 * @return the polling interval
	 */
	@JsonProperty("pollInterval")
	public long pollInterval() {
		return this.pollInterval;
	}

	@JsonProperty("progress")
	@Nullable
	public TaskProgress progress() {
		return this.progress;
	}

	@JsonProperty("result")
	@Nullable
	public TaskResult result() {
		return this.result;
	}

	@JsonProperty("error")
	@Nullable
	public TaskError error() {
		return this.error;
	}

	@JsonIgnore
	public boolean isTerminal() {
		return this.status.isTerminal();
	}

	/**
	 * Checks whether the task's TTL has elapsed at the given instant.
	 * @param now the instant to check against
	 * @return true if the task is older than its TTL
	 */
	public boolean isExpired(Instant now) {
		return now.isAfter(Instant.parse(this.createdAt).plusMillis(this.ttl));
	}

	/**
	 * Applies a change to this task.
	 *
	 * <p>
	 * A terminal task is never changed: this instance is returned as is. Otherwise the
	 * returned task carries the patch's status, the outcome field belonging to that
	 * status, and a {@code lastUpdatedAt} of {@code now} (or {@code createdAt} if
	 * {@code now} is earlier).
	 * @param patch the change to apply
	 * @param now the time of the change
	 * @return the changed task, or this task if it is terminal
	 */
	public Task apply(TaskPatch patch, Instant now) {
		Assert.notNull(patch, "patch must not be null");
		if (isTerminal()) {
			return this;
		}
		Instant created = Instant.parse(this.createdAt);
		Instant updated = now.isBefore(created) ? created : now;
		return builder().taskId(this.taskId)
			.status(patch.status())
			.createdAt(this.createdAt)
			.lastUpdatedAt(updated.toString())
			.ttl(this.ttl)
			.pollInterval(this.pollInterval)
			.progress(patch.status() == TaskStatus.WORKING ? patch.progress() : null)
			.result(patch.status() == TaskStatus.COMPLETED ? patch.result() : null)
			.error(patch.status() == TaskStatus.FAILED || patch.status() == TaskStatus.CANCELLED ? patch.error()
					: null)
			.build();
	}

	@Override
	public String toString() {
		return "Task[taskId=" + this.taskId + ", status=" + this.status + ", createdAt=" + this.createdAt
				+ ", lastUpdatedAt=" + this.lastUpdatedAt + ", ttl=" + this.ttl + ", progress=" + this.progress
				+ ", error=" + this.error + "]";
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link Task}.
	 */
	public static class Builder {

		private String taskId;

		private TaskStatus status;

		private String createdAt;

		private String lastUpdatedAt;

		private long ttl = TaskDefaults.DEFAULT_TTL_MS;

		private long pollInterval = TaskDefaults.DEFAULT_POLL_INTERVAL_MS;

		private TaskProgress progress;

		private TaskResult result;

		private TaskError error;

		public Builder taskId(String taskId) {
			this.taskId = taskId;
			return this;
		}

		public Builder status(TaskStatus status) {
			this.status = status;
			return this;
		}

		public Builder createdAt(String createdAt) {
			this.createdAt = createdAt;
			return this;
		}

		public Builder lastUpdatedAt(String lastUpdatedAt) {
			this.lastUpdatedAt = lastUpdatedAt;
			return this;
		}

		public Builder ttl(long ttl) {
			this.ttl = ttl;
			return this;
		}

		public Builder pollInterval(long pollInterval) {
			this.pollInterval = pollInterval;
			return this;
		}

		public Builder progress(@Nullable TaskProgress progress) {
			this.progress = progress;
			return this;
		}

		public Builder result(@Nullable TaskResult result) {
			this.result = result;
			return this;
		}

		public Builder error(@Nullable TaskError error) {
			this.error = error;
			return this;
		}

		public Task build() {
			return new Task(this.taskId, this.status, this.createdAt, this.lastUpdatedAt, this.ttl, this.pollInterval,
					this.progress, this.result, this.error);
		}

	}

}
