/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import io.logpare.mcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * In-memory implementation of {@link TaskStore}.
 *
 * <p>
 * Tasks are held in a {@link ConcurrentHashMap}. Every change is a single
 * {@code computeIfPresent} step that applies a {@link TaskPatch} to the current value,
 * so concurrent progress, completion and cancellation calls on one task cannot lose
 * updates, and the first terminal change wins. A single daemon thread removes expired
 * tasks at a fixed interval.
 */
public class InMemoryTaskStore implements TaskStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryTaskStore.class);

	// Counter for unique instance IDs to distinguish multiple stores in thread names
	private static final AtomicLong INSTANCE_COUNTER = new AtomicLong(0);

	private final Map<String, Task> tasks = new ConcurrentHashMap<>();

	private final ScheduledExecutorService cleanupExecutor;

	private final long defaultTtl;

	private final long defaultPollInterval;

	private final Clock clock;

	/**
	 * Creates a new InMemoryTaskStore with default settings.
	 */
	public InMemoryTaskStore() {
		this(builder());
	}

	private InMemoryTaskStore(Builder builder) {
		Assert.isTrue(builder.defaultTtl > 0, "defaultTtl must be positive");
		Assert.isTrue(builder.defaultPollInterval > 0, "defaultPollInterval must be positive");
		Assert.isTrue(builder.cleanupInterval > 0, "cleanupInterval must be positive");
		Assert.notNull(builder.clock, "clock must not be null");
		this.defaultTtl = builder.defaultTtl;
		this.defaultPollInterval = builder.defaultPollInterval;
		this.clock = builder.clock;
		long instanceId = INSTANCE_COUNTER.incrementAndGet();
		this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "logpare-task-cleanup-" + instanceId);
			t.setDaemon(true);
			return t;
		});
		this.cleanupExecutor.scheduleAtFixedRate(this::runCleanup, builder.cleanupInterval, builder.cleanupInterval,
				TimeUnit.MILLISECONDS);
	}

	/**
	 * Creates a new builder for InMemoryTaskStore with default settings.
	 *
	 * <pre>{@code
	 * InMemoryTaskStore store = InMemoryTaskStore.builder()
	 *     .defaultTtl(Duration.ofMinutes(30))
	 *     .cleanupInterval(Duration.ofSeconds(10))
	 *     .build();
	 * }</pre>
	 * @return a new builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for creating {@link InMemoryTaskStore} instances. All values are optional:
	 * <ul>
	 * <li>{@code defaultTtl}: {@link TaskDefaults#DEFAULT_TTL_MS} (5 minutes)</li>
	 * <li>{@code defaultPollInterval}: {@link TaskDefaults#DEFAULT_POLL_INTERVAL_MS} (1
	 * second)</li>
	 * <li>{@code cleanupInterval}: {@link TaskDefaults#CLEANUP_INTERVAL_MS} (30
	 * seconds)</li>
	 * <li>{@code clock}: the system UTC clock</li>
	 * </ul>
	 */
	public static class Builder {

		private long defaultTtl = TaskDefaults.DEFAULT_TTL_MS;

		private long defaultPollInterval = TaskDefaults.DEFAULT_POLL_INTERVAL_MS;

		private long cleanupInterval = TaskDefaults.CLEANUP_INTERVAL_MS;

		private Clock clock = Clock.systemUTC();

		public Builder defaultTtl(Duration ttl) {
			this.defaultTtl = ttl.toMillis();
			return this;
		}

		public Builder defaultPollInterval(Duration interval) {
			this.defaultPollInterval = interval.toMillis();
			return this;
		}

		/**
		 * Sets the interval between expired-task cleanup runs. The interval is
		 * independent of any task's TTL.
		 * @param interval the cleanup interval (must be positive)
		 * @return this builder for chaining
		 */
		public Builder cleanupInterval(Duration interval) {
			this.cleanupInterval = interval.toMillis();
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Builds the store and starts its cleanup timer.
		 * @return a new InMemoryTaskStore instance
		 * @throws IllegalArgumentException if any configured value is invalid
		 */
		public InMemoryTaskStore build() {
			return new InMemoryTaskStore(this);
		}

	}

	@Override
	public Mono<Task> createTask(CreateTaskOptions options) {
		return Mono.fromCallable(() -> {
			CreateTaskOptions effective = options != null ? options : CreateTaskOptions.defaults();
			String now = this.clock.instant().toString();
			Task task = Task.builder()
				.taskId(UUID.randomUUID().toString())
				.status(TaskStatus.WORKING)
				.createdAt(now)
				.lastUpdatedAt(now)
				.ttl(effective.requestedTtl() != null ? effective.requestedTtl() : this.defaultTtl)
				.pollInterval(effective.pollInterval() != null ? effective.pollInterval() : this.defaultPollInterval)
				.build();
			this.tasks.put(task.taskId(), task);
			logger.debug("Created task {} with ttl {}ms", task.taskId(), task.ttl());
			return task;
		});
	}

	@Override
	public Mono<Task> getTask(String taskId) {
		return Mono.fromCallable(() -> taskId != null ? this.tasks.get(taskId) : null);
	}

	@Override
	public Mono<Void> updateProgress(String taskId, TaskProgress progress) {
		return applyPatch(taskId, TaskPatch.progress(progress));
	}

	@Override
	public Mono<Void> completeTask(String taskId, TaskResult result) {
		return applyPatch(taskId, TaskPatch.completed(result));
	}

	@Override
	public Mono<Void> failTask(String taskId, TaskError error) {
		return applyPatch(taskId, TaskPatch.failed(error));
	}

	@Override
	public Mono<Boolean> cancelTask(String taskId) {
		return Mono.fromCallable(() -> {
			if (taskId == null) {
				return false;
			}
			AtomicBoolean cancelled = new AtomicBoolean(false);
			this.tasks.computeIfPresent(taskId, (id, task) -> {
				if (task.isTerminal()) {
					return task;
				}
				cancelled.set(true);
				return task.apply(TaskPatch.cancelled(), this.clock.instant());
			});
			if (cancelled.get()) {
				logger.debug("Cancelled task {}", taskId);
			}
			return cancelled.get();
		});
	}

	@Override
	public Mono<Boolean> isCancelled(String taskId) {
		return Mono.fromCallable(() -> {
			Task task = taskId != null ? this.tasks.get(taskId) : null;
			return task != null && task.status() == TaskStatus.CANCELLED;
		});
	}

	@Override
	public Mono<Boolean> deleteTask(String taskId) {
		return Mono.fromCallable(() -> taskId != null && this.tasks.remove(taskId) != null);
	}

	@Override
	public int size() {
		return this.tasks.size();
	}

	private Mono<Void> applyPatch(String taskId, TaskPatch patch) {
		if (taskId == null) {
			return Mono.empty();
		}
		return Mono.fromRunnable(() -> this.tasks.computeIfPresent(taskId, (id, task) -> {
			if (task.isTerminal()) {
				// Late report from a job racing a cancellation or an earlier outcome
				logger.debug("Ignoring {} change for task {} in terminal status {}", patch.status(), taskId,
						task.status());
				return task;
			}
			return task.apply(patch, this.clock.instant());
		}));
	}

	/**
	 * Removes every task whose TTL has elapsed, regardless of its status.
	 * Package-private for testing.
	 * @return the number of removed tasks
	 */
	int cleanupExpiredTasks() {
		Instant now = this.clock.instant();
		AtomicLong removed = new AtomicLong();
		this.tasks.entrySet().removeIf(entry -> {
			if (entry.getValue().isExpired(now)) {
				removed.incrementAndGet();
				return true;
			}
			return false;
		});
		if (removed.get() > 0) {
			logger.debug("Removed {} expired tasks", removed.get());
		}
		return removed.intValue();
	}

	private void runCleanup() {
		try {
			cleanupExpiredTasks();
		}
		catch (RuntimeException e) {
			// An exception would cancel all further runs of the fixed-rate schedule
			logger.error("Expired task cleanup failed", e);
		}
	}

	/**
	 * Shuts down the cleanup executor and discards all tasks.
	 */
	@Override
	public Mono<Void> shutdown() {
		return Mono.fromRunnable(() -> {
			this.cleanupExecutor.shutdown();
			try {
				if (!this.cleanupExecutor.awaitTermination(TaskDefaults.TASK_STORE_SHUTDOWN_TIMEOUT_SECONDS,
						TimeUnit.SECONDS)) {
					this.cleanupExecutor.shutdownNow();
				}
			}
			catch (InterruptedException e) {
				this.cleanupExecutor.shutdownNow();
				Thread.currentThread().interrupt();
			}
			this.tasks.clear();
		});
	}

}
