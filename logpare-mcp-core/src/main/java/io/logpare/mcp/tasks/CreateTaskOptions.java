/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import java.time.Duration;

import io.logpare.mcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Options for {@link TaskStore#createTask(CreateTaskOptions)}. Unset values fall back to
 * the store's defaults.
 *
 * <pre>{@code
 * CreateTaskOptions options = CreateTaskOptions.builder()
 *     .requestedTtl(Duration.ofMinutes(10))
 *     .build();
 * }</pre>
 */
public final class CreateTaskOptions {

	private static final CreateTaskOptions DEFAULTS = builder().build();

	private final Long requestedTtl;

	private final Long pollInterval;

	private CreateTaskOptions(Long requestedTtl, Long pollInterval) {
		this.requestedTtl = requestedTtl;
		this.pollInterval = pollInterval;
	}

	/**
	 * Options that use the store defaults for everything.
	 * @return the default options
	 */
	public static CreateTaskOptions defaults() {
		return DEFAULTS;
	}

	/**
	 * Requested TTL in milliseconds.
	 * @return the TTL, or {@code null} to use the store default
	 */
	@Nullable
	public Long requestedTtl() {
		return this.requestedTtl;
	}

	/**
	 * Poll interval in milliseconds.
	 * @return the poll interval, or {@code null} to use the store default
	 */
	@Nullable
	public Long pollInterval() {
		return this.pollInterval;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private Long requestedTtl;

		private Long pollInterval;

		public Builder requestedTtl(Duration ttl) {
			Assert.isPositive(ttl, "ttl must be positive");
			this.requestedTtl = ttl.toMillis();
			return this;
		}

		public Builder pollInterval(Duration interval) {
			Assert.isPositive(interval, "pollInterval must be positive");
			this.pollInterval = interval.toMillis();
			return this;
		}

		public CreateTaskOptions build() {
			return new CreateTaskOptions(this.requestedTtl, this.pollInterval);
		}

	}

}
