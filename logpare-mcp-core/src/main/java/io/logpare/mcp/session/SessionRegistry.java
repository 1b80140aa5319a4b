/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

import io.logpare.mcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tracks the live sessions of one server and the transport each of them owns.
 *
 * <p>
 * Sessions idle for longer than the configured timeout are evicted by a background
 * sweep. Teardown first marks the entry as closing, which hides it from
 * {@link #find(String)} and makes {@link #touch(String)} ineffective, then closes the
 * transport and finally removes the entry. Only the caller that marked an entry closes
 * its transport, so every transport is closed at most once by the registry. A session id
 * that has been removed is never accepted again.
 */
public class SessionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

	private static final AtomicLong INSTANCE_COUNTER = new AtomicLong(0);

	private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();

	private final Duration sessionTimeout;

	private final Clock clock;

	private final ScheduledExecutorService sweepExecutor;

	private final AtomicBoolean closed = new AtomicBoolean(false);

	/**
	 * Creates a registry with the default timeout and sweep interval.
	 */
	public SessionRegistry() {
		this(builder());
	}

	private SessionRegistry(Builder builder) {
		Assert.isPositive(builder.sessionTimeout, "sessionTimeout must be positive");
		Assert.isPositive(builder.sweepInterval, "sweepInterval must be positive");
		Assert.notNull(builder.clock, "clock must not be null");
		this.sessionTimeout = builder.sessionTimeout;
		this.clock = builder.clock;
		long instanceId = INSTANCE_COUNTER.incrementAndGet();
		this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "logpare-session-sweep-" + instanceId);
			t.setDaemon(true);
			return t;
		});
		long sweepMillis = builder.sweepInterval.toMillis();
		this.sweepExecutor.scheduleAtFixedRate(this::runSweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link SessionRegistry}. Defaults come from {@link SessionDefaults}.
	 */
	public static class Builder {

		private Duration sessionTimeout = Duration.ofMillis(SessionDefaults.SESSION_TIMEOUT_MS);

		private Duration sweepInterval = Duration.ofMillis(SessionDefaults.SWEEP_INTERVAL_MS);

		private Clock clock = Clock.systemUTC();

		public Builder sessionTimeout(Duration sessionTimeout) {
			this.sessionTimeout = sessionTimeout;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			this.sweepInterval = sweepInterval;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public SessionRegistry build() {
			return new SessionRegistry(this);
		}

	}

	/**
	 * Registers the transport of a new session and arranges for the session to be
	 * forgotten when the transport closes on its own.
	 * @param sessionId the new session id
	 * @param transport the session's transport
	 * @return {@code false} if the id is already taken or the registry is closed
	 */
	public boolean register(String sessionId, SessionTransport transport) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.notNull(transport, "transport must not be null");
		if (this.closed.get()) {
			return false;
		}
		boolean added = this.sessions.putIfAbsent(sessionId,
				new SessionEntry(transport, this.clock.instant(), false)) == null;
		if (added) {
			transport.onClose(() -> deregister(sessionId, transport));
			logger.info("Session {} initialized", sessionId);
		}
		return added;
	}

	/**
	 * Looks up the transport of a live session.
	 * @param sessionId the session id, may be {@code null}
	 * @return the transport, or empty if the session is unknown or being torn down
	 */
	public Optional<SessionTransport> find(String sessionId) {
		if (sessionId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(this.sessions.get(sessionId))
			.filter(entry -> !entry.closing())
			.map(SessionEntry::transport);
	}

	/**
	 * Records activity on a session. Unknown and closing sessions are left alone.
	 * @param sessionId the session id
	 */
	public void touch(String sessionId) {
		if (sessionId == null) {
			return;
		}
		Instant now = this.clock.instant();
		this.sessions.computeIfPresent(sessionId, (id, entry) -> entry.closing() ? entry : entry.touched(now));
	}

	/**
	 * Returns the number of live sessions. Sessions being torn down are not counted.
	 * @return the session count
	 */
	public int count() {
		return (int) this.sessions.values().stream().filter(entry -> !entry.closing()).count();
	}

	/**
	 * Removes a session whose transport has already closed. The transport is not closed
	 * again.
	 * @param sessionId the session id
	 */
	public void deregister(String sessionId) {
		if (this.sessions.remove(sessionId) != null) {
			logger.info("Session {} closed", sessionId);
		}
	}

	private void deregister(String sessionId, SessionTransport transport) {
		AtomicBoolean removed = new AtomicBoolean(false);
		this.sessions.computeIfPresent(sessionId, (id, entry) -> {
			// Closing entries are removed by the teardown that claimed them
			if (entry.transport() != transport || entry.closing()) {
				return entry;
			}
			removed.set(true);
			return null;
		});
		if (removed.get()) {
			logger.info("Session {} closed", sessionId);
		}
	}

	/**
	 * Evicts every session idle for longer than the timeout.
	 * @return a Mono emitting the number of evicted sessions
	 */
	public Mono<Integer> evictIdle() {
		return Mono.defer(() -> {
			Instant now = this.clock.instant();
			List<String> ids = new ArrayList<>(this.sessions.keySet());
			return teardown(ids, entry -> entry.isIdle(now, this.sessionTimeout), "expired due to inactivity");
		});
	}

	/**
	 * Tears down one session: closes its transport, then forgets it.
	 * @param sessionId the session id
	 * @return a Mono emitting {@code true} if this call tore the session down
	 */
	public Mono<Boolean> terminate(String sessionId) {
		return Mono.defer(() -> teardown(List.of(sessionId), entry -> true, "terminated").map(count -> count > 0));
	}

	/**
	 * Stops the idle sweep and tears down every session. Close failures are logged and
	 * do not stop the remaining teardowns. No session can be registered afterwards.
	 * @return a Mono completing once all sessions are gone
	 */
	public Mono<Void> closeAll() {
		return Mono.defer(() -> {
			if (this.closed.compareAndSet(false, true)) {
				stopSweep();
			}
			return teardown(new ArrayList<>(this.sessions.keySet()), entry -> true, "closed on shutdown");
		}).doOnSuccess(count -> logger.info("All sessions closed")).then();
	}

	private Mono<Integer> teardown(List<String> ids, Predicate<SessionEntry> condition, String reason) {
		List<Map.Entry<String, SessionEntry>> claimed = new ArrayList<>();
		for (String id : ids) {
			SessionEntry entry = markClosing(id, condition);
			if (entry != null) {
				claimed.add(Map.entry(id, entry));
			}
		}
		if (claimed.isEmpty()) {
			return Mono.just(0);
		}
		return Flux.fromIterable(claimed)
			.flatMap(claim -> closeAndRemove(claim.getKey(), claim.getValue()).doOnSuccess(
					v -> logger.info("Session {} {}", claim.getKey(), reason)))
			.then(Mono.just(claimed.size()));
	}

	/**
	 * Atomically marks a session as closing if it is live and matches the condition.
	 * @return the marked entry, or {@code null} if nothing was marked
	 */
	private SessionEntry markClosing(String sessionId, Predicate<SessionEntry> condition) {
		AtomicReference<SessionEntry> marked = new AtomicReference<>();
		this.sessions.computeIfPresent(sessionId, (id, entry) -> {
			if (entry.closing() || !condition.test(entry)) {
				return entry;
			}
			SessionEntry closing = entry.markClosing();
			marked.set(closing);
			return closing;
		});
		return marked.get();
	}

	private Mono<Void> closeAndRemove(String sessionId, SessionEntry entry) {
		return Mono.defer(() -> entry.transport().closeGracefully())
			.onErrorResume(e -> {
				logger.warn("Failed to close transport of session {}", sessionId, e);
				return Mono.empty();
			})
			.then(Mono.fromRunnable(() -> this.sessions.remove(sessionId, entry)));
	}

	private void runSweep() {
		try {
			Integer evicted = evictIdle().block();
			if (evicted != null && evicted > 0) {
				logger.debug("Idle sweep evicted {} sessions", evicted);
			}
		}
		catch (RuntimeException e) {
			logger.error("Idle session sweep failed", e);
		}
	}

	private void stopSweep() {
		this.sweepExecutor.shutdown();
		try {
			if (!this.sweepExecutor.awaitTermination(SessionDefaults.SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.sweepExecutor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			this.sweepExecutor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

}
