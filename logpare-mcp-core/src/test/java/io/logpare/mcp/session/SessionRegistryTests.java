/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

import static io.logpare.mcp.tasks.TaskTestUtils.runConcurrent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import io.logpare.mcp.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

/**
 * Tests for {@link SessionRegistry}.
 */
class SessionRegistryTests {

	private MutableClock clock;

	private SessionRegistry registry;

	@BeforeEach
	void setUp() {
		clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
		registry = SessionRegistry.builder().clock(clock).build();
	}

	@AfterEach
	void tearDown() {
		registry.closeAll().block();
	}

	private RecordingSessionTransport register(String sessionId) {
		RecordingSessionTransport transport = new RecordingSessionTransport(sessionId);
		assertThat(registry.register(sessionId, transport)).isTrue();
		return transport;
	}

	@Test
	void testRegisterAndFind() {
		RecordingSessionTransport transport = register("s1");

		assertThat(registry.find("s1")).containsSame(transport);
		assertThat(registry.find("unknown")).isEmpty();
		assertThat(registry.find(null)).isEmpty();
		assertThat(registry.count()).isEqualTo(1);
	}

	@Test
	void testDuplicateIdIsRejected() {
		RecordingSessionTransport first = register("s1");

		assertThat(registry.register("s1", new RecordingSessionTransport("s1"))).isFalse();
		assertThat(registry.find("s1")).containsSame(first);
	}

	@Test
	void testRemoteCloseDeregisters() {
		RecordingSessionTransport transport = register("s1");

		transport.simulateRemoteClose();

		assertThat(registry.find("s1")).isEmpty();
		assertThat(registry.count()).isZero();
		assertThat(transport.closeCalls()).isZero();
	}

	@Test
	void testStaleCloseCallbackDoesNotRemoveNewerTransport() {
		RecordingSessionTransport old = register("s1");
		registry.deregister("s1");
		RecordingSessionTransport current = register("s1");

		old.simulateRemoteClose();

		assertThat(registry.find("s1")).containsSame(current);
	}

	// ------------------------------------------
	// Idle eviction
	// ------------------------------------------

	@Test
	void testIdleSessionIsEvicted() {
		RecordingSessionTransport idle = register("idle");
		RecordingSessionTransport active = register("active");

		clock.advance(Duration.ofMinutes(20));
		registry.touch("active");
		clock.advance(Duration.ofMinutes(10).plusMillis(1));

		StepVerifier.create(registry.evictIdle()).expectNext(1).verifyComplete();

		assertThat(idle.closeCalls()).isEqualTo(1);
		assertThat(active.closeCalls()).isZero();
		assertThat(registry.find("idle")).isEmpty();
		assertThat(registry.find("active")).containsSame(active);
	}

	@Test
	void testSessionAtExactTimeoutIsKept() {
		register("s1");

		clock.advance(Duration.ofMillis(SessionDefaults.SESSION_TIMEOUT_MS));

		StepVerifier.create(registry.evictIdle()).expectNext(0).verifyComplete();
		assertThat(registry.count()).isEqualTo(1);
	}

	@Test
	void testCloseFailureDuringEvictionStillRemovesSession() {
		RecordingSessionTransport broken = new RecordingSessionTransport("broken")
			.failingOnClose(new IllegalStateException("socket gone"));
		registry.register("broken", broken);
		RecordingSessionTransport healthy = register("healthy");

		clock.advance(Duration.ofHours(1));

		StepVerifier.create(registry.evictIdle()).expectNext(2).verifyComplete();
		assertThat(broken.closeCalls()).isEqualTo(1);
		assertThat(healthy.closeCalls()).isEqualTo(1);
		assertThat(registry.count()).isZero();
	}

	@Test
	void testBackgroundSweepEvictsIdleSessions() {
		SessionRegistry fast = SessionRegistry.builder()
			.sessionTimeout(Duration.ofMillis(50))
			.sweepInterval(Duration.ofMillis(25))
			.build();
		try {
			RecordingSessionTransport transport = new RecordingSessionTransport("s1");
			fast.register("s1", transport);

			await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
				assertThat(fast.count()).isZero();
				assertThat(transport.closeCalls()).isEqualTo(1);
			});
		}
		finally {
			fast.closeAll().block();
		}
	}

	// ------------------------------------------
	// Termination
	// ------------------------------------------

	@Test
	void testTerminate() {
		RecordingSessionTransport transport = register("s1");

		StepVerifier.create(registry.terminate("s1")).expectNext(true).verifyComplete();
		StepVerifier.create(registry.terminate("s1")).expectNext(false).verifyComplete();

		assertThat(transport.closeCalls()).isEqualTo(1);
		assertThat(registry.find("s1")).isEmpty();
	}

	@Test
	void testConcurrentTeardownClosesExactlyOnce() throws InterruptedException {
		RecordingSessionTransport transport = register("s1");
		clock.advance(Duration.ofHours(1));
		AtomicInteger terminated = new AtomicInteger();

		runConcurrent(60, 12, i -> {
			switch (i % 3) {
				case 0 -> {
					if (Boolean.TRUE.equals(registry.terminate("s1").block())) {
						terminated.incrementAndGet();
					}
				}
				case 1 -> terminated.addAndGet(registry.evictIdle().block());
				default -> registry.closeAll().block();
			}
		});

		assertThat(transport.closeCalls()).isEqualTo(1);
		assertThat(terminated.get()).isLessThanOrEqualTo(1);
		assertThat(registry.count()).isZero();
	}

	@Test
	void testCloseAllClosesEverySessionAndRejectsNewOnes() {
		RecordingSessionTransport broken = new RecordingSessionTransport("a")
			.failingOnClose(new IllegalStateException("boom"));
		registry.register("a", broken);
		RecordingSessionTransport b = register("b");
		RecordingSessionTransport c = register("c");

		StepVerifier.create(registry.closeAll()).verifyComplete();

		assertThat(broken.closeCalls()).isEqualTo(1);
		assertThat(b.closeCalls()).isEqualTo(1);
		assertThat(c.closeCalls()).isEqualTo(1);
		assertThat(registry.count()).isZero();
		assertThat(registry.register("d", new RecordingSessionTransport("d"))).isFalse();
	}

}
