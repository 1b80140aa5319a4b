/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Registry entry of one session. Entries are replaced, never mutated.
 *
 * @param transport the session's transport
 * @param lastActivity time of the last message bearing the session id
 * @param closing whether teardown has begun
 */
record SessionEntry(SessionTransport transport, Instant lastActivity, boolean closing) {

	SessionEntry touched(Instant now) {
		return now.isAfter(this.lastActivity) ? new SessionEntry(this.transport, now, this.closing) : this;
	}

	SessionEntry markClosing() {
		return new SessionEntry(this.transport, this.lastActivity, true);
	}

	boolean isIdle(Instant now, Duration timeout) {
		return Duration.between(this.lastActivity, now).compareTo(timeout) > 0;
	}

}
