/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

import io.logpare.mcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * A message received from a client, before it is bound to a session.
 *
 * @param sessionId the session id the client presented, or {@code null}
 * @param kind what the message asks for
 * @param body the raw message payload, or {@code null} when there is none
 */
public record InboundMessage(@Nullable String sessionId, MessageKind kind, @Nullable String body) {

	public InboundMessage {
		Assert.notNull(kind, "kind must not be null");
	}

	public static InboundMessage initialize(String body) {
		return new InboundMessage(null, MessageKind.INITIALIZE, body);
	}

	public static InboundMessage request(@Nullable String sessionId, String body) {
		return new InboundMessage(sessionId, MessageKind.REQUEST, body);
	}

	public static InboundMessage stream(@Nullable String sessionId) {
		return new InboundMessage(sessionId, MessageKind.STREAM, null);
	}

	public static InboundMessage terminate(@Nullable String sessionId) {
		return new InboundMessage(sessionId, MessageKind.TERMINATE, null);
	}

}
