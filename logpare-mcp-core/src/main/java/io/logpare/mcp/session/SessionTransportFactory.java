/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

/**
 * Creates the transport of a new session.
 */
@FunctionalInterface
public interface SessionTransportFactory {

	SessionTransport create(String sessionId);

}
