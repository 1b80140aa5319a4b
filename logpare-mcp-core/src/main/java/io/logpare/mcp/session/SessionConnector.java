/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

import reactor.core.publisher.Mono;

/**
 * Attaches the protocol server to a freshly created transport. A session only becomes
 * visible once its transport has been connected.
 */
@FunctionalInterface
public interface SessionConnector {

	/**
	 * Connects the server to the transport.
	 * @param transport the new transport
	 * @return a Mono completing when connected, or failing if the session cannot be
	 * initialized
	 */
	Mono<Void> connect(SessionTransport transport);

}
