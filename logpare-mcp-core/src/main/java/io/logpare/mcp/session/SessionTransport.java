/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

import reactor.core.publisher.Mono;

/**
 * The per-session connection to the protocol layer. A transport is owned by exactly one
 * session from registration until it is closed.
 */
public interface SessionTransport {

	String sessionId();

	/**
	 * Delivers a client message to the protocol layer.
	 * @param message the message
	 * @return a Mono emitting the reply payload, or empty if the message needs none
	 */
	Mono<String> handleMessage(InboundMessage message);

	/**
	 * Closes the transport, letting in-flight work finish. Closing an already closed
	 * transport has no effect.
	 * @return a Mono completing once the transport is closed
	 */
	Mono<Void> closeGracefully();

	/**
	 * Registers a callback run when the transport closes, whoever closed it.
	 * @param callback the callback
	 */
	void onClose(Runnable callback);

}
