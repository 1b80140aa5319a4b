/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

/**
 * What an inbound message asks of the session layer.
 */
public enum MessageKind {

	/**
	 * Opens a new session. Only valid without a session id.
	 */
	INITIALIZE,

	/**
	 * Any other client message on an existing session.
	 */
	REQUEST,

	/**
	 * Opens the server-to-client event stream of an existing session.
	 */
	STREAM,

	/**
	 * Ends an existing session.
	 */
	TERMINATE

}
