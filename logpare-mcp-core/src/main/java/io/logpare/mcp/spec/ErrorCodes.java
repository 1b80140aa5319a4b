/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.spec;

/**
 * Error codes used in JSON-RPC error replies produced by the server.
 */
public final class ErrorCodes {

	private ErrorCodes() {
	}

	/**
	 * Invalid JSON was received.
	 */
	public static final int PARSE_ERROR = -32700;

	/**
	 * The JSON sent is not a valid Request object.
	 */
	public static final int INVALID_REQUEST = -32600;

	/**
	 * Invalid method parameter(s).
	 */
	public static final int INVALID_PARAMS = -32602;

	/**
	 * Internal JSON-RPC error.
	 */
	public static final int INTERNAL_ERROR = -32603;

	/**
	 * The presented session id is missing, unknown or expired. The client has to
	 * initialize a new session.
	 */
	public static final int INVALID_SESSION = -32000;

	/**
	 * Authentication required.
	 */
	public static final int UNAUTHORIZED = -32001;

	/**
	 * Resource not found.
	 */
	public static final int RESOURCE_NOT_FOUND = -32002;

	/**
	 * The caller lacks a required scope. Shares its value with
	 * {@link #RESOURCE_NOT_FOUND}.
	 */
	public static final int INSUFFICIENT_SCOPE = -32002;

}
