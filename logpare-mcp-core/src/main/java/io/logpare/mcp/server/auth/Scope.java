/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server.auth;

/**
 * Authorization scopes of the server's operations.
 */
public enum Scope {

	/**
	 * List available operations and metadata.
	 */
	DISCOVER("logs:discover"),

	/**
	 * Run log compression.
	 */
	COMPRESS("logs:compress"),

	/**
	 * Read full compression results through resources.
	 */
	EXPORT("logs:export");

	private final String value;

	Scope(String value) {
		this.value = value;
	}

	public String value() {
		return this.value;
	}

	@Override
	public String toString() {
		return this.value;
	}

}
