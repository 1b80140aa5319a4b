/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.spec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.util.Assert;

/**
 * Unchecked exception carrying a JSON-RPC error. Raised for session routing failures
 * and for task or resource lookups that cannot be satisfied.
 */
public class McpError extends RuntimeException {

	private final JsonRpcError jsonRpcError;

	public McpError(JsonRpcError jsonRpcError) {
		super(jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public JsonRpcError getJsonRpcError() {
		return this.jsonRpcError;
	}

	public int code() {
		return this.jsonRpcError.code();
	}

	@Override
	public String toString() {
		return "McpError: " + this.jsonRpcError;
	}

	public static Builder builder(int errorCode) {
		return new Builder(errorCode);
	}

	/**
	 * Session id missing, unknown or expired.
	 * @return the error
	 */
	public static McpError invalidSession() {
		return builder(ErrorCodes.INVALID_SESSION).message("Invalid session").build();
	}

	/**
	 * A message that needs an existing session carried no session id at all.
	 * @return the error
	 */
	public static McpError missingSessionId() {
		return builder(ErrorCodes.INVALID_SESSION).message("Missing session ID").build();
	}

	/**
	 * The error object of a JSON-RPC error reply.
	 *
	 * @param code the error code
	 * @param message a short description of the error
	 * @param data optional additional information
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	public record JsonRpcError( // @formatter:off
		@JsonProperty("code") int code,
		@JsonProperty("message") String message,
		@JsonProperty("data") Object data) { // @formatter:on
	}

	public static class Builder {

		private final int code;

		private String message;

		private Object data;

		private Builder(int code) {
			this.code = code;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder data(Object data) {
			this.data = data;
			return this;
		}

		public McpError build() {
			Assert.hasText(this.message, "message must not be empty");
			return new McpError(new JsonRpcError(this.code, this.message, this.data));
		}

	}

}
