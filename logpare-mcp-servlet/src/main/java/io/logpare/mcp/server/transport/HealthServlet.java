/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logpare.mcp.server.LogpareServer;
import io.logpare.mcp.session.SessionRegistry;
import io.logpare.mcp.util.Assert;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Liveness endpoint reporting the number of live sessions as
 * {@code {"status":"ok","sessions":N}}.
 */
public class HealthServlet extends HttpServlet {

	private final transient SessionRegistry sessionRegistry;

	private final transient ObjectMapper objectMapper;

	public HealthServlet(LogpareServer server) {
		this(server.sessionRegistry(), server.objectMapper());
	}

	public HealthServlet(SessionRegistry sessionRegistry, ObjectMapper objectMapper) {
		Assert.notNull(sessionRegistry, "sessionRegistry must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.sessionRegistry = sessionRegistry;
		this.objectMapper = objectMapper;
	}

	@Override
	protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
		Map<String, Object> health = new LinkedHashMap<>();
		health.put("status", "ok");
		health.put("sessions", this.sessionRegistry.count());
		resp.setStatus(HttpServletResponse.SC_OK);
		resp.setContentType("application/json");
		resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
		resp.getWriter().write(this.objectMapper.writeValueAsString(health));
		resp.getWriter().flush();
	}

}
