/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

import reactor.util.annotation.Nullable;

/**
 * The reply of a session transport to a routed message.
 *
 * @param sessionId the session that handled the message
 * @param body the reply payload, or {@code null} if the message needs no reply
 */
public record RoutedReply(String sessionId, @Nullable String body) {

}
