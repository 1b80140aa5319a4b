/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

import reactor.util.annotation.Nullable;

/**
 * A progress report emitted by the compressor.
 *
 * @param currentPhase the phase the compressor is in
 * @param processedLines lines processed so far
 * @param totalLines total lines, when known
 * @param percentComplete percentage computed by the compressor, when it provides one
 */
public record ProgressEvent(ProgressPhase currentPhase, int processedLines, @Nullable Integer totalLines,
		@Nullable Integer percentComplete) {

	public ProgressEvent(ProgressPhase currentPhase, int processedLines, @Nullable Integer totalLines) {
		this(currentPhase, processedLines, totalLines, null);
	}

}
