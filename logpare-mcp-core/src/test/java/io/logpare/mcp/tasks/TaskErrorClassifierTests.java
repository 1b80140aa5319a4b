/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link TaskErrorClassifier}.
 */
class TaskErrorClassifierTests {

	@ParameterizedTest
	@CsvSource(delimiter = '|', textBlock = """
			Input is empty                      | INVALID_INPUT
			invalid log format on line 3        | INVALID_INPUT
			Java heap space exhausted           | INPUT_TOO_LARGE
			out of memory while clustering      | INPUT_TOO_LARGE
			unexpected end of stream            | COMPRESSION_FAILED
			Invalid token                       | COMPRESSION_FAILED
			Empty file                          | COMPRESSION_FAILED
			""")
	void testClassifiesByMessage(String message, String expectedCode) {
		TaskError error = TaskErrorClassifier.classify(new IllegalStateException(message));

		assertThat(error.code()).isEqualTo(expectedCode);
		assertThat(error.message()).isEqualTo(message);
	}

	@Test
	void testInvalidInputTakesPrecedenceOverMemory() {
		TaskError error = TaskErrorClassifier.classify(new RuntimeException("invalid memory address"));

		assertThat(error.code()).isEqualTo(TaskErrorCodes.INVALID_INPUT);
	}

	@Test
	void testOutOfMemoryErrorWithoutMessageKeyword() {
		TaskError error = TaskErrorClassifier.classify(new OutOfMemoryError("GC overhead limit exceeded"));

		assertThat(error.code()).isEqualTo(TaskErrorCodes.INPUT_TOO_LARGE);
	}

	@Test
	void testStackOverflowIsInputTooLarge() {
		TaskError error = TaskErrorClassifier.classify(new StackOverflowError());

		assertThat(error.code()).isEqualTo(TaskErrorCodes.INPUT_TOO_LARGE);
		assertThat(error.message()).isEqualTo("Unknown error");
	}

	@Test
	void testMissingMessage() {
		TaskError error = TaskErrorClassifier.classify(new IllegalStateException());

		assertThat(error.code()).isEqualTo(TaskErrorCodes.COMPRESSION_FAILED);
		assertThat(error.message()).isEqualTo("Unknown error");
	}

}
