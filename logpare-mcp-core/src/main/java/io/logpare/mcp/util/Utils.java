/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.util;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private static final Pattern LINE_SEPARATOR = Pattern.compile("\\r?\\n");

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Splits raw log text into its non-blank lines.
	 * @param text the log text
	 * @return the non-blank lines, in order
	 */
	public static List<String> nonBlankLines(@Nullable String text) {
		if (text == null || text.isEmpty()) {
			return List.of();
		}
		return Arrays.stream(LINE_SEPARATOR.split(text)).filter(Utils::hasText).toList();
	}

}
