/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 *
 * @author Christian Tzolov
 */

public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty. Otherwise,
	 * return {@code false}.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Encode parameters as {@code application/x-www-form-urlencoded}, preserving the
	 * iteration order of the map.
	 * @param params the parameters
	 * @return the encoded form body
	 */
	public static String formEncode(Map<String, String> params) {
		StringBuilder result = new StringBuilder();
		boolean first = true;

		for (Map.Entry<String, String> entry : params.entrySet()) {
			if (!first) {
				result.append("&");
			}
			first = false;

			result.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8));
			result.append("=");
			result.append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
		}

		return result.toString();
	}

	/**
	 * Strip the {@link CompletionException} and {@link ExecutionException} wrappers that
	 * {@code CompletableFuture} adds around the actual failure.
	 * @param throwable the failure as observed on a future
	 * @return the innermost cause that is not a wrapper
	 */
	public static Throwable unwrap(Throwable throwable) {
		Throwable current = throwable;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	/**
	 * Replace {@code {name}} placeholders in the template with the given values.
	 * Unknown placeholders are left untouched.
	 * @param template the template, may be {@code null}
	 * @param values placeholder values keyed by name
	 * @return the expanded template, or {@code null} if the template was {@code null}
	 */
	@Nullable
	public static String expand(@Nullable String template, Map<String, String> values) {
		if (template == null) {
			return null;
		}
		String result = template;
		for (Map.Entry<String, String> entry : values.entrySet()) {
			if (entry.getValue() != null) {
				result = result.replace("{" + entry.getKey() + "}", entry.getValue());
			}
		}
		return result;
	}

}
