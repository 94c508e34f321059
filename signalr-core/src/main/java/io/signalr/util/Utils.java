/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.util;

import java.net.URI;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous string and URI helpers.
 */
public final class Utils {

	private Utils() {
	}

	public static boolean hasText(@Nullable String str) {
		return str != null && !str.trim().isEmpty();
	}

	/**
	 * Appends a path segment to a base address, keeping the query string of the base
	 * address intact. {@code http://host/hub?x=1} plus {@code negotiate} becomes
	 * {@code http://host/hub/negotiate?x=1}.
	 * @param baseAddress the base address
	 * @param segment the segment to append, without leading slash
	 * @return the resulting URI
	 */
	public static URI appendPath(String baseAddress, String segment) {
		int queryStart = baseAddress.indexOf('?');
		String path = queryStart < 0 ? baseAddress : baseAddress.substring(0, queryStart);
		String query = queryStart < 0 ? "" : baseAddress.substring(queryStart);
		String joined = path.endsWith("/") ? path + segment : path + "/" + segment;
		return URI.create(joined + query);
	}

	/**
	 * Replaces the raw query of a URI. A {@code null} or empty query removes it.
	 * @param uri the URI
	 * @param rawQuery the already encoded query, without leading {@code ?}
	 * @return the resulting URI
	 */
	public static URI withRawQuery(URI uri, @Nullable String rawQuery) {
		String text = uri.toString();
		int queryStart = text.indexOf('?');
		String base = queryStart < 0 ? text : text.substring(0, queryStart);
		return hasText(rawQuery) ? URI.create(base + "?" + rawQuery) : URI.create(base);
	}

}
