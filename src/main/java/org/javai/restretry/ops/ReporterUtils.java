package org.javai.restretry.ops;

import java.util.Map;
import java.util.TreeMap;

/**
 * Shared formatting helpers for FailureReporter implementations.
 */
public final class ReporterUtils {

	private ReporterUtils() {
		// Utility class
	}

	/**
	 * Escapes a value for use inside a JSON string literal. Quotes, backslashes and every
	 * control character below U+0020 are escaped.
	 */
	public static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(s.length() + 8);
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				case '\b' -> sb.append("\\b");
				case '\f' -> sb.append("\\f");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}

	/**
	 * Formats tags as {@code k1=v1, k2=v2}, sorted by key so output is stable.
	 * Returns an empty string for null or empty tags.
	 */
	public static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, String> e : new TreeMap<>(tags).entrySet()) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			sb.append(e.getKey()).append('=').append(e.getValue());
		}
		return sb.toString();
	}
}
