package org.javai.syntax.grammar.compile;

import java.util.Locale;

/**
 * Case conversions between grammar names and generated identifiers.
 */
public final class Names {

	private Names() {
	}

	/**
	 * {@code RecordExprFieldList} to {@code record_expr_field_list}.
	 */
	public static String snake(String camel) {
		StringBuilder sb = new StringBuilder(camel.length() + 8);
		for (int i = 0; i < camel.length(); i++) {
			char c = camel.charAt(i);
			if (Character.isUpperCase(c)) {
				boolean afterLower = i > 0 && (Character.isLowerCase(camel.charAt(i - 1))
						|| Character.isDigit(camel.charAt(i - 1)));
				boolean endOfAcronym = i > 0 && Character.isUpperCase(camel.charAt(i - 1))
						&& i + 1 < camel.length() && Character.isLowerCase(camel.charAt(i + 1));
				if (afterLower || endOfAcronym) {
					sb.append('_');
				}
				sb.append(Character.toLowerCase(c));
			} else {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * {@code RecordExprFieldList} to {@code RECORD_EXPR_FIELD_LIST}.
	 */
	public static String upperSnake(String name) {
		return snake(name).toUpperCase(Locale.ROOT);
	}

	/**
	 * {@code else_branch} to {@code elseBranch}.
	 */
	public static String camel(String snake) {
		StringBuilder sb = new StringBuilder(snake.length());
		boolean upper = false;
		for (int i = 0; i < snake.length(); i++) {
			char c = snake.charAt(i);
			if (c == '_') {
				upper = sb.length() > 0;
			} else if (upper) {
				sb.append(Character.toUpperCase(c));
				upper = false;
			} else {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * {@code else_branch} to {@code ElseBranch}.
	 */
	public static String pascal(String snake) {
		String camel = camel(snake);
		return camel.isEmpty() ? camel : Character.toUpperCase(camel.charAt(0)) + camel.substring(1);
	}

	/**
	 * English plural of the last word: {@code +es} after s, x, ch and sh, {@code +s} otherwise.
	 */
	public static String plural(String word) {
		if (word.endsWith("s") || word.endsWith("x") || word.endsWith("ch") || word.endsWith("sh")) {
			return word + "es";
		}
		return word + "s";
	}
}
