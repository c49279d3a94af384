package org.javai.syntax.tree;

/**
 * Half-open range {@code [start, end)} of character offsets in the source text.
 */
public record TextRange(int start, int end) {

	public TextRange {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid text range " + start + ".." + end);
		}
	}

	public static TextRange of(int start, int length) {
		return new TextRange(start, start + length);
	}

	public int length() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}

	public boolean contains(int offset) {
		return start <= offset && offset < end;
	}

	public boolean contains(TextRange other) {
		return start <= other.start && other.end <= end;
	}

	/**
	 * The smallest range containing both ranges.
	 */
	public TextRange cover(TextRange other) {
		return new TextRange(Math.min(start, other.start), Math.max(end, other.end));
	}

	/**
	 * The characters of {@code source} covered by this range.
	 */
	public String slice(CharSequence source) {
		return source.subSequence(start, end).toString();
	}

	@Override
	public String toString() {
		return start + ".." + end;
	}
}
