package org.javai.syntax.rust.search;

import java.util.Optional;

/**
 * Signals that a pattern does not match the code being tried. Carries a reason only while
 * failure reasons are being recorded; never leaves the search package.
 */
final class MatchFailed extends Exception {

	private static final long serialVersionUID = 1L;

	private final String reason;

	MatchFailed(String reason) {
		super(reason, null, false, false);
		this.reason = reason;
	}

	Optional<String> reason() {
		return Optional.ofNullable(reason);
	}
}
