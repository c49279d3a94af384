package org.javai.syntax.rust.search;

import java.util.Optional;

import org.javai.syntax.tree.TextRange;

/**
 * Why a rule did or did not match one code node.
 *
 * @param range range of the code node
 * @param nodeText text of the code node
 * @param ruleIndex index of the rule that was tried
 * @param failureReason empty if the rule matched
 */
public record MatchDebugInfo(TextRange range, String nodeText, int ruleIndex, Optional<String> failureReason) {

	public boolean matched() {
		return failureReason.isEmpty();
	}
}
