package org.javai.taskomat.sequence;

import java.util.List;
import org.javai.taskomat.step.Step;

/**
 * Boundary scan over indented steps. This is the only place where the syntax check does
 * arithmetic on indentation levels.
 */
final class IndentedBlocks {

	private IndentedBlocks() {
	}

	/**
	 * Returns the index of the first step in {@code [from, to)} whose indentation level is
	 * below {@code minLevel}, or {@code to} if every step in the range is indented at least
	 * that deep.
	 */
	static int findEndOfIndentedBlock(List<Step> steps, int from, int to, int minLevel) {
		for (int i = from; i < to; i++) {
			if (steps.get(i).getIndentationLevel() < minLevel) {
				return i;
			}
		}
		return to;
	}
}
