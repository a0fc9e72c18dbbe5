package org.javai.taskomat.sequence;

import java.util.List;
import org.javai.taskomat.step.Step;
import org.javai.taskomat.step.StepType;

/**
 * Recursive-descent check of the block structure of an indented step list.
 * <p>
 * The steps are treated as a flat token stream:
 *
 * <pre>
 * sequence := body
 * body     := (ACTION | if | while | try)*
 * if       := IF body (ELSE_IF body)* (ELSE body)? END
 * while    := WHILE body END
 * try      := TRY body CATCH body END
 * </pre>
 *
 * Block boundaries are not searched by counting openers and closers but by looking for
 * the next step that is indented less deeply than the block body, so the list must have
 * been indented by {@link SequenceIndenter} without errors beforehand.
 * <p>
 * Each recursion level corresponds to one nesting level; the recursion depth is therefore
 * bounded by {@link Step#MAX_INDENTATION_LEVEL}. The checker is stateless and can be
 * shared.
 */
public class SyntaxChecker {

	/**
	 * Checks the whole step list.
	 *
	 * @param steps indented steps in sequence order
	 * @throws SequenceSyntaxException at the first violation, in left-to-right order
	 */
	public void check(List<Step> steps) {
		checkBody(steps, 0, steps.size());
	}

	/**
	 * Diagnostic for a clause or END step that is not preceded by a matching opener.
	 */
	static String unmatchedMessage(StepType type) {
		return switch (type) {
			case CATCH -> "CATCH without matching TRY";
			case ELSE_IF -> "ELSE IF without matching IF";
			case ELSE -> "ELSE without matching IF";
			case END -> "END without matching IF/WHILE/TRY";
			case ACTION, IF, WHILE, TRY -> throw new IllegalArgumentException(
					type.keyword() + " cannot be unmatched");
		};
	}

	private void checkBody(List<Step> steps, int begin, int end) {
		int index = begin;

		while (index < end) {
			StepType type = steps.get(index).getType();
			index = switch (type) {
				case ACTION -> index + 1;
				case WHILE -> checkWhile(steps, index, end);
				case TRY -> checkTry(steps, index, end);
				case IF -> checkIf(steps, index, end);
				case CATCH, ELSE_IF, ELSE, END -> throw syntaxError(index, unmatchedMessage(type));
			};
		}
	}

	/**
	 * @return index of the first step after the matching END
	 */
	private int checkWhile(List<Step> steps, int begin, int end) {
		int minLevel = steps.get(begin).getIndentationLevel() + 1;
		int blockEnd = IndentedBlocks.findEndOfIndentedBlock(steps, begin + 1, end, minLevel);

		if (blockEnd == end || steps.get(blockEnd).getType() != StepType.END) {
			throw syntaxError(begin, "WHILE without matching END");
		}

		checkBody(steps, begin + 1, blockEnd);

		return blockEnd + 1;
	}

	private int checkTry(List<Step> steps, int begin, int end) {
		int minLevel = steps.get(begin).getIndentationLevel() + 1;
		int catchIndex = IndentedBlocks.findEndOfIndentedBlock(steps, begin + 1, end, minLevel);

		if (catchIndex == end || steps.get(catchIndex).getType() != StepType.CATCH) {
			throw syntaxError(begin, "TRY without matching CATCH");
		}

		checkBody(steps, begin + 1, catchIndex);

		int blockEnd = IndentedBlocks.findEndOfIndentedBlock(steps, catchIndex + 1, end, minLevel);

		if (blockEnd == end || steps.get(blockEnd).getType() != StepType.END) {
			throw syntaxError(begin, "TRY...CATCH without matching END");
		}

		checkBody(steps, catchIndex + 1, blockEnd);

		return blockEnd + 1;
	}

	private int checkIf(List<Step> steps, int begin, int end) {
		int minLevel = steps.get(begin).getIndentationLevel() + 1;
		boolean elseFound = false;
		int clauseStart = begin;

		while (true) {
			int boundary = IndentedBlocks.findEndOfIndentedBlock(steps, clauseStart + 1, end, minLevel);

			if (boundary == end) {
				throw syntaxError(begin, "IF without matching END");
			}

			checkBody(steps, clauseStart + 1, boundary);

			switch (steps.get(boundary).getType()) {
				case ELSE_IF -> {
					if (elseFound) {
						throw syntaxError(boundary, "ELSE IF after ELSE clause");
					}
				}
				case ELSE -> {
					if (elseFound) {
						throw syntaxError(boundary, "Duplicate ELSE clause");
					}
					elseFound = true;
				}
				case END -> {
					return boundary + 1;
				}
				case ACTION, IF, WHILE, TRY, CATCH -> throw syntaxError(boundary, "Unfinished IF construct");
			}

			clauseStart = boundary;
		}
	}

	private static SequenceSyntaxException syntaxError(int index, String reason) {
		return new SequenceSyntaxException(index + 1, reason);
	}
}
