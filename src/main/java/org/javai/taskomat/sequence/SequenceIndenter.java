package org.javai.taskomat.sequence;

import java.util.List;
import java.util.Optional;
import org.javai.taskomat.step.Step;
import org.javai.taskomat.step.StepType;

/**
 * Assigns an indentation level to every step of a sequence in a single forward pass.
 * <p>
 * The pass never throws on malformed input. Levels are clamped to the valid range so that
 * every step still receives one, and only the first problem is reported. The result
 * depends only on the order of step types, so indenting twice gives the same levels.
 */
public class SequenceIndenter {

	static final String NOT_NESTED_CORRECTLY = "Steps are not nested correctly";

	static final String EXCESS_END = NOT_NESTED_CORRECTLY
			+ " (every END must correspond to one IF, TRY, or WHILE)";

	static final String MISSING_END = NOT_NESTED_CORRECTLY
			+ " (there must be one END for each IF, TRY, WHILE)";

	static final String NESTED_TOO_DEEPLY = "Steps are nested too deeply (max. level: "
			+ Step.MAX_INDENTATION_LEVEL + ")";

	/**
	 * Indents the given steps in place.
	 *
	 * @param steps the steps in sequence order
	 * @return the first nesting error, or empty if the nesting is consistent
	 */
	public Optional<String> indent(List<Step> steps) {
		String error = null;
		int level = 0;

		for (int i = 0; i < steps.size(); i++) {
			Step step = steps.get(i);
			StepType type = step.getType();

			int stepLevel = switch (type) {
				case ACTION, IF, WHILE, TRY -> level;
				case ELSE_IF, ELSE, CATCH, END -> level - 1;
			};
			level += depthChange(type);

			if (stepLevel < 0) {
				stepLevel = 0;
				if (error == null) {
					error = NOT_NESTED_CORRECTLY + " (Step " + (i + 1) + ": "
							+ SyntaxChecker.unmatchedMessage(type) + ")";
				}
			}

			step.setIndentationLevel(stepLevel);

			if (level < 0) {
				level = 0;
				if (error == null) {
					error = EXCESS_END;
				}
			}
			else if (level > Step.MAX_INDENTATION_LEVEL) {
				level = Step.MAX_INDENTATION_LEVEL;
				if (error == null) {
					error = NESTED_TOO_DEEPLY;
				}
			}
		}

		if (level != 0 && error == null) {
			error = MISSING_END;
		}

		return Optional.ofNullable(error);
	}

	private static int depthChange(StepType type) {
		return switch (type) {
			case IF, WHILE, TRY -> 1;
			case END -> -1;
			case ACTION, ELSE_IF, ELSE, CATCH -> 0;
		};
	}
}
