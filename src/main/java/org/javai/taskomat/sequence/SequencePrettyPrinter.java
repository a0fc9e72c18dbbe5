package org.javai.taskomat.sequence;

import org.javai.taskomat.step.Step;

/**
 * Renders a sequence as a numbered listing indented by the steps' indentation levels.
 *
 * <pre>
 * 1 TRY
 * 2     ACTION open valve
 * 3 CATCH
 * 4 END
 * </pre>
 */
public class SequencePrettyPrinter {

	private final int indentSize;

	public SequencePrettyPrinter() {
		this(4);
	}

	public SequencePrettyPrinter(int indentSize) {
		if (indentSize < 0) {
			throw new IllegalArgumentException("indentSize must not be negative");
		}
		this.indentSize = indentSize;
	}

	public String print(Sequence sequence) {
		int numberWidth = String.valueOf(sequence.size()).length();
		StringBuilder output = new StringBuilder();

		int stepNumber = 1;
		for (Step step : sequence.getSteps()) {
			if (output.length() > 0) {
				output.append('\n');
			}
			output.append(String.format("%" + numberWidth + "d ", stepNumber++));
			output.append(" ".repeat(step.getIndentationLevel() * indentSize));
			output.append(step.getType().keyword());
			if (!step.getLabel().isEmpty()) {
				output.append(' ').append(step.getLabel());
			}
		}

		return output.toString();
	}

	/**
	 * Static convenience method using the default indent size.
	 */
	public static String listing(Sequence sequence) {
		return new SequencePrettyPrinter().print(sequence);
	}
}
