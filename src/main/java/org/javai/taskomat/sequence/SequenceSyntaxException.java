package org.javai.taskomat.sequence;

/**
 * Structural error attributed to a single step of a sequence.
 * <p>
 * The message has the form {@code [syntax check] Step 7: CATCH without matching TRY}.
 */
public class SequenceSyntaxException extends SequenceException {

	private final int stepNumber;
	private final String reason;

	/**
	 * @param stepNumber 1-based position of the offending step within the whole sequence
	 * @param reason description of the violation
	 */
	public SequenceSyntaxException(int stepNumber, String reason) {
		super("[syntax check] Step " + stepNumber + ": " + reason);
		this.stepNumber = stepNumber;
		this.reason = reason;
	}

	/**
	 * 1-based position of the offending step.
	 */
	public int getStepNumber() {
		return stepNumber;
	}

	/**
	 * The violation without the step prefix, e.g. {@code "Duplicate ELSE clause"}.
	 */
	public String getReason() {
		return reason;
	}
}
