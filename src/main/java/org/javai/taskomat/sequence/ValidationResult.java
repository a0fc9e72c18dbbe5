package org.javai.taskomat.sequence;

/**
 * Outcome of validating a sequence.
 *
 * @param valid whether the sequence is well-nested and may be executed
 * @param stepNumber 1-based position of the offending step, or 0 if the problem concerns
 *            the sequence as a whole or there is none
 * @param message diagnostic text, empty when valid
 */
public record ValidationResult(boolean valid, int stepNumber, String message) {

	public ValidationResult {
		message = message != null ? message : "";
	}

	public static ValidationResult success() {
		return new ValidationResult(true, 0, "");
	}

	public static ValidationResult failure(SequenceException e) {
		int stepNumber = e instanceof SequenceSyntaxException syntaxError ? syntaxError.getStepNumber() : 0;
		return new ValidationResult(false, stepNumber, e.getMessage());
	}
}
