package org.javai.taskomat.sequence;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-throwing entry point that indents a sequence and checks its syntax.
 * <p>
 * Callers must not execute a sequence unless the result is valid.
 */
public class SequenceValidator {

	private static final Logger logger = LoggerFactory.getLogger(SequenceValidator.class);

	private final SyntaxChecker syntaxChecker;

	public SequenceValidator() {
		this(new SyntaxChecker());
	}

	public SequenceValidator(SyntaxChecker syntaxChecker) {
		this.syntaxChecker = Objects.requireNonNull(syntaxChecker, "syntaxChecker must not be null");
	}

	public ValidationResult validate(Sequence sequence) {
		Objects.requireNonNull(sequence, "sequence must not be null");

		sequence.indent();

		var indentationError = sequence.getIndentationError();
		if (indentationError.isPresent()) {
			logger.warn("Sequence '{}' is not nested correctly: {}", sequence.getLabel(), indentationError.get());
			return ValidationResult.failure(new SequenceException(indentationError.get()));
		}

		try {
			syntaxChecker.check(sequence.getSteps());
		} catch (SequenceSyntaxException e) {
			logger.warn("Sequence '{}' failed the syntax check: {}", sequence.getLabel(), e.getMessage());
			return ValidationResult.failure(e);
		}

		logger.debug("Sequence '{}' with {} steps is valid", sequence.getLabel(), sequence.size());
		return ValidationResult.success();
	}
}
