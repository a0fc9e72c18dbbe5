package org.javai.taskomat.sequence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.taskomat.step.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A labelled, ordered list of steps.
 * <p>
 * Steps are appended with {@link #addStep(Step)}, which keeps the indentation of all steps
 * current. Whether the steps form a well-nested program is checked on demand with
 * {@link #checkSyntax()}. Mutating a step after it was added (e.g. changing its type)
 * invalidates both; call {@link #indent()} again before checking.
 * <p>
 * Instances are not thread-safe.
 */
public class Sequence {

	private static final Logger logger = LoggerFactory.getLogger(Sequence.class);

	/**
	 * Maximum number of characters in a sequence label.
	 */
	public static final int MAX_LABEL_LENGTH = 64;

	private static final SequenceIndenter INDENTER = new SequenceIndenter();
	private static final SyntaxChecker SYNTAX_CHECKER = new SyntaxChecker();

	private final List<Step> steps = new ArrayList<>();
	private String label;
	private String indentationError;

	/**
	 * @param label descriptive name, 1 to {@link #MAX_LABEL_LENGTH} characters
	 * @throws SequenceException if the label is empty or too long
	 */
	public Sequence(String label) {
		checkLabel(label);
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		checkLabel(label);
		this.label = label;
	}

	/**
	 * Appends a step and re-indents the sequence.
	 */
	public void addStep(Step step) {
		steps.add(Objects.requireNonNull(step, "step must not be null"));
		indent();
	}

	/**
	 * Read-only view of the steps in sequence order.
	 */
	public List<Step> getSteps() {
		return Collections.unmodifiableList(steps);
	}

	public int size() {
		return steps.size();
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	/**
	 * Assigns indentation levels to all steps. Never throws; a nesting problem is kept
	 * and can be queried with {@link #getIndentationError()}.
	 */
	public void indent() {
		indentationError = INDENTER.indent(steps).orElse(null);
	}

	/**
	 * The first nesting error found by the last {@link #indent()}, if any.
	 */
	public Optional<String> getIndentationError() {
		return Optional.ofNullable(indentationError);
	}

	/**
	 * Checks that block openers, clauses and ENDs pair up at every nesting level.
	 *
	 * @throws SequenceException with the indentation error if the last indentation failed
	 * @throws SequenceSyntaxException at the first structural violation
	 */
	public void checkSyntax() {
		if (indentationError != null) {
			logger.debug("Sequence '{}' ({} steps) skipped syntax check: {}", label, steps.size(), indentationError);
			throw new SequenceException(indentationError);
		}
		SYNTAX_CHECKER.check(steps);
	}

	/**
	 * Re-indents the sequence and checks its syntax.
	 *
	 * @return {@code true}; failures are thrown
	 * @throws SequenceException if the steps are not nested correctly
	 */
	public boolean checkCorrectnessOfSteps() {
		indent();
		checkSyntax();
		return true;
	}

	static void checkLabel(String label) {
		if (label == null || label.isEmpty()) {
			throw new SequenceException("Sequence label may not be empty");
		}
		if (label.length() > MAX_LABEL_LENGTH) {
			throw new SequenceException("Label \"" + label + "\" is too long (>"
					+ MAX_LABEL_LENGTH + " characters)");
		}
	}

	@Override
	public String toString() {
		return "Sequence['" + label + "', " + steps.size() + " steps]";
	}
}
