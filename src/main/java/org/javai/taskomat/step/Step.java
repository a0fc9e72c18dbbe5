package org.javai.taskomat.step;

import java.util.Objects;

/**
 * One entry of a sequence.
 * <p>
 * A step knows nothing about its neighbours; the order of steps within a sequence is the
 * only structural signal. The indentation level is derived from that order and is only
 * meaningful after the owning sequence has been indented.
 */
public class Step {

	/**
	 * Deepest nesting level a step may be assigned.
	 */
	public static final short MAX_INDENTATION_LEVEL = 20;

	private StepType type;
	private String label;
	private short indentationLevel = 0;

	public Step(StepType type) {
		this(type, "");
	}

	public Step(StepType type, String label) {
		this.type = Objects.requireNonNull(type, "type must not be null");
		this.label = label != null ? label : "";
	}

	public StepType getType() {
		return type;
	}

	/**
	 * Changes the type of this step. The owning sequence has to be indented again
	 * afterwards.
	 */
	public void setType(StepType type) {
		this.type = Objects.requireNonNull(type, "type must not be null");
	}

	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		this.label = label != null ? label : "";
	}

	public short getIndentationLevel() {
		return indentationLevel;
	}

	/**
	 * @param level nesting depth between 0 and {@link #MAX_INDENTATION_LEVEL}
	 * @throws IllegalArgumentException if the level is out of range
	 */
	public void setIndentationLevel(int level) {
		if (level < 0 || level > MAX_INDENTATION_LEVEL) {
			throw new IllegalArgumentException("Indentation level " + level
					+ " is out of range [0, " + MAX_INDENTATION_LEVEL + "]");
		}
		this.indentationLevel = (short) level;
	}

	@Override
	public String toString() {
		return "Step[" + type.keyword() + (label.isEmpty() ? "" : " '" + label + "'")
				+ ", level=" + indentationLevel + "]";
	}
}
