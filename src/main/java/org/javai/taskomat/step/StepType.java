package org.javai.taskomat.step;

import java.util.Locale;

/**
 * Structural type of a {@link Step}.
 * <p>
 * The set is closed: every pass over a sequence switches over all constants, so adding a
 * type forces each pass to decide how to treat it.
 */
public enum StepType {
	ACTION("ACTION"),
	IF("IF"),
	ELSE_IF("ELSE IF"),
	ELSE("ELSE"),
	WHILE("WHILE"),
	TRY("TRY"),
	CATCH("CATCH"),
	END("END");

	private final String keyword;

	StepType(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * The keyword used in listings and diagnostics, e.g. {@code "ELSE IF"}.
	 */
	public String keyword() {
		return keyword;
	}

	/**
	 * IF, WHILE and TRY open a block.
	 */
	public boolean opensBlock() {
		return switch (this) {
			case IF, WHILE, TRY -> true;
			case ACTION, ELSE_IF, ELSE, CATCH, END -> false;
		};
	}

	/**
	 * ELSE IF, ELSE and CATCH end one clause of a block and start the next.
	 */
	public boolean continuesBlock() {
		return switch (this) {
			case ELSE_IF, ELSE, CATCH -> true;
			case ACTION, IF, WHILE, TRY, END -> false;
		};
	}

	public boolean closesBlock() {
		return this == END;
	}

	/**
	 * Resolves a step type from its name or keyword. Case, blanks and underscores are
	 * ignored, so {@code "ELSE_IF"}, {@code "else if"} and {@code "elseif"} all map to
	 * {@link #ELSE_IF}.
	 *
	 * @param keyword the text to resolve
	 * @return the matching type
	 * @throws IllegalArgumentException if the keyword is null or unknown
	 */
	public static StepType fromKeyword(String keyword) {
		if (keyword == null) {
			throw new IllegalArgumentException("Step type cannot be null");
		}
		String normalized = normalize(keyword);
		for (StepType type : values()) {
			if (normalize(type.name()).equals(normalized)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown step type: '" + keyword + "'");
	}

	private static String normalize(String text) {
		return text.replace("_", "")
				.replaceAll("\\s+", "")
				.toUpperCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return keyword;
	}
}
