package org.javai.taskomat.sequence;

/**
 * Exception thrown when a sequence is malformed or cannot be built.
 */
public class SequenceException extends RuntimeException {

	public SequenceException(String message) {
		super(message);
	}

	public SequenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
