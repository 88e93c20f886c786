package org.javai.exprcheck;

/**
 * Base type for failures raised while turning expression text into an AST.
 * Carries the character offset at which the problem was detected.
 */
public abstract class ExpressionException extends RuntimeException {

	private final int position;

	protected ExpressionException(String message, int position) {
		super(message);
		this.position = position;
	}

	protected ExpressionException(String message, int position, Throwable cause) {
		super(message, cause);
		this.position = position;
	}

	/**
	 * Character offset in the source text, or {@code -1} when unknown.
	 */
	public int position() {
		return position;
	}
}
