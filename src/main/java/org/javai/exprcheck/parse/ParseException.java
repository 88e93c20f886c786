package org.javai.exprcheck.parse;

import org.javai.exprcheck.ExpressionException;

/**
 * Exception thrown when a token sequence does not form a valid expression.
 */
public class ParseException extends ExpressionException {

	public ParseException(String message, int position) {
		super(message, position);
	}

	public ParseException(String message, int position, Throwable cause) {
		super(message, position, cause);
	}
}
