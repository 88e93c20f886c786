package org.javai.exprcheck.lex;

import org.javai.exprcheck.ExpressionException;

/**
 * Exception thrown when expression text contains a character or identifier
 * the lexer does not accept.
 */
public class LexException extends ExpressionException {

	public LexException(String message, int position) {
		super(message, position);
	}

	public LexException(String message, int position, Throwable cause) {
		super(message, position, cause);
	}
}
