package org.javai.exprcheck.lex;

import java.math.BigInteger;

/**
 * A single lexical token of an arithmetic expression.
 * 
 * @param type the token type
 * @param value the token text ({@code "*"} for synthetic implicit multiplications, empty for END)
 * @param position the character offset in the source text
 */
public record Token(TokenType type, String value, int position) {

	public enum TokenType {
		NUMBER,             // decimal digits
		VARIABLE,           // single letter
		PLUS,               // +
		MINUS,              // -
		MULTIPLY,           // *
		IMPLICIT_MULTIPLY,  // inserted between adjacent operands, e.g. 2x
		DIVIDE,             // /
		POWER,              // ^
		LPAREN,             // (
		RPAREN,             // )
		FUNCTION,           // sin, cos, tan, ln, sqrt
		END                 // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case NUMBER, VARIABLE, FUNCTION -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	/**
	 * Integer value of a NUMBER token.
	 * 
	 * @throws IllegalStateException if this is not a NUMBER token
	 */
	public BigInteger numericValue() {
		if (type != TokenType.NUMBER) {
			throw new IllegalStateException("Not a number token: " + this);
		}
		return new BigInteger(value);
	}
}
