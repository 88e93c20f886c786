package org.javai.exprcheck.ast;

/**
 * Operators of the expression grammar with their rendering precedence.
 * Higher precedence binds tighter.
 */
public enum Operator {

	PLUS('+', 1, true),
	MINUS('-', 1, false),
	MULTIPLY('*', 3, true),
	DIVIDE('/', 3, false),
	POWER('^', 4, false);

	private final char symbol;
	private final int precedence;
	private final boolean commutative;

	Operator(char symbol, int precedence, boolean commutative) {
		this.symbol = symbol;
		this.precedence = precedence;
		this.commutative = commutative;
	}

	public char symbol() {
		return symbol;
	}

	public int precedence() {
		return precedence;
	}

	public boolean isCommutative() {
		return commutative;
	}

	public boolean isRightAssociative() {
		return this == POWER;
	}

	public static Operator fromSymbol(char symbol) {
		for (Operator operator : values()) {
			if (operator.symbol == symbol) {
				return operator;
			}
		}
		throw new IllegalArgumentException("Unknown operator: '" + symbol + "'");
	}

	@Override
	public String toString() {
		return String.valueOf(symbol);
	}
}
