package org.javai.exprcheck.ast;

import java.util.Objects;

/**
 * Unary negation. Minus is the only unary operator of the grammar.
 */
public record UnaryOp(Operator operator, Expression operand) implements Expression {

	public UnaryOp {
		Objects.requireNonNull(operand, "operand must not be null");
		if (operator != Operator.MINUS) {
			throw new IllegalArgumentException("Unsupported unary operator: " + operator);
		}
	}

	public static UnaryOp negate(Expression operand) {
		return new UnaryOp(Operator.MINUS, operand);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitUnary(this);
	}
}
