package org.javai.exprcheck.ast;

import java.util.Objects;

/**
 * Binary operation {@code left operator right}.
 */
public record BinaryOp(Expression left, Operator operator, Expression right) implements Expression {

	public BinaryOp {
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(right, "right must not be null");
	}

	public static BinaryOp add(Expression left, Expression right) {
		return new BinaryOp(left, Operator.PLUS, right);
	}

	public static BinaryOp subtract(Expression left, Expression right) {
		return new BinaryOp(left, Operator.MINUS, right);
	}

	public static BinaryOp multiply(Expression left, Expression right) {
		return new BinaryOp(left, Operator.MULTIPLY, right);
	}

	public static BinaryOp divide(Expression left, Expression right) {
		return new BinaryOp(left, Operator.DIVIDE, right);
	}

	public static BinaryOp power(Expression base, Expression exponent) {
		return new BinaryOp(base, Operator.POWER, exponent);
	}

	public boolean is(Operator expected) {
		return operator == expected;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitBinary(this);
	}
}
