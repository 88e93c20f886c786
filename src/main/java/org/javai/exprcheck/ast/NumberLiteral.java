package org.javai.exprcheck.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Non-negative integer literal.
 */
public record NumberLiteral(BigInteger value) implements Expression {

	public static final NumberLiteral ZERO = new NumberLiteral(BigInteger.ZERO);
	public static final NumberLiteral ONE = new NumberLiteral(BigInteger.ONE);

	public NumberLiteral {
		Objects.requireNonNull(value, "value must not be null");
	}

	public static NumberLiteral of(long value) {
		return new NumberLiteral(BigInteger.valueOf(value));
	}

	public boolean isZero() {
		return value.signum() == 0;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitNumber(this);
	}
}
