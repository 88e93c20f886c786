package org.javai.exprcheck.ast;

import java.util.Objects;

/**
 * Application of one of the fixed functions to a single argument.
 */
public record FunctionCall(MathFunction function, Expression argument) implements Expression {

	public FunctionCall {
		Objects.requireNonNull(function, "function must not be null");
		Objects.requireNonNull(argument, "argument must not be null");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitCall(this);
	}
}
