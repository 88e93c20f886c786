package org.javai.exprcheck.ast;

import java.util.Objects;

/**
 * Single-letter variable.
 */
public record Variable(String name) implements Expression {

	public Variable {
		Objects.requireNonNull(name, "name must not be null");
		if (name.length() != 1 || !Character.isLetter(name.charAt(0))) {
			throw new IllegalArgumentException("Variable name must be a single letter: '" + name + "'");
		}
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitVariable(this);
	}
}
