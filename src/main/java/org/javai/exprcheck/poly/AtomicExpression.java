package org.javai.exprcheck.poly;

import java.util.Objects;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.ast.FunctionCall;

/**
 * A subexpression the normalizer cannot expand, treated as an opaque symbol.
 *
 * Identity is the canonical rendering of the subtree: two atoms are equal iff
 * their canonical strings are equal. Subtrees that are equal in value but render
 * differently, e.g. {@code 1/(x+y)} and {@code 1/(y+x)}, stay distinct atoms.
 * The numeric id is a debug label only and takes no part in equality, hashing
 * or ordering.
 */
public final class AtomicExpression implements Symbol {

	private final Expression expression;
	private final String canonical;
	private final long id;

	AtomicExpression(Expression expression, String canonical, long id) {
		this.expression = Objects.requireNonNull(expression, "expression must not be null");
		this.canonical = Objects.requireNonNull(canonical, "canonical must not be null");
		this.id = id;
	}

	public Expression expression() {
		return expression;
	}

	public String canonical() {
		return canonical;
	}

	public long id() {
		return id;
	}

	@Override
	public String name() {
		return canonical;
	}

	@Override
	public boolean isSelfDelimiting() {
		return expression instanceof FunctionCall;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		return o instanceof AtomicExpression other && canonical.equals(other.canonical);
	}

	@Override
	public int hashCode() {
		return canonical.hashCode();
	}

	@Override
	public String toString() {
		return "Atom(" + id + ":" + canonical + ")";
	}
}
