package org.javai.exprcheck.equiv;

import java.util.Objects;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.poly.Polynomial;
import org.javai.exprcheck.poly.PolynomialNormalizer;

/**
 * Normalizes both expressions and compares the polynomials for exact equality.
 * Atoms match only when their canonical strings match.
 */
public class PolynomialStrategy implements EquivalenceStrategy {

	private final PolynomialNormalizer normalizer;

	public PolynomialStrategy(PolynomialNormalizer normalizer) {
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
	}

	@Override
	public EquivalenceMethod method() {
		return EquivalenceMethod.POLYNOMIAL;
	}

	@Override
	public EquivalenceResult compare(Expression first, Expression second) {
		Polynomial left = normalizer.normalize(first);
		Polynomial right = normalizer.normalize(second);

		if (left.equals(right)) {
			return EquivalenceResult.proven(method(), "Both expressions normalize to " + left);
		}
		return EquivalenceResult.notProven(method(), "Normalized forms differ: " + left + " vs " + right);
	}
}
