package org.javai.exprcheck.equiv;

import java.util.Objects;
import java.util.Optional;
import org.javai.exprcheck.ast.BinaryOp;
import org.javai.exprcheck.ast.CanonicalRenderer;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.ast.ExpressionWalker;
import org.javai.exprcheck.ast.Operator;
import org.javai.exprcheck.poly.Polynomial;
import org.javai.exprcheck.poly.PolynomialNormalizer;

/**
 * Rewrites both expressions as single fractions and cross-multiplies:
 * {@code n1/d1} and {@code n2/d2} are equivalent when {@code n1*d2} and
 * {@code n2*d1} normalize to the same polynomial.
 *
 * Nothing is proven when any divisor in either tree normalizes to zero, e.g.
 * {@code x/0} or {@code 2/(x/0)}: cross-multiplying by zero would equate any
 * two numerators.
 */
public class RationalStrategy implements EquivalenceStrategy {

	private final PolynomialNormalizer normalizer;

	public RationalStrategy(PolynomialNormalizer normalizer) {
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
	}

	@Override
	public EquivalenceMethod method() {
		return EquivalenceMethod.RATIONAL;
	}

	@Override
	public EquivalenceResult compare(Expression first, Expression second) {
		Optional<Expression> zeroDivisor = findZeroDivisor(first).or(() -> findZeroDivisor(second));
		if (zeroDivisor.isPresent()) {
			return EquivalenceResult.notProven(method(),
					"Divisor " + CanonicalRenderer.render(zeroDivisor.get()) + " normalizes to zero");
		}

		RationalForm left = RationalForm.of(first);
		RationalForm right = RationalForm.of(second);

		Polynomial leftCross = normalizer.normalize(BinaryOp.multiply(left.numerator(), right.denominator()));
		Polynomial rightCross = normalizer.normalize(BinaryOp.multiply(right.numerator(), left.denominator()));

		if (leftCross.equals(rightCross)) {
			return EquivalenceResult.proven(method(), "Cross products both normalize to " + leftCross);
		}
		return EquivalenceResult.notProven(method(), "Cross products differ: " + leftCross + " vs " + rightCross);
	}

	/**
	 * First divisor, in pre-order, whose numerator as a single fraction is the
	 * zero polynomial.
	 */
	private Optional<Expression> findZeroDivisor(Expression expression) {
		return ExpressionWalker.flatten(expression).stream()
				.filter(node -> node instanceof BinaryOp binary && binary.is(Operator.DIVIDE))
				.map(node -> ((BinaryOp) node).right())
				.filter(divisor -> normalizer.normalize(RationalForm.of(divisor).numerator()).isZero())
				.findFirst();
	}
}
