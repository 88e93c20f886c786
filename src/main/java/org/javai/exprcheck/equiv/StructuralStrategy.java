package org.javai.exprcheck.equiv;

import java.util.Objects;
import org.javai.exprcheck.ast.BinaryOp;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.ast.FunctionCall;
import org.javai.exprcheck.ast.UnaryOp;
import org.javai.exprcheck.poly.PolynomialNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares trees node by node, accepting either operand order under
 * {@code +} and {@code *}.
 *
 * At every pair of corresponding subtrees a polynomial comparison is tried
 * first, so arguments of function calls are compared in normalized form:
 * {@code sin(x+y)} matches {@code sin(y+x)} even though the two calls are
 * distinct atoms to the normalizer.
 */
public class StructuralStrategy implements EquivalenceStrategy {

	private static final Logger logger = LoggerFactory.getLogger(StructuralStrategy.class);

	private final PolynomialNormalizer normalizer;

	public StructuralStrategy(PolynomialNormalizer normalizer) {
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
	}

	@Override
	public EquivalenceMethod method() {
		return EquivalenceMethod.STRUCTURAL;
	}

	@Override
	public EquivalenceResult compare(Expression first, Expression second) {
		if (matches(first, second)) {
			return EquivalenceResult.proven(method(), "Expression trees match up to commutativity of + and *");
		}
		return EquivalenceResult.notProven(method(), "Expression trees differ");
	}

	boolean matches(Expression first, Expression second) {
		if (first.equals(second) || polynomiallyEqual(first, second)) {
			return true;
		}
		if (first.getClass() != second.getClass()) {
			return false;
		}

		if (first instanceof BinaryOp left && second instanceof BinaryOp right) {
			if (left.operator() != right.operator()) {
				return false;
			}
			if (matches(left.left(), right.left()) && matches(left.right(), right.right())) {
				return true;
			}
			return left.operator().isCommutative()
					&& matches(left.left(), right.right())
					&& matches(left.right(), right.left());
		}
		if (first instanceof UnaryOp left && second instanceof UnaryOp right) {
			return matches(left.operand(), right.operand());
		}
		if (first instanceof FunctionCall left && second instanceof FunctionCall right) {
			return left.function() == right.function() && matches(left.argument(), right.argument());
		}
		// numbers and variables that are not equal
		return false;
	}

	private boolean polynomiallyEqual(Expression first, Expression second) {
		try {
			return normalizer.normalize(first).equals(normalizer.normalize(second));
		} catch (RuntimeException | StackOverflowError e) {
			logger.debug("Polynomial comparison of subtrees failed, comparing structure instead", e);
			return false;
		}
	}
}
