package org.javai.exprcheck.equiv;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.poly.PolynomialNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether two expressions are equivalent by running a cascade of
 * strategies, by default polynomial, then structural, then rational. The
 * first strategy that proves equivalence wins.
 *
 * The checker never throws. A strategy that fails with an exception, or that
 * runs out of stack on a very deep tree, counts as "not proven" and the
 * cascade moves on. If no strategy proves equivalence the
 * verdict is negative and reports the last strategy that completed, or
 * {@link EquivalenceMethod#ERROR} if none did. The oracle is sound but not
 * complete: equal expressions whose non-expandable parts print differently can
 * be reported as not equivalent.
 *
 * <pre>
 * EquivalenceChecker checker = EquivalenceChecker.withDefaults();
 * checker.areEquivalent(ExpressionParser.parse("x*(y+z)"), ExpressionParser.parse("x*y+x*z")); // true
 * </pre>
 */
public class EquivalenceChecker {

	private static final Logger logger = LoggerFactory.getLogger(EquivalenceChecker.class);

	public static final List<EquivalenceMethod> DEFAULT_CASCADE = List.of(
			EquivalenceMethod.POLYNOMIAL, EquivalenceMethod.STRUCTURAL, EquivalenceMethod.RATIONAL);

	private final List<EquivalenceStrategy> strategies;

	public EquivalenceChecker(List<EquivalenceStrategy> strategies) {
		Objects.requireNonNull(strategies, "strategies must not be null");
		if (strategies.isEmpty()) {
			throw new IllegalArgumentException("At least one equivalence strategy is required");
		}
		this.strategies = List.copyOf(strategies);
	}

	/**
	 * Checker running the full default cascade with a fresh normalizer.
	 */
	public static EquivalenceChecker withDefaults() {
		return forMethods(new PolynomialNormalizer(), DEFAULT_CASCADE);
	}

	/**
	 * Checker running the given methods in order, all sharing one normalizer.
	 *
	 * @throws IllegalArgumentException if {@code methods} is empty or names {@link EquivalenceMethod#ERROR}
	 */
	public static EquivalenceChecker forMethods(PolynomialNormalizer normalizer, List<EquivalenceMethod> methods) {
		Objects.requireNonNull(normalizer, "normalizer must not be null");
		Objects.requireNonNull(methods, "methods must not be null");
		List<EquivalenceStrategy> strategies = new ArrayList<>();
		for (EquivalenceMethod method : methods) {
			strategies.add(switch (method) {
				case POLYNOMIAL -> new PolynomialStrategy(normalizer);
				case STRUCTURAL -> new StructuralStrategy(normalizer);
				case RATIONAL -> new RationalStrategy(normalizer);
				case ERROR -> throw new IllegalArgumentException("'error' is not an equivalence strategy");
			});
		}
		return new EquivalenceChecker(strategies);
	}

	public List<EquivalenceStrategy> strategies() {
		return strategies;
	}

	public boolean areEquivalent(Expression first, Expression second) {
		return checkEquivalenceVerbose(first, second).equivalent();
	}

	/**
	 * Runs the cascade and reports which strategy decided the verdict.
	 */
	public EquivalenceResult checkEquivalenceVerbose(Expression first, Expression second) {
		if (first == null || second == null) {
			return EquivalenceResult.error("Both expressions are required");
		}

		EquivalenceResult lastCompleted = null;
		List<String> failures = new ArrayList<>();

		for (EquivalenceStrategy strategy : strategies) {
			EquivalenceResult result;
			try {
				result = strategy.compare(first, second);
			} catch (RuntimeException | StackOverflowError e) {
				logger.warn("Equivalence strategy '{}' failed; treating as not proven", strategy.method(), e);
				failures.add(strategy.method() + ": " + describe(e));
				continue;
			}

			logger.debug("Strategy '{}' -> {} ({})", strategy.method(), result.equivalent(), result.details());
			if (result.equivalent()) {
				return result;
			}
			lastCompleted = result;
		}

		if (lastCompleted == null) {
			return EquivalenceResult.error("No strategy completed: " + String.join("; ", failures));
		}
		String details = failures.isEmpty()
				? lastCompleted.details()
				: lastCompleted.details() + " (failed: " + String.join("; ", failures) + ")";
		return EquivalenceResult.notProven(lastCompleted.method(), details);
	}

	private static String describe(Throwable e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}
}
