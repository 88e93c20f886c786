package org.javai.exprcheck.equiv;

import org.javai.exprcheck.ast.Expression;

/**
 * One stage of the equivalence cascade.
 *
 * Implementations are sound: a result with {@code equivalent == true} means
 * the expressions are equal for every value of their variables where both are
 * defined. A negative result only means this strategy could not prove it.
 * Implementations may throw; {@link EquivalenceChecker} treats a thrown
 * exception as "not proven" and moves on.
 */
public interface EquivalenceStrategy {

	/**
	 * The method reported on results of this strategy.
	 */
	EquivalenceMethod method();

	/**
	 * Attempts to prove the two expressions equivalent.
	 */
	EquivalenceResult compare(Expression first, Expression second);
}
