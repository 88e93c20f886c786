package org.javai.exprcheck.poly;

import java.util.Comparator;

/**
 * A factor of a monomial: either a variable or an opaque atomic subexpression.
 */
public sealed interface Symbol permits VariableSymbol, AtomicExpression {

	/**
	 * Orders symbols by display name, variables before atoms on a tie.
	 */
	Comparator<Symbol> ORDER = Comparator.comparing(Symbol::name)
			.thenComparing(symbol -> symbol instanceof AtomicExpression);

	/**
	 * Display name; also the identity key of the symbol.
	 */
	String name();

	/**
	 * Whether the name can be followed by {@code ^n} or joined with {@code *}
	 * without parentheses.
	 */
	boolean isSelfDelimiting();
}
