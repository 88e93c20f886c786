package org.javai.exprcheck;

import java.util.List;
import java.util.SortedSet;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.ast.ExpressionTreePrinter;
import org.javai.exprcheck.ast.ExpressionWalker;
import org.javai.exprcheck.lex.Token;
import org.javai.exprcheck.poly.Polynomial;

/**
 * Every stage of the pipeline for one expression.
 *
 * @param source the analyzed text
 * @param tokens tokens including inserted implicit multiplications and the final END
 * @param expression the parsed tree
 * @param polynomial the normalized form
 * @param expandable whether the tree normalizes without atoms
 */
public record ExpressionAnalysis(
		String source,
		List<Token> tokens,
		Expression expression,
		Polynomial polynomial,
		boolean expandable) {

	public ExpressionAnalysis {
		tokens = List.copyOf(tokens);
	}

	public int nodeCount() {
		return ExpressionWalker.nodeCount(expression);
	}

	/**
	 * Height of the parsed tree; a lone number or variable has depth 1.
	 */
	public int depth() {
		return ExpressionWalker.depth(expression);
	}

	/**
	 * Variables occurring in the expression, sorted by name.
	 */
	public SortedSet<String> variables() {
		return ExpressionWalker.variables(expression);
	}

	/**
	 * Indented dump of the parsed tree.
	 */
	public String treeDump() {
		return ExpressionTreePrinter.print(expression);
	}
}
