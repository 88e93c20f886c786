package org.javai.exprcheck.ast;

/**
 * A node of a parsed arithmetic expression.
 *
 * The node set is closed: numbers, single-letter variables, binary and unary
 * operations, and calls of one of the fixed functions. Every variant is an
 * immutable record, so equality is exact structural equality with no notion of
 * commutativity at this layer.
 */
public sealed interface Expression permits NumberLiteral, Variable, BinaryOp, UnaryOp, FunctionCall {

	/**
	 * Accepts a visitor and dispatches to the method matching this node's variant.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(ExpressionVisitor<R> visitor);
}
