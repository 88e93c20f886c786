package org.javai.exprcheck.ast;

/**
 * Visitor over the closed set of {@link Expression} variants.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ExpressionVisitor<R> {

	R visitNumber(NumberLiteral number);

	R visitVariable(Variable variable);

	R visitBinary(BinaryOp binary);

	R visitUnary(UnaryOp unary);

	R visitCall(FunctionCall call);
}
