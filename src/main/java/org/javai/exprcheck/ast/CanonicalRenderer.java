package org.javai.exprcheck.ast;

/**
 * Renders an expression as compact text with the fewest parentheses that keep
 * its tree shape: a child is parenthesized only when its precedence is lower
 * than its parent's, or equal on the side the parent does not associate to.
 * {@code ^} associates to the right, every other binary operator to the left.
 *
 * The output keys atomic subexpressions during normalization. It is not
 * guaranteed to parse back to the same tree, since unary minus renders with
 * its own precedence between addition and multiplication.
 */
public final class CanonicalRenderer implements ExpressionVisitor<String> {

	private static final CanonicalRenderer INSTANCE = new CanonicalRenderer();

	private static final int UNARY_PRECEDENCE = 2;
	private static final int ATOMIC_PRECEDENCE = 5;

	private CanonicalRenderer() {
	}

	public static String render(Expression expression) {
		return expression.accept(INSTANCE);
	}

	@Override
	public String visitNumber(NumberLiteral number) {
		return number.value().toString();
	}

	@Override
	public String visitVariable(Variable variable) {
		return variable.name();
	}

	@Override
	public String visitBinary(BinaryOp binary) {
		Operator op = binary.operator();
		int leftPrecedence = precedenceOf(binary.left());
		int rightPrecedence = precedenceOf(binary.right());

		boolean wrapLeft = leftPrecedence < op.precedence()
				|| (op.isRightAssociative() && leftPrecedence == op.precedence());
		boolean wrapRight = rightPrecedence < op.precedence()
				|| (!op.isRightAssociative() && rightPrecedence == op.precedence());

		return wrap(binary.left(), wrapLeft) + op.symbol() + wrap(binary.right(), wrapRight);
	}

	@Override
	public String visitUnary(UnaryOp unary) {
		boolean wrapOperand = precedenceOf(unary.operand()) <= UNARY_PRECEDENCE;
		return unary.operator().symbol() + wrap(unary.operand(), wrapOperand);
	}

	@Override
	public String visitCall(FunctionCall call) {
		return call.function().functionName() + "(" + render(call.argument()) + ")";
	}

	private String wrap(Expression expression, boolean parenthesize) {
		String text = render(expression);
		return parenthesize ? "(" + text + ")" : text;
	}

	private static int precedenceOf(Expression expression) {
		if (expression instanceof BinaryOp binary) {
			return binary.operator().precedence();
		}
		if (expression instanceof UnaryOp) {
			return UNARY_PRECEDENCE;
		}
		return ATOMIC_PRECEDENCE;
	}
}
