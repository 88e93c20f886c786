package org.javai.exprcheck.equiv;

import java.util.Objects;
import org.javai.exprcheck.ast.BinaryOp;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.ast.NumberLiteral;
import org.javai.exprcheck.ast.UnaryOp;

/**
 * An expression rewritten as a single fraction {@code numerator / denominator}.
 *
 * Built by structural recursion over {@code + - * /} and unary minus:
 * <pre>
 * a/b + c/d  -&gt; (a*d + c*b) / (b*d)
 * a/b - c/d  -&gt; (a*d - c*b) / (b*d)
 * a/b * c/d  -&gt; (a*c) / (b*d)
 * (a/b)/(c/d) -&gt; (a*d) / (b*c)
 * -(a/b)     -&gt; (-a) / b
 * </pre>
 * Powers, function calls, numbers and variables are kept as they are over {@code 1}.
 */
public record RationalForm(Expression numerator, Expression denominator) {

	public RationalForm {
		Objects.requireNonNull(numerator, "numerator must not be null");
		Objects.requireNonNull(denominator, "denominator must not be null");
	}

	public static RationalForm of(Expression expression) {
		Objects.requireNonNull(expression, "expression must not be null");

		if (expression instanceof UnaryOp unary) {
			RationalForm operand = of(unary.operand());
			return new RationalForm(UnaryOp.negate(operand.numerator), operand.denominator);
		}
		if (!(expression instanceof BinaryOp binary)) {
			return whole(expression);
		}

		return switch (binary.operator()) {
			case PLUS, MINUS -> {
				RationalForm left = of(binary.left());
				RationalForm right = of(binary.right());
				Expression numerator = new BinaryOp(
						BinaryOp.multiply(left.numerator, right.denominator),
						binary.operator(),
						BinaryOp.multiply(right.numerator, left.denominator));
				yield new RationalForm(numerator, BinaryOp.multiply(left.denominator, right.denominator));
			}
			case MULTIPLY -> {
				RationalForm left = of(binary.left());
				RationalForm right = of(binary.right());
				yield new RationalForm(
						BinaryOp.multiply(left.numerator, right.numerator),
						BinaryOp.multiply(left.denominator, right.denominator));
			}
			case DIVIDE -> {
				RationalForm left = of(binary.left());
				RationalForm right = of(binary.right());
				yield new RationalForm(
						BinaryOp.multiply(left.numerator, right.denominator),
						BinaryOp.multiply(left.denominator, right.numerator));
			}
			case POWER -> whole(binary);
		};
	}

	private static RationalForm whole(Expression expression) {
		return new RationalForm(expression, NumberLiteral.ONE);
	}
}
