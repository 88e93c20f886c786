package org.javai.exprcheck.poly;

import java.math.BigInteger;
import java.util.Objects;
import org.javai.exprcheck.ast.BinaryOp;
import org.javai.exprcheck.ast.CanonicalRenderer;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.ast.ExpressionVisitor;
import org.javai.exprcheck.ast.FunctionCall;
import org.javai.exprcheck.ast.NumberLiteral;
import org.javai.exprcheck.ast.UnaryOp;
import org.javai.exprcheck.ast.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands an expression into canonical polynomial form.
 *
 * Sums, differences, products and negations are distributed fully. A power with
 * a literal exponent from 2 up to {@link #maxExpansionExponent()} and an
 * expandable base is expanded by repeated multiplication. Any other power, every
 * division and every function call becomes an {@link AtomicExpression}
 * contributing the monomial {@code atom^1}, so normalization never fails for a
 * tree produced by the parser.
 *
 * Each normalizer owns an {@link AtomTable}. Atoms seen more than once within
 * one {@link #normalize} call are interned; the table is reset at the start of
 * every call, so it never holds more than one run's atoms. Not thread-safe.
 */
public class PolynomialNormalizer implements ExpressionVisitor<Polynomial> {

	private static final Logger logger = LoggerFactory.getLogger(PolynomialNormalizer.class);

	public static final int DEFAULT_MAX_EXPANSION_EXPONENT = 3;

	private final AtomTable atoms;
	private final int maxExpansionExponent;

	public PolynomialNormalizer() {
		this(DEFAULT_MAX_EXPANSION_EXPONENT);
	}

	public PolynomialNormalizer(int maxExpansionExponent) {
		this(new AtomTable(), maxExpansionExponent);
	}

	public PolynomialNormalizer(AtomTable atoms, int maxExpansionExponent) {
		this.atoms = Objects.requireNonNull(atoms, "atoms must not be null");
		if (maxExpansionExponent < 1) {
			throw new IllegalArgumentException("maxExpansionExponent must be at least 1: " + maxExpansionExponent);
		}
		this.maxExpansionExponent = maxExpansionExponent;
	}

	/**
	 * Normalizes an expression tree.
	 *
	 * @return the polynomial, free of zero-coefficient monomials
	 */
	public Polynomial normalize(Expression expression) {
		Objects.requireNonNull(expression, "expression must not be null");
		atoms.reset();
		Polynomial result = expression.accept(this);
		if (logger.isDebugEnabled()) {
			logger.debug("Normalized {} to {} ({} term(s), {} atom(s))",
					CanonicalRenderer.render(expression), result, result.size(), atoms.size());
		}
		return result;
	}

	/**
	 * Whether the tree is built only from numbers, variables, {@code + - *} and
	 * unary minus.
	 */
	public static boolean isExpandable(Expression expression) {
		if (expression instanceof NumberLiteral || expression instanceof Variable) {
			return true;
		}
		if (expression instanceof UnaryOp unary) {
			return isExpandable(unary.operand());
		}
		if (expression instanceof BinaryOp binary) {
			return switch (binary.operator()) {
				case PLUS, MINUS, MULTIPLY -> isExpandable(binary.left()) && isExpandable(binary.right());
				case DIVIDE, POWER -> false;
			};
		}
		return false;
	}

	public AtomTable atomTable() {
		return atoms;
	}

	public int maxExpansionExponent() {
		return maxExpansionExponent;
	}

	@Override
	public Polynomial visitNumber(NumberLiteral number) {
		return number.isZero() ? Polynomial.ZERO : Polynomial.constant(number.value());
	}

	@Override
	public Polynomial visitVariable(Variable variable) {
		return Polynomial.variable(variable.name());
	}

	@Override
	public Polynomial visitBinary(BinaryOp binary) {
		return switch (binary.operator()) {
			case PLUS -> binary.left().accept(this).add(binary.right().accept(this));
			case MINUS -> binary.left().accept(this).subtract(binary.right().accept(this));
			case MULTIPLY -> binary.left().accept(this).multiply(binary.right().accept(this));
			case POWER -> expandPower(binary);
			case DIVIDE -> atom(binary);
		};
	}

	@Override
	public Polynomial visitUnary(UnaryOp unary) {
		return unary.operand().accept(this).negate();
	}

	@Override
	public Polynomial visitCall(FunctionCall call) {
		return atom(call);
	}

	private Polynomial expandPower(BinaryOp power) {
		if (power.right() instanceof NumberLiteral exponent
				&& isExpansionExponent(exponent.value())
				&& isExpandable(power.left())) {
			return power.left().accept(this).pow(exponent.value().intValueExact());
		}
		return atom(power);
	}

	private boolean isExpansionExponent(BigInteger exponent) {
		return exponent.compareTo(BigInteger.TWO) >= 0
				&& exponent.compareTo(BigInteger.valueOf(maxExpansionExponent)) <= 0;
	}

	private Polynomial atom(Expression expression) {
		AtomicExpression atom = atoms.atomFor(expression);
		logger.trace("Treating {} as {}", atom.canonical(), atom);
		return Polynomial.symbol(atom);
	}
}
