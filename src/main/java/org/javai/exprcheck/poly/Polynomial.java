package org.javai.exprcheck.poly;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sparse polynomial over variables and atomic expressions with integer
 * coefficients.
 *
 * Instances are immutable; every arithmetic operation returns a new polynomial.
 * Monomials with a zero coefficient never appear in {@link #terms()}: they are
 * pruned whenever a polynomial is constructed. Equality is exact equality of
 * the monomial-to-coefficient maps.
 */
public final class Polynomial {

	public static final Polynomial ZERO = new Polynomial(Map.of());

	private static final Comparator<Map.Entry<Monomial, BigInteger>> DISPLAY_ORDER =
			Comparator.comparing(entry -> entry.getKey().render());

	private final Map<Monomial, BigInteger> terms;

	private Polynomial(Map<Monomial, BigInteger> terms) {
		Map<Monomial, BigInteger> pruned = new LinkedHashMap<>();
		terms.forEach((monomial, coefficient) -> {
			if (coefficient.signum() != 0) {
				pruned.put(monomial, coefficient);
			}
		});
		this.terms = Collections.unmodifiableMap(pruned);
	}

	/**
	 * Builds a polynomial from a monomial-to-coefficient map, dropping zero coefficients.
	 */
	public static Polynomial of(Map<Monomial, BigInteger> terms) {
		Objects.requireNonNull(terms, "terms must not be null");
		return new Polynomial(terms);
	}

	public static Polynomial of(Monomial monomial, BigInteger coefficient) {
		return new Polynomial(Map.of(monomial, coefficient));
	}

	public static Polynomial constant(BigInteger value) {
		return of(Monomial.ONE, value);
	}

	public static Polynomial constant(long value) {
		return constant(BigInteger.valueOf(value));
	}

	public static Polynomial symbol(Symbol symbol) {
		return of(Monomial.of(symbol), BigInteger.ONE);
	}

	public static Polynomial variable(String name) {
		return symbol(new VariableSymbol(name));
	}

	public Map<Monomial, BigInteger> terms() {
		return terms;
	}

	/**
	 * Terms in display order: ascending by rendered monomial, constant first.
	 */
	public List<Map.Entry<Monomial, BigInteger>> orderedTerms() {
		return terms.entrySet().stream()
				.sorted(DISPLAY_ORDER)
				.toList();
	}

	public BigInteger coefficient(Monomial monomial) {
		return terms.getOrDefault(monomial, BigInteger.ZERO);
	}

	public int size() {
		return terms.size();
	}

	public boolean isZero() {
		return terms.isEmpty();
	}

	public Polynomial add(Polynomial other) {
		Map<Monomial, BigInteger> result = new LinkedHashMap<>(terms);
		other.terms.forEach((monomial, coefficient) -> result.merge(monomial, coefficient, BigInteger::add));
		return new Polynomial(result);
	}

	public Polynomial subtract(Polynomial other) {
		return add(other.negate());
	}

	public Polynomial negate() {
		Map<Monomial, BigInteger> result = new LinkedHashMap<>();
		terms.forEach((monomial, coefficient) -> result.put(monomial, coefficient.negate()));
		return new Polynomial(result);
	}

	/**
	 * Distributes over both operands: every pair of monomials is combined and
	 * the partial products are summed.
	 */
	public Polynomial multiply(Polynomial other) {
		Map<Monomial, BigInteger> result = new LinkedHashMap<>();
		for (Map.Entry<Monomial, BigInteger> left : terms.entrySet()) {
			for (Map.Entry<Monomial, BigInteger> right : other.terms.entrySet()) {
				Monomial product = left.getKey().times(right.getKey());
				result.merge(product, left.getValue().multiply(right.getValue()), BigInteger::add);
			}
		}
		return new Polynomial(result);
	}

	/**
	 * Repeated self-multiplication.
	 *
	 * @param exponent a positive exponent
	 */
	public Polynomial pow(int exponent) {
		if (exponent < 1) {
			throw new IllegalArgumentException("Exponent must be positive: " + exponent);
		}
		Polynomial result = this;
		for (int i = 1; i < exponent; i++) {
			result = result.multiply(this);
		}
		return result;
	}

	/**
	 * Renders the polynomial with monomials in ascending order of their rendered
	 * factors, e.g. {@code 1 + 2*x + x^2} or {@code 2*(x*y) - z}. Coefficients
	 * of one are omitted and the zero polynomial renders as {@code 0}.
	 */
	public String render() {
		if (terms.isEmpty()) {
			return "0";
		}

		StringBuilder sb = new StringBuilder();
		for (Map.Entry<Monomial, BigInteger> term : orderedTerms()) {
			BigInteger coefficient = term.getValue();
			boolean negative = coefficient.signum() < 0;
			if (sb.length() == 0) {
				if (negative) {
					sb.append('-');
				}
			} else {
				sb.append(negative ? " - " : " + ");
			}
			sb.append(formatTerm(term.getKey(), coefficient.abs()));
		}
		return sb.toString();
	}

	private static String formatTerm(Monomial monomial, BigInteger magnitude) {
		if (monomial.isConstant()) {
			return magnitude.toString();
		}
		String factors = monomial.render();
		if (magnitude.equals(BigInteger.ONE)) {
			return factors;
		}
		return monomial.isCompound()
				? magnitude + "*(" + factors + ")"
				: magnitude + "*" + factors;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Polynomial)) return false;
		return terms.equals(((Polynomial) o).terms);
	}

	@Override
	public int hashCode() {
		return terms.hashCode();
	}

	@Override
	public String toString() {
		return render();
	}
}
