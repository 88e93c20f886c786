package org.javai.exprcheck.poly;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * A product of distinct symbols, each raised to a positive integer power.
 * The empty product is the constant monomial {@link #ONE}.
 *
 * Two monomials are equal iff they hold the same symbol-to-power pairs; the
 * order in which factors were multiplied is irrelevant.
 */
public final class Monomial {

	public static final Monomial ONE = new Monomial(new TreeMap<>(Symbol.ORDER));

	private final SortedMap<Symbol, Integer> powers;

	private Monomial(SortedMap<Symbol, Integer> powers) {
		this.powers = Collections.unmodifiableSortedMap(powers);
	}

	public static Monomial of(Symbol symbol) {
		return of(symbol, 1);
	}

	public static Monomial of(Symbol symbol, int power) {
		Objects.requireNonNull(symbol, "symbol must not be null");
		if (power < 1) {
			throw new IllegalArgumentException("Power must be positive: " + power);
		}
		SortedMap<Symbol, Integer> powers = new TreeMap<>(Symbol.ORDER);
		powers.put(symbol, power);
		return new Monomial(powers);
	}

	/**
	 * Builds a monomial from symbol-power pairs.
	 *
	 * @throws IllegalArgumentException if any power is not positive
	 */
	public static Monomial of(Map<? extends Symbol, Integer> factors) {
		SortedMap<Symbol, Integer> powers = new TreeMap<>(Symbol.ORDER);
		factors.forEach((symbol, power) -> {
			if (power == null || power < 1) {
				throw new IllegalArgumentException("Power of " + symbol + " must be positive: " + power);
			}
			powers.merge(symbol, power, Integer::sum);
		});
		return new Monomial(powers);
	}

	/**
	 * Product of two monomials: the union of their symbols, adding powers of
	 * symbols present in both.
	 */
	public Monomial times(Monomial other) {
		if (other.isConstant()) return this;
		if (isConstant()) return other;

		SortedMap<Symbol, Integer> combined = new TreeMap<>(Symbol.ORDER);
		combined.putAll(powers);
		other.powers.forEach((symbol, power) -> combined.merge(symbol, power, Integer::sum));
		return new Monomial(combined);
	}

	public SortedMap<Symbol, Integer> powers() {
		return powers;
	}

	public int power(Symbol symbol) {
		return powers.getOrDefault(symbol, 0);
	}

	public boolean isConstant() {
		return powers.isEmpty();
	}

	/**
	 * Sum of all powers.
	 */
	public int degree() {
		return powers.values().stream().mapToInt(Integer::intValue).sum();
	}

	/**
	 * Whether a coefficient in front of this monomial needs parentheses around it,
	 * i.e. it has several factors or a raised factor.
	 */
	boolean isCompound() {
		return powers.size() > 1 || powers.values().stream().anyMatch(power -> power > 1);
	}

	/**
	 * Factors joined by {@code *} in ascending symbol order, {@code symbol^power}
	 * for powers above one. The constant monomial renders as the empty string.
	 */
	public String render() {
		StringJoiner joiner = new StringJoiner("*");
		boolean single = powers.size() == 1;
		powers.forEach((symbol, power) -> {
			boolean wrap = !symbol.isSelfDelimiting() && (power > 1 || !single);
			String base = wrap ? "(" + symbol.name() + ")" : symbol.name();
			joiner.add(power > 1 ? base + "^" + power : base);
		});
		return joiner.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Monomial)) return false;
		return powers.equals(((Monomial) o).powers);
	}

	@Override
	public int hashCode() {
		return powers.hashCode();
	}

	@Override
	public String toString() {
		return isConstant() ? "1" : render();
	}
}
