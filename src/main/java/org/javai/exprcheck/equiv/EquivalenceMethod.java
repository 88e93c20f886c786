package org.javai.exprcheck.equiv;

import java.util.Locale;

/**
 * The strategy that produced an equivalence verdict.
 */
public enum EquivalenceMethod {

	POLYNOMIAL,
	STRUCTURAL,
	RATIONAL,
	ERROR;

	/**
	 * Lower-case name used in reports, e.g. {@code polynomial}.
	 */
	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static EquivalenceMethod fromWireName(String name) {
		for (EquivalenceMethod method : values()) {
			if (method.wireName().equals(name)) {
				return method;
			}
		}
		throw new IllegalArgumentException("Unknown equivalence method: '" + name + "'");
	}

	@Override
	public String toString() {
		return wireName();
	}
}
