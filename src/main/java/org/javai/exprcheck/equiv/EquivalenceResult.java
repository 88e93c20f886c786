package org.javai.exprcheck.equiv;

import java.util.Objects;

/**
 * Verdict of an equivalence check.
 *
 * @param equivalent whether equivalence was proven
 * @param method the strategy that produced the verdict, or {@link EquivalenceMethod#ERROR}
 * @param details human-readable explanation
 */
public record EquivalenceResult(boolean equivalent, EquivalenceMethod method, String details) {

	public EquivalenceResult {
		Objects.requireNonNull(method, "method must not be null");
		details = details != null ? details : "";
	}

	public static EquivalenceResult proven(EquivalenceMethod method, String details) {
		return new EquivalenceResult(true, method, details);
	}

	public static EquivalenceResult notProven(EquivalenceMethod method, String details) {
		return new EquivalenceResult(false, method, details);
	}

	public static EquivalenceResult error(String details) {
		return new EquivalenceResult(false, EquivalenceMethod.ERROR, details);
	}
}
