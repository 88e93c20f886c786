package org.javai.exprcheck.config;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.javai.exprcheck.equiv.EquivalenceChecker;
import org.javai.exprcheck.equiv.EquivalenceMethod;
import org.javai.exprcheck.poly.PolynomialNormalizer;

/**
 * Tunables of the analysis pipeline.
 *
 * @param maxExpansionExponent largest literal exponent the normalizer expands (1 disables expansion)
 * @param strategies equivalence strategies in cascade order
 */
public record AnalyzerSettings(int maxExpansionExponent, List<EquivalenceMethod> strategies) {

	public static final int MIN_EXPANSION_EXPONENT = 1;
	public static final int MAX_EXPANSION_EXPONENT = 6;

	public AnalyzerSettings {
		if (maxExpansionExponent < MIN_EXPANSION_EXPONENT || maxExpansionExponent > MAX_EXPANSION_EXPONENT) {
			throw new AnalyzerSettingsException("max_expansion_exponent must be between "
					+ MIN_EXPANSION_EXPONENT + " and " + MAX_EXPANSION_EXPONENT + ": " + maxExpansionExponent);
		}
		Objects.requireNonNull(strategies, "strategies must not be null");
		if (strategies.isEmpty()) {
			throw new AnalyzerSettingsException("strategies must name at least one equivalence strategy");
		}
		if (strategies.contains(EquivalenceMethod.ERROR)) {
			throw new AnalyzerSettingsException("strategies must not contain 'error'");
		}
		if (new LinkedHashSet<>(strategies).size() != strategies.size()) {
			throw new AnalyzerSettingsException("strategies must not repeat a strategy: " + strategies);
		}
		strategies = List.copyOf(strategies);
	}

	public static AnalyzerSettings defaults() {
		return new AnalyzerSettings(PolynomialNormalizer.DEFAULT_MAX_EXPANSION_EXPONENT, EquivalenceChecker.DEFAULT_CASCADE);
	}

	public AnalyzerSettings withMaxExpansionExponent(int exponent) {
		return new AnalyzerSettings(exponent, strategies);
	}

	public AnalyzerSettings withStrategies(List<EquivalenceMethod> methods) {
		return new AnalyzerSettings(maxExpansionExponent, methods);
	}
}
