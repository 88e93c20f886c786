package org.javai.exprcheck;

import java.util.List;
import java.util.Objects;
import org.javai.exprcheck.ast.CanonicalRenderer;
import org.javai.exprcheck.ast.Expression;
import org.javai.exprcheck.config.AnalyzerSettings;
import org.javai.exprcheck.config.AnalyzerSettingsLoader;
import org.javai.exprcheck.equiv.EquivalenceChecker;
import org.javai.exprcheck.equiv.EquivalenceMethod;
import org.javai.exprcheck.equiv.EquivalenceResult;
import org.javai.exprcheck.lex.Lexer;
import org.javai.exprcheck.lex.Token;
import org.javai.exprcheck.parse.ExpressionParser;
import org.javai.exprcheck.poly.Polynomial;
import org.javai.exprcheck.poly.PolynomialNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for programs embedding the analysis pipeline:
 * lexer, parser, polynomial normalizer and equivalence checker.
 *
 * <pre>
 * ExpressionAnalyzer analyzer = ExpressionAnalyzer.withDefaults();
 * analyzer.areEquivalent("1-1/x", "(x-1)/x");            // true
 * analyzer.normalize(analyzer.parse("(x+1)^2")).render(); // "1 + 2*x + x^2"
 * </pre>
 *
 * Instances are not thread-safe: all calls on one analyzer share a normalizer
 * and its atom table.
 */
public final class ExpressionAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(ExpressionAnalyzer.class);

	private final AnalyzerSettings settings;
	private final PolynomialNormalizer normalizer;
	private final EquivalenceChecker checker;

	private ExpressionAnalyzer(AnalyzerSettings settings) {
		this.settings = settings;
		this.normalizer = new PolynomialNormalizer(settings.maxExpansionExponent());
		this.checker = EquivalenceChecker.forMethods(normalizer, settings.strategies());
	}

	/**
	 * Analyzer configured from the bundled {@code META-INF/exprcheck-settings.yml}.
	 */
	public static ExpressionAnalyzer withDefaults() {
		return builder().settings(new AnalyzerSettingsLoader().loadDefaults()).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public AnalyzerSettings settings() {
		return settings;
	}

	/**
	 * @throws org.javai.exprcheck.lex.LexException on an invalid character, decimal point or identifier
	 */
	public List<Token> tokenize(String text) {
		return new Lexer(Objects.requireNonNull(text, "text must not be null")).tokenize();
	}

	/**
	 * @throws org.javai.exprcheck.lex.LexException if the text cannot be tokenized
	 * @throws org.javai.exprcheck.parse.ParseException if the tokens do not form an expression
	 */
	public Expression parse(String text) {
		Expression expression = new ExpressionParser(tokenize(text)).parse();
		if (logger.isDebugEnabled()) {
			logger.debug("Parsed '{}' as {}", text, CanonicalRenderer.render(expression));
		}
		return expression;
	}

	public Polynomial normalize(Expression expression) {
		return normalizer.normalize(expression);
	}

	public boolean areEquivalent(Expression first, Expression second) {
		return checker.areEquivalent(first, second);
	}

	public EquivalenceResult checkEquivalenceVerbose(Expression first, Expression second) {
		return checker.checkEquivalenceVerbose(first, second);
	}

	/**
	 * Parses both texts and checks them. Text that fails to tokenize or parse
	 * yields an {@code error} verdict naming the failing side.
	 */
	public EquivalenceResult checkEquivalenceVerbose(String first, String second) {
		if (first == null || second == null) {
			return EquivalenceResult.error("Both expressions are required");
		}
		Expression left;
		Expression right;
		try {
			left = parse(first);
		} catch (ExpressionException e) {
			return EquivalenceResult.error("First expression is invalid: " + e.getMessage());
		}
		try {
			right = parse(second);
		} catch (ExpressionException e) {
			return EquivalenceResult.error("Second expression is invalid: " + e.getMessage());
		}
		return checker.checkEquivalenceVerbose(left, right);
	}

	public boolean areEquivalent(String first, String second) {
		return checkEquivalenceVerbose(first, second).equivalent();
	}

	/**
	 * Runs tokenization, parsing and normalization on one expression.
	 *
	 * @throws ExpressionException if the text is not a valid expression
	 */
	public ExpressionAnalysis analyze(String text) {
		List<Token> tokens = tokenize(text);
		Expression expression = new ExpressionParser(tokens).parse();
		Polynomial polynomial = normalizer.normalize(expression);
		return new ExpressionAnalysis(text, tokens, expression, polynomial,
				PolynomialNormalizer.isExpandable(expression));
	}

	public static final class Builder {

		private AnalyzerSettings settings = AnalyzerSettings.defaults();

		private Builder() {
		}

		public Builder settings(AnalyzerSettings settings) {
			this.settings = Objects.requireNonNull(settings, "settings must not be null");
			return this;
		}

		public Builder maxExpansionExponent(int exponent) {
			this.settings = settings.withMaxExpansionExponent(exponent);
			return this;
		}

		public Builder strategies(List<EquivalenceMethod> methods) {
			this.settings = settings.withStrategies(methods);
			return this;
		}

		public ExpressionAnalyzer build() {
			return new ExpressionAnalyzer(settings);
		}
	}
}
